package com.example.socketrouter.shared.exception;

import lombok.Getter;

@Getter
public class ConnectionLimitExceededException extends RuntimeException {

    private final String userId;
    private final int limit;

    public ConnectionLimitExceededException(String userId, int limit) {
        super("Connection limit of " + limit + " reached for user " + userId);
        this.userId = userId;
        this.limit = limit;
    }
}
