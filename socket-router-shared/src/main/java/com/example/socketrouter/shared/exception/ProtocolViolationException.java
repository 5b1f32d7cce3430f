package com.example.socketrouter.shared.exception;

/**
 * Raised when an inbound frame is not a JSON object. Fatal to the single
 * receive call that triggered it, never to the connection.
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
