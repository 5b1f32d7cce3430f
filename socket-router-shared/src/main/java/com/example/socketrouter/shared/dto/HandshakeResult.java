package com.example.socketrouter.shared.dto;

public enum HandshakeResult {
    ACCEPTED,
    REJECTED
}
