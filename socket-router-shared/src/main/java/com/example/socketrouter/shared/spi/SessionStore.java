package com.example.socketrouter.shared.spi;

import com.example.socketrouter.shared.dto.HandshakeRequest;

import java.util.Optional;

public interface SessionStore {

    Optional<String> lookupUser(String sessionId);

    Optional<String> sessionIdFor(HandshakeRequest request);
}
