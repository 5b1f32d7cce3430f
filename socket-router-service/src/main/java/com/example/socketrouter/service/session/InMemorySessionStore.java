package com.example.socketrouter.service.session;

import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.dto.HandshakeRequest;
import com.example.socketrouter.shared.spi.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session id to user id map for a single node. The session cookie name comes
 * from {@code socket-router.connection.session-cookie}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InMemorySessionStore implements SessionStore {

    private final Map<String, String> usersBySession = new ConcurrentHashMap<>();

    private final AppProperties appProperties;

    public void register(String sessionId, String userId) {
        usersBySession.put(sessionId, userId);
        log.debug("Attached user {} to session {}", userId, sessionId);
    }

    public void invalidate(String sessionId) {
        if (usersBySession.remove(sessionId) != null) {
            log.debug("Invalidated session {}", sessionId);
        }
    }

    @Override
    public Optional<String> lookupUser(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(usersBySession.get(sessionId));
    }

    @Override
    public Optional<String> sessionIdFor(HandshakeRequest request) {
        String sessionId = request.getCookies().get(appProperties.getConnection().getSessionCookie());
        return sessionId == null || sessionId.isBlank() ? Optional.empty() : Optional.of(sessionId);
    }
}
