package com.example.socketrouter.shared.service.registry;

import com.example.socketrouter.shared.aspect.Monitored;
import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.exception.ConnectionLimitExceededException;
import com.example.socketrouter.shared.model.SocketConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("registry")
public class InMemoryConnectionRegistry implements ConnectionRegistry {

    private final Map<String, SocketConnection> connectionsByHandle = new ConcurrentHashMap<>();
    // one entry per limited user with records; computing on it serializes that user's registrations
    private final Map<String, Boolean> registeringUsers = new ConcurrentHashMap<>();

    private final AppProperties appProperties;

    @Override
    public SocketConnection upsert(ConnectionRefresh refresh) {
        Objects.requireNonNull(refresh.getHandle(), "handle");
        Objects.requireNonNull(refresh.getTimestamp(), "timestamp");
        String userId = refresh.getUserId();
        if (userId == null || appProperties.getConnection().getMaxConnectionsPerUser() <= 0) {
            return apply(refresh);
        }
        AtomicReference<SocketConnection> applied = new AtomicReference<>();
        registeringUsers.compute(userId, (user, marker) -> {
            applied.set(apply(refresh));
            return Boolean.TRUE;
        });
        return applied.get();
    }

    private SocketConnection apply(ConnectionRefresh refresh) {
        return connectionsByHandle.compute(refresh.getHandle(), (handle, existing) -> {
            if (existing == null) {
                checkLimit(refresh.getUserId());
                SocketConnection created = SocketConnection.builder()
                        .id(UUID.randomUUID().toString())
                        .handle(handle)
                        .userId(refresh.getUserId())
                        .sessionId(refresh.getSessionId())
                        .path(refresh.getPath())
                        .active(true)
                        .lastPing(refresh.getTimestamp())
                        .userIp(refresh.getUserIp())
                        .connectedAt(refresh.getTimestamp())
                        .build();
                log.debug("Registered connection {} for handle {}", created.getId(), handle);
                return created;
            }
            return existing.toBuilder()
                    .userId(refresh.getUserId())
                    .sessionId(refresh.getSessionId() != null ? refresh.getSessionId() : existing.getSessionId())
                    .path(refresh.getPath())
                    .active(true)
                    .lastPing(refresh.getTimestamp())
                    .userIp(refresh.getUserIp() != null ? refresh.getUserIp() : existing.getUserIp())
                    .build();
        });
    }

    private void checkLimit(String userId) {
        int limit = appProperties.getConnection().getMaxConnectionsPerUser();
        if (limit <= 0 || userId == null) {
            return;
        }
        long current = connectionsByHandle.values().stream()
                .filter(c -> userId.equals(c.getUserId()))
                .count();
        if (current >= limit) {
            log.warn("Connection limit reached for user '{}'. Registration refused.", userId);
            throw new ConnectionLimitExceededException(userId, limit);
        }
    }

    @Override
    public Optional<SocketConnection> find(String handle) {
        return Optional.ofNullable(connectionsByHandle.get(handle));
    }

    @Override
    public Optional<SocketConnection> remove(String handle) {
        Optional<SocketConnection> removed = Optional.ofNullable(connectionsByHandle.remove(handle));
        removed.ifPresent(this::releaseUser);
        return removed;
    }

    private void releaseUser(SocketConnection removed) {
        if (removed.getUserId() == null) {
            return;
        }
        registeringUsers.computeIfPresent(removed.getUserId(), (user, marker) ->
                connectionsByHandle.values().stream().anyMatch(c -> user.equals(c.getUserId())) ? marker : null);
    }

    @Override
    public List<SocketConnection> findAll(ConnectionScope scope) {
        return connectionsByHandle.values().stream()
                .filter(scope::matches)
                .collect(Collectors.toList());
    }

    @Override
    public List<SocketConnection> markInactive(ConnectionScope scope) {
        ConnectionScope activeInScope = scope.onlyActive();
        List<SocketConnection> flipped = new ArrayList<>();
        for (SocketConnection candidate : findAll(activeInScope)) {
            connectionsByHandle.computeIfPresent(candidate.getHandle(), (handle, current) -> {
                if (!activeInScope.matches(current)) {
                    return current;
                }
                SocketConnection pending = current.withActive(false);
                flipped.add(pending);
                return pending;
            });
        }
        return flipped;
    }

    @Override
    public List<SocketConnection> removeInactiveBefore(ConnectionScope scope, Instant threshold) {
        ConnectionScope inactiveInScope = scope.toBuilder().active(Boolean.FALSE).build();
        List<SocketConnection> removed = new ArrayList<>();
        for (SocketConnection candidate : findAll(inactiveInScope)) {
            connectionsByHandle.computeIfPresent(candidate.getHandle(), (handle, current) -> {
                boolean stale = inactiveInScope.matches(current)
                        && current.getLastPing() != null
                        && current.getLastPing().isBefore(threshold);
                if (!stale) {
                    return current;
                }
                removed.add(current);
                return null;
            });
        }
        removed.forEach(this::releaseUser);
        return removed;
    }

    @Override
    public int size() {
        return connectionsByHandle.size();
    }

    @Override
    public long countUsers() {
        return connectionsByHandle.values().stream()
                .map(SocketConnection::getUserId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
    }
}
