package com.example.socketrouter.shared.service.lifecycle;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.dto.SweepReport;
import com.example.socketrouter.shared.model.SocketConnection;
import com.example.socketrouter.shared.service.registry.ConnectionRefresh;
import com.example.socketrouter.shared.service.registry.ConnectionScope;
import com.example.socketrouter.shared.util.Constants;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handler-facing view of one live connection. Created by
 * {@link ConnectionLifecycle} on connect and closed on disconnect; after that
 * session refreshes are skipped so a late send cannot resurrect the record.
 */
public class SocketContext {

    private final ConnectionLifecycle lifecycle;
    private final String handle;
    private final String path;
    private final String sessionId;
    private final String userIp;
    private final AtomicLong inboundCount = new AtomicLong();
    private volatile boolean closed;

    SocketContext(ConnectionLifecycle lifecycle, String handle, String path, String sessionId, String userIp) {
        this.lifecycle = lifecycle;
        this.handle = handle;
        this.path = path;
        this.sessionId = sessionId;
        this.userIp = userIp;
    }

    public String handle() {
        return handle;
    }

    public String path() {
        return path;
    }

    public String sessionId() {
        return sessionId;
    }

    public String userIp() {
        return userIp;
    }

    public String routingKey() {
        return lifecycle.routingKey();
    }

    public SocketEndpoint endpoint() {
        return lifecycle.getEndpoint();
    }

    /**
     * The user currently attached to this connection's session, looked up on every call.
     */
    public Optional<String> userId() {
        return lifecycle.resolveUser(sessionId);
    }

    public Optional<SocketConnection> connection() {
        return lifecycle.registry().find(handle);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Writes the current session state to the registry, creating the record if a
     * sweep removed it, and marks the connection active with a fresh ping time.
     */
    public Optional<SocketConnection> refreshSession() {
        if (closed) {
            return connection();
        }
        ConnectionRefresh refresh = ConnectionRefresh.builder()
                .handle(handle)
                .userId(userId().orElse(null))
                .sessionId(sessionId)
                .path(path)
                .userIp(userIp)
                .timestamp(lifecycle.clock().instant())
                .build();
        return Optional.of(lifecycle.registry().upsert(refresh));
    }

    public boolean send(Envelope envelope) {
        Optional<SocketConnection> connection = refreshSession();
        Envelope stamped = envelope.with(Constants.TIMESTAMP_KEY, lifecycle.clock().millis());
        lifecycle.ioMessageLogger().logOutbound(connection.orElse(null), stamped);
        return sendRaw(lifecycle.envelopeCodec().encode(stamped));
    }

    public boolean sendAction(String actionType, Map<String, ?> payload) {
        return send(Envelope.action(routingKey(), actionType, payload));
    }

    /**
     * Delivers an already serialized frame. Bot handles are not addressable, so
     * this silently does nothing for them.
     */
    public boolean sendRaw(String text) {
        if (!lifecycle.groupAddressor().isAddressable(handle)) {
            return false;
        }
        return lifecycle.transport().send(handle, text);
    }

    /**
     * Sends to every connection on this context's path, this one included if still registered.
     */
    public int broadcastAction(String actionType, Map<String, ?> payload) {
        return lifecycle.groupAddressor()
                .fromScope(ConnectionScope.forPath(path))
                .broadcastAction(actionType, payload);
    }

    /**
     * Pings the owner's other connections on this path so ghost tabs get
     * confirmed or purged. Anonymous connections never trigger a sweep: it
     * would ping every anonymous socket on the page.
     */
    public SweepReport cleanupStale() {
        Optional<String> userId = userId();
        Optional<SocketConnection> connection = connection();
        if (userId.isEmpty() || connection.isEmpty()) {
            return new SweepReport(0, 0);
        }
        ConnectionScope related = ConnectionScope.forUserAndPath(userId.get(), path)
                .excluding(connection.get().getId());
        return lifecycle.staleSweeper().cleanupStale(related);
    }

    long markInbound() {
        return inboundCount.incrementAndGet();
    }

    long inboundCount() {
        return inboundCount.get();
    }

    void close() {
        closed = true;
    }
}
