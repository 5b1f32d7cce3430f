package com.example.socketrouter.shared.service.lifecycle;

import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.config.MonitoringConfig.SocketMetricsCollector;
import com.example.socketrouter.shared.dto.DisconnectInfo;
import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.dto.HandshakeRequest;
import com.example.socketrouter.shared.dto.HandshakeResult;
import com.example.socketrouter.shared.exception.ConnectionLimitExceededException;
import com.example.socketrouter.shared.model.SocketConnection;
import com.example.socketrouter.shared.service.group.GroupAddressor;
import com.example.socketrouter.shared.service.registry.ConnectionRegistry;
import com.example.socketrouter.shared.service.routing.HandlerFaultListener;
import com.example.socketrouter.shared.service.routing.Router;
import com.example.socketrouter.shared.service.sweep.StaleSweeper;
import com.example.socketrouter.shared.spi.IoMessageLogger;
import com.example.socketrouter.shared.spi.SessionStore;
import com.example.socketrouter.shared.spi.Transport;
import com.example.socketrouter.shared.util.Constants;
import com.example.socketrouter.shared.util.Constants.ActionType;
import com.example.socketrouter.shared.util.Constants.MdcKeys;
import com.example.socketrouter.shared.util.EnvelopeCodec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connect, receive and disconnect orchestration for one {@link SocketEndpoint}.
 * Keeps the registry record of each connection in step with its transport,
 * routes inbound envelopes, and contains handler faults.
 */
@Slf4j
public class ConnectionLifecycle implements HandlerFaultListener {

    private final Map<String, SocketContext> contexts = new ConcurrentHashMap<>();

    @Getter
    private final SocketEndpoint endpoint;
    private final Router router;
    private final ConnectionRegistry connectionRegistry;
    private final GroupAddressor groupAddressor;
    private final StaleSweeper staleSweeper;
    private final Transport transport;
    private final SessionStore sessionStore;
    private final EnvelopeCodec envelopeCodec;
    private final IoMessageLogger ioMessageLogger;
    private final SocketMetricsCollector metricsCollector;
    private final AppProperties appProperties;
    private final Clock clock;

    public ConnectionLifecycle(SocketEndpoint endpoint,
                               ConnectionRegistry connectionRegistry,
                               GroupAddressor groupAddressor,
                               StaleSweeper staleSweeper,
                               Transport transport,
                               SessionStore sessionStore,
                               EnvelopeCodec envelopeCodec,
                               IoMessageLogger ioMessageLogger,
                               SocketMetricsCollector metricsCollector,
                               AppProperties appProperties,
                               Clock clock) {
        this.endpoint = endpoint;
        this.connectionRegistry = connectionRegistry;
        this.groupAddressor = groupAddressor;
        this.staleSweeper = staleSweeper;
        this.transport = transport;
        this.sessionStore = sessionStore;
        this.envelopeCodec = envelopeCodec;
        this.ioMessageLogger = ioMessageLogger;
        this.metricsCollector = metricsCollector;
        this.appProperties = appProperties;
        this.clock = clock;
        this.router = new Router(endpoint.getRouteTable(), routingKey(), ioMessageLogger, this);
    }

    /**
     * Registers the connection and completes the transport handshake. Rejected
     * handshakes leave no record behind.
     */
    public HandshakeResult onConnect(HandshakeRequest request) {
        String handle = request.getHandle();
        if (handle == null || handle.isBlank()) {
            log.warn("Rejected websocket handshake on {} without a transport handle", request.getPath());
            return HandshakeResult.REJECTED;
        }

        String userIp = resolveClientIp(request);
        String sessionId = sessionStore.sessionIdFor(request).orElse(null);
        SocketContext context = new SocketContext(this, handle, request.getPath(), sessionId, userIp);

        SocketConnection connection;
        try {
            connection = context.refreshSession().orElseThrow();
        } catch (ConnectionLimitExceededException e) {
            log.warn("Rejected websocket on {} from {}: {}", request.getPath(), userIp, e.getMessage());
            return HandshakeResult.REJECTED;
        }
        contexts.put(handle, context);

        transport.acceptHandshake(handle);
        log.info("[CONNECT] {} handle={} endpoint={} ip={}", connection, handle, endpoint.getName(), userIp);

        if (endpoint.getConnectHook() != null) {
            try {
                endpoint.getConnectHook().onConnect(context);
            } catch (Exception e) {
                onHandlerFault(context, Envelope.empty(), e);
            }
        }
        return HandshakeResult.ACCEPTED;
    }

    /**
     * Parses and routes one inbound text frame.
     *
     * @throws com.example.socketrouter.shared.exception.ProtocolViolationException when the frame is not a JSON object
     * @throws IllegalStateException when {@code handle} has no live connection on this endpoint
     */
    public void onReceive(String handle, String rawText) {
        SocketContext context = contexts.get(handle);
        if (context == null) {
            throw new IllegalStateException("No live websocket connection for handle " + handle);
        }
        Envelope envelope = envelopeCodec.decode(rawText);
        context.markInbound();

        if (endpoint.isLoginRequired() && context.userId().isEmpty()) {
            // happens when the session store was wiped while the socket stayed open
            context.sendAction(ActionType.RECONNECT.name(), Map.of(
                    "details", "No session was attached to socket, the frontend should try reconnecting."));
            return;
        }
        router.dispatch(context, envelope);
    }

    /**
     * Idempotent: a second disconnect for the same handle is ignored.
     */
    public void onDisconnect(DisconnectInfo info) {
        SocketContext context = contexts.remove(info.getHandle());
        if (context == null) {
            log.debug("Ignoring disconnect for unknown or already removed handle {}", info.getHandle());
            return;
        }

        Optional<SocketConnection> lastSeen = connectionRegistry.find(info.getHandle());
        try {
            lastSeen = context.refreshSession();
        } catch (RuntimeException e) {
            log.warn("Could not refresh session of {} on disconnect: {}", info.getHandle(), e.getMessage());
        }
        context.close();
        connectionRegistry.remove(info.getHandle());
        SocketConnection connection = lastSeen.orElse(null);

        if (endpoint.getDisconnectHook() != null) {
            try {
                endpoint.getDisconnectHook().onDisconnect(context, info);
            } catch (Exception e) {
                log.error("Disconnect hook of endpoint {} failed for {}", endpoint.getName(), connection, e);
            }
        }

        if (info.getCode() == Constants.ABNORMAL_CLOSE_CODE) {
            reportAbnormalClose(context, info, connection);
        }
        log.info("[DISCONNECT] {} handle={} code={}", connection, info.getHandle(), info.getCode());
    }

    @Override
    public void onHandlerFault(SocketContext context, Envelope envelope, Exception fault) {
        Optional<SocketConnection> connection = Optional.empty();
        try {
            connection = context.refreshSession();
        } catch (RuntimeException e) {
            log.warn("Could not refresh session of {} while reporting a handler fault: {}", context.handle(), e.getMessage());
        }

        if (appProperties.isDiagnosticMode()) {
            String stackTrace = stackTraceOf(fault);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("success", false);
            payload.put("errors", List.of(fault.toString()));
            payload.put("details", stackTrace);
            try {
                context.sendAction(ActionType.ERROR.name(), payload);
            } catch (RuntimeException e) {
                log.warn("Could not send fault details to {}: {}", context.handle(), e.getMessage());
            }
        }

        putUserMdc(context, connection.orElse(null));
        try {
            log.error("Websocket handler failed on endpoint {} for message {}", endpoint.getName(), envelope, fault);
        } finally {
            clearUserMdc();
        }
        metricsCollector.incrementCounter("socket.errors", "type", "handler");
    }

    private void reportAbnormalClose(SocketContext context, DisconnectInfo info, SocketConnection connection) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("code", info.getCode());
        details.put("reason", info.getReason());
        details.put("path", context.path());
        details.put("endpoint", endpoint.getName());
        details.put("order", context.inboundCount());
        details.put("handle", info.getHandle());
        details.put("last_ping", connection != null ? connection.getLastPing() : null);
        details.put("user_id", connection != null ? connection.getUserId() : null);
        details.put("user_ip", context.userIp());

        if (appProperties.isDiagnosticMode()) {
            log.warn("[!] Closed websocket due to overloaded server! {}", details);
        } else if (connection != null && connection.isAuthenticated()) {
            // dropping sockets of logged-in users is much worse than dropping spectators
            log.error("Closed websocket due to overloaded server. {}", details);
        } else {
            log.debug("Closed websocket due to overloaded server. {}", details);
        }
    }

    private static void putUserMdc(SocketContext context, SocketConnection connection) {
        MDC.put(MdcKeys.PATH, context.path());
        MDC.put(MdcKeys.USER_IP, context.userIp());
        MDC.put(MdcKeys.SESSION_ID, context.sessionId());
        if (connection != null) {
            MDC.put(MdcKeys.CONNECTION_ID, connection.getId());
            MDC.put(MdcKeys.USER_ID, connection.getUserId());
        }
    }

    private static void clearUserMdc() {
        MDC.remove(MdcKeys.PATH);
        MDC.remove(MdcKeys.USER_IP);
        MDC.remove(MdcKeys.SESSION_ID);
        MDC.remove(MdcKeys.CONNECTION_ID);
        MDC.remove(MdcKeys.USER_ID);
    }

    private String resolveClientIp(HandshakeRequest request) {
        String forwarded = request.header(appProperties.getConnection().getRealIpHeader());
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getPeerAddress();
    }

    private static String stackTraceOf(Throwable fault) {
        StringWriter writer = new StringWriter();
        fault.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    public int liveConnectionCount() {
        return contexts.size();
    }

    public Optional<SocketContext> context(String handle) {
        return Optional.ofNullable(contexts.get(handle));
    }

    Optional<String> resolveUser(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return sessionStore.lookupUser(sessionId);
    }

    String routingKey() {
        return appProperties.getRouting().getRoutingKey();
    }

    ConnectionRegistry registry() {
        return connectionRegistry;
    }

    GroupAddressor groupAddressor() {
        return groupAddressor;
    }

    StaleSweeper staleSweeper() {
        return staleSweeper;
    }

    Transport transport() {
        return transport;
    }

    EnvelopeCodec envelopeCodec() {
        return envelopeCodec;
    }

    IoMessageLogger ioMessageLogger() {
        return ioMessageLogger;
    }

    Clock clock() {
        return clock;
    }
}
