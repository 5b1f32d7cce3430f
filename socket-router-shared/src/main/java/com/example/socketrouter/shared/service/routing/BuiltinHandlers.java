package com.example.socketrouter.shared.service.routing;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.model.SocketConnection;
import com.example.socketrouter.shared.service.lifecycle.SocketContext;
import com.example.socketrouter.shared.util.Constants.ActionType;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handlers every endpoint gets through {@link RouteTable#withBuiltins()} and the
 * default route of a fresh {@link RouteTable.Builder}.
 */
@Slf4j
public final class BuiltinHandlers {

    private BuiltinHandlers() {}

    /**
     * Answers the initial HELLO with the connection's details, then asks the
     * user's other sockets on the same path to confirm they are still alive.
     */
    public static void onHello(SocketContext context, Envelope envelope) {
        SocketConnection connection = context.refreshSession().orElse(null);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", context.userId().orElse(null));
        payload.put("connection_id", connection != null ? connection.getId() : null);
        payload.put("path", context.path());
        payload.put("last_ping", connection != null ? connection.getLastPing() : null);
        payload.put("user_ip", context.userIp());
        context.sendAction(ActionType.GOT_HELLO.name(), payload);

        context.cleanupStale();
    }

    /**
     * The refresh itself confirms liveness, nothing is sent back.
     */
    public static void onPing(SocketContext context, Envelope envelope) {
        context.refreshSession();
    }

    public static void onUnknownAction(SocketContext context, Envelope envelope) {
        String actionType = envelope.actionType(context.routingKey()).orElse(null);
        context.sendAction(ActionType.ERROR.name(), Map.of("details", "Unknown action: " + actionType));
        log.error("Unrecognized websocket msg: {}", envelope);
    }
}
