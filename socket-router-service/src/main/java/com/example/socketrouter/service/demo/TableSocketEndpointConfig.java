package com.example.socketrouter.service.demo;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.service.lifecycle.SocketContext;
import com.example.socketrouter.shared.service.lifecycle.SocketEndpoint;
import com.example.socketrouter.shared.service.routing.RouteTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sample game-table endpoint. Spectators may connect without logging in.
 */
@Configuration
@Slf4j
public class TableSocketEndpointConfig {

    public static final String PATH_PATTERN = "/ws/table/**";

    @Bean
    public SocketEndpoint tableSocketEndpoint() {
        RouteTable routes = RouteTable.withBuiltins()
                .route("UPDATE_USER", TableSocketEndpointConfig::onUpdateUser)
                .route(Pattern.compile("HELLO.*"), "onTableHello", TableSocketEndpointConfig::onHello)
                .defaultRoute(TableSocketEndpointConfig::onUnknownMessage)
                .build();

        return SocketEndpoint.builder()
                .name("table")
                .pathPattern(PATH_PATTERN)
                .routeTable(routes)
                .loginRequired(false)
                .connectHook(context -> context.send(Envelope.of(Map.of("connected", true))))
                .disconnectHook((context, info) ->
                        context.broadcastAction("CHAT", Map.of("recvd_message", "spectator disconnected")))
                .build();
    }

    static void onUpdateUser(SocketContext context, Envelope envelope) {
        Map<String, Object> payload = new LinkedHashMap<>(envelope.asMap());
        payload.remove(context.routingKey());
        payload.put("user_id", context.userId().orElse(null));
        context.broadcastAction("USER_UPDATED", payload);
    }

    /**
     * Overrides the built-in HELLO for this endpoint, still confirming the
     * caller's other tabs on the table.
     */
    static void onHello(SocketContext context, Envelope envelope) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("received_hello", envelope.asMap());
        payload.put("on_channel_name", context.handle());
        context.send(Envelope.of(payload));
        context.cleanupStale();
    }

    static void onUnknownMessage(SocketContext context, Envelope envelope) {
        context.sendAction("ERROR", Map.of("details", "Got unknown message: " + envelope));
    }
}
