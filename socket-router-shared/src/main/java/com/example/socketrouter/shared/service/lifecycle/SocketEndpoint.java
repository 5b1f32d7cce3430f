package com.example.socketrouter.shared.service.lifecycle;

import com.example.socketrouter.shared.service.routing.RouteTable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Declarative description of one websocket endpoint: where it is mounted,
 * how its messages are routed and which hooks run around connect and disconnect.
 */
@Value
@Builder
public class SocketEndpoint {
    @NonNull
    String name;
    @NonNull
    String pathPattern;
    @NonNull
    RouteTable routeTable;
    boolean loginRequired;
    ConnectHook connectHook;
    DisconnectHook disconnectHook;
}
