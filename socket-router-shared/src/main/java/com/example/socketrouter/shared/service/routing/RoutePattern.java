package com.example.socketrouter.shared.service.routing;

import lombok.NonNull;
import lombok.Value;

@Value
public class RoutePattern {
    @NonNull
    RouteMatcher matcher;
    @NonNull
    SocketHandler handler;
    @NonNull
    String name;
}
