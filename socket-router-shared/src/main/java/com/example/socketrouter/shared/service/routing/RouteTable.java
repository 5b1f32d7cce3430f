package com.example.socketrouter.shared.service.routing;

import com.example.socketrouter.shared.util.Constants.ActionType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered, immutable list of route patterns plus the default route.
 * <p>
 * Precedence is "most recently registered wins": {@link #select(String)} scans
 * from the last entry backwards and returns the first match. Entries appended
 * after the built-ins therefore override them.
 */
public final class RouteTable {

    private final List<RoutePattern> patterns;
    private final SocketHandler defaultHandler;

    private RouteTable(List<RoutePattern> patterns, SocketHandler defaultHandler) {
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
        this.defaultHandler = defaultHandler;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder preloaded with the {@code PING_RESPONSE} and {@code HELLO} routes
     * every websocket endpoint ships with.
     */
    public static Builder withBuiltins() {
        return new Builder()
                .route(ActionType.PING_RESPONSE.name(), "onPing", BuiltinHandlers::onPing)
                .route(ActionType.HELLO.name(), "onHello", BuiltinHandlers::onHello);
    }

    public Optional<RoutePattern> select(String actionType) {
        ListIterator<RoutePattern> reversed = patterns.listIterator(patterns.size());
        while (reversed.hasPrevious()) {
            RoutePattern candidate = reversed.previous();
            if (candidate.getMatcher().matches(actionType)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public List<RoutePattern> getPatterns() {
        return patterns;
    }

    public SocketHandler getDefaultHandler() {
        return defaultHandler;
    }

    public static final class Builder {
        private final List<RoutePattern> patterns = new ArrayList<>();
        private SocketHandler defaultHandler = BuiltinHandlers::onUnknownAction;

        private Builder() {
        }

        public Builder route(String actionType, SocketHandler handler) {
            return route(actionType, actionType, handler);
        }

        public Builder route(String actionType, String name, SocketHandler handler) {
            patterns.add(new RoutePattern(RouteMatcher.exact(actionType), handler, name));
            return this;
        }

        public Builder route(Pattern pattern, SocketHandler handler) {
            return route(pattern, "/" + pattern.pattern() + "/", handler);
        }

        public Builder route(Pattern pattern, String name, SocketHandler handler) {
            patterns.add(new RoutePattern(RouteMatcher.pattern(pattern), handler, name));
            return this;
        }

        /**
         * Appends every entry of {@code base}, keeping its order and default route.
         */
        public Builder extend(RouteTable base) {
            patterns.addAll(base.getPatterns());
            defaultHandler = base.getDefaultHandler();
            return this;
        }

        public Builder defaultRoute(SocketHandler handler) {
            this.defaultHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public RouteTable build() {
            return new RouteTable(patterns, defaultHandler);
        }
    }
}
