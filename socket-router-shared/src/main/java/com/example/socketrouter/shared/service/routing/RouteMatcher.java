package com.example.socketrouter.shared.service.routing;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Matches an action type either by exact string equality or by a full match
 * against a compiled pattern.
 */
public final class RouteMatcher {

    private final String exact;
    private final Pattern pattern;

    private RouteMatcher(String exact, Pattern pattern) {
        this.exact = exact;
        this.pattern = pattern;
    }

    public static RouteMatcher exact(String actionType) {
        return new RouteMatcher(Objects.requireNonNull(actionType, "actionType"), null);
    }

    public static RouteMatcher pattern(Pattern pattern) {
        return new RouteMatcher(null, Objects.requireNonNull(pattern, "pattern"));
    }

    public boolean matches(String actionType) {
        if (actionType == null) {
            return false;
        }
        if (pattern != null) {
            return pattern.matcher(actionType).matches();
        }
        return exact.equals(actionType);
    }

    @Override
    public String toString() {
        return pattern != null ? "/" + pattern.pattern() + "/" : exact;
    }
}
