package com.example.socketrouter.shared.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Registry record for one live websocket connection. Instances are immutable;
 * the registry replaces them atomically per handle.
 */
@Value
@Builder(toBuilder = true)
@With
public class SocketConnection {
    String id;
    String handle;
    String userId;
    String sessionId;
    String path;
    boolean active;
    Instant lastPing;
    String userIp;
    Instant connectedAt;

    public boolean isAuthenticated() {
        return userId != null;
    }

    @Override
    public String toString() {
        // <SocketConnection alice@/table/1234 (inactive)>
        String owner = userId != null ? userId : "anon";
        return "<SocketConnection " + owner + "@" + path + (active ? "" : " (inactive)") + ">";
    }
}
