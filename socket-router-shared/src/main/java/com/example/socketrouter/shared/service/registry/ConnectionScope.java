package com.example.socketrouter.shared.service.registry;

import com.example.socketrouter.shared.model.SocketConnection;
import lombok.Builder;
import lombok.Value;

/**
 * Filter over registry records. Unset fields match everything.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionScope {

    private static final ConnectionScope ALL = ConnectionScope.builder().build();

    String userId;
    String path;
    Boolean active;
    String excludeConnectionId;

    public static ConnectionScope all() {
        return ALL;
    }

    public static ConnectionScope forPath(String path) {
        return ConnectionScope.builder().path(path).build();
    }

    public static ConnectionScope forUserAndPath(String userId, String path) {
        return ConnectionScope.builder().userId(userId).path(path).build();
    }

    public ConnectionScope excluding(String connectionId) {
        return toBuilder().excludeConnectionId(connectionId).build();
    }

    public ConnectionScope onlyActive() {
        return toBuilder().active(Boolean.TRUE).build();
    }

    public boolean matches(SocketConnection connection) {
        if (userId != null && !userId.equals(connection.getUserId())) {
            return false;
        }
        if (path != null && !path.equals(connection.getPath())) {
            return false;
        }
        if (active != null && active != connection.isActive()) {
            return false;
        }
        return excludeConnectionId == null || !excludeConnectionId.equals(connection.getId());
    }
}
