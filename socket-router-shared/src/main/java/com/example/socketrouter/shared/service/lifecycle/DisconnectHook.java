package com.example.socketrouter.shared.service.lifecycle;

import com.example.socketrouter.shared.dto.DisconnectInfo;

/**
 * Runs after the connection's registry record is deleted.
 */
@FunctionalInterface
public interface DisconnectHook {

    void onDisconnect(SocketContext context, DisconnectInfo info) throws Exception;
}
