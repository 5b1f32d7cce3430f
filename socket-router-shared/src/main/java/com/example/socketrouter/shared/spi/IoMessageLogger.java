package com.example.socketrouter.shared.spi;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.model.SocketConnection;
import com.example.socketrouter.shared.service.group.ConnectionGroup;

/**
 * Sink for inbound/outbound message tracing, used for operational flow
 * debugging. Format is up to the implementation.
 */
public interface IoMessageLogger {

    /**
     * @param route   name of the route the message was dispatched to, null for the default route
     * @param unknown true when no route matched
     */
    void logInbound(SocketConnection connection, Envelope envelope, String route, boolean unknown);

    void logOutbound(SocketConnection connection, Envelope envelope);

    void logBroadcast(ConnectionGroup group, Envelope envelope);
}
