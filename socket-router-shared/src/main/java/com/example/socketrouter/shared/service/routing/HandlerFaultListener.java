package com.example.socketrouter.shared.service.routing;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.service.lifecycle.SocketContext;

/**
 * Receives every exception a route handler throws. The router never rethrows them.
 */
@FunctionalInterface
public interface HandlerFaultListener {

    void onHandlerFault(SocketContext context, Envelope envelope, Exception fault);
}
