package com.example.socketrouter.shared.service.routing;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.service.lifecycle.SocketContext;

@FunctionalInterface
public interface SocketHandler {

    void handle(SocketContext context, Envelope envelope) throws Exception;
}
