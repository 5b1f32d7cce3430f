package com.example.socketrouter.shared.service.routing;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.exception.ProtocolViolationException;
import com.example.socketrouter.shared.service.lifecycle.SocketContext;
import com.example.socketrouter.shared.spi.IoMessageLogger;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Selects and runs the handler for one inbound envelope.
 * <p>
 * Envelopes without a routing key, and envelopes no pattern matches, go to the
 * table's default route. Handler exceptions are reported to the
 * {@link HandlerFaultListener} and never escape {@link #dispatch}.
 */
@Slf4j
public class Router {

    private final RouteTable routeTable;
    private final String routingKey;
    private final IoMessageLogger ioMessageLogger;
    private final HandlerFaultListener faultListener;

    public Router(RouteTable routeTable, String routingKey, IoMessageLogger ioMessageLogger, HandlerFaultListener faultListener) {
        this.routeTable = Objects.requireNonNull(routeTable, "routeTable");
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey");
        this.ioMessageLogger = Objects.requireNonNull(ioMessageLogger, "ioMessageLogger");
        this.faultListener = Objects.requireNonNull(faultListener, "faultListener");
    }

    public void dispatch(SocketContext context, Envelope envelope) {
        if (envelope == null) {
            throw new ProtocolViolationException("Expected websocket message to be a key-value mapping, but got null");
        }

        Optional<RoutePattern> route = envelope.actionType(routingKey).flatMap(routeTable::select);

        SocketHandler handler;
        if (route.isPresent()) {
            ioMessageLogger.logInbound(context.connection().orElse(null), envelope, route.get().getName(), false);
            handler = route.get().getHandler();
        } else {
            ioMessageLogger.logInbound(context.connection().orElse(null), envelope, null, true);
            handler = routeTable.getDefaultHandler();
        }

        try {
            handler.handle(context, envelope);
        } catch (Exception e) {
            faultListener.onHandlerFault(context, envelope, e);
        }
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }
}
