package com.example.socketrouter.shared.service.lifecycle;

import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.config.MonitoringConfig.SocketMetricsCollector;
import com.example.socketrouter.shared.service.group.GroupAddressor;
import com.example.socketrouter.shared.service.registry.ConnectionRegistry;
import com.example.socketrouter.shared.service.sweep.StaleSweeper;
import com.example.socketrouter.shared.spi.IoMessageLogger;
import com.example.socketrouter.shared.spi.SessionStore;
import com.example.socketrouter.shared.spi.Transport;
import com.example.socketrouter.shared.util.EnvelopeCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Wires one {@link ConnectionLifecycle} per endpoint against the shared registry and transport.
 */
@Component
@RequiredArgsConstructor
public class ConnectionLifecycleFactory {

    private final ConnectionRegistry connectionRegistry;
    private final GroupAddressor groupAddressor;
    private final StaleSweeper staleSweeper;
    private final Transport transport;
    private final SessionStore sessionStore;
    private final EnvelopeCodec envelopeCodec;
    private final IoMessageLogger ioMessageLogger;
    private final SocketMetricsCollector metricsCollector;
    private final AppProperties appProperties;
    private final Clock clock;

    public ConnectionLifecycle create(SocketEndpoint endpoint) {
        return new ConnectionLifecycle(endpoint, connectionRegistry, groupAddressor, staleSweeper, transport,
                sessionStore, envelopeCodec, ioMessageLogger, metricsCollector, appProperties, clock);
    }
}
