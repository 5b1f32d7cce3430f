package com.example.socketrouter.shared.service.group;

import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.config.MonitoringConfig.SocketMetricsCollector;
import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.model.SocketConnection;
import com.example.socketrouter.shared.service.registry.ConnectionRegistry;
import com.example.socketrouter.shared.service.registry.ConnectionScope;
import com.example.socketrouter.shared.spi.IoMessageLogger;
import com.example.socketrouter.shared.spi.Transport;
import com.example.socketrouter.shared.util.Constants;
import com.example.socketrouter.shared.util.EnvelopeCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class GroupAddressor {

    private final Transport transport;
    private final ConnectionRegistry connectionRegistry;
    private final EnvelopeCodec envelopeCodec;
    private final IoMessageLogger ioMessageLogger;
    private final SocketMetricsCollector metricsCollector;
    private final AppProperties appProperties;
    private final Clock clock;

    public ConnectionGroup fromConnections(Collection<SocketConnection> connections) {
        if (connections == null || connections.isEmpty()) {
            return ConnectionGroup.EMPTY;
        }
        // sorted so the id does not depend on query order
        String combinedHandles = connections.stream()
                .map(SocketConnection::getHandle)
                .sorted()
                .collect(Collectors.joining("\n"));
        String groupId = DigestUtils.md5DigestAsHex(combinedHandles.getBytes(StandardCharsets.UTF_8));

        List<SocketConnection> addressable = connections.stream()
                .filter(connection -> isAddressable(connection.getHandle()))
                .collect(Collectors.toList());
        return new ConnectionGroup(groupId, addressable, this);
    }

    /**
     * Snapshot of the registry at call time; membership may change before delivery.
     */
    public ConnectionGroup fromScope(ConnectionScope scope) {
        return fromConnections(connectionRegistry.findAll(scope));
    }

    public boolean isAddressable(String handle) {
        return handle != null && !handle.startsWith(appProperties.getConnection().getBotHandlePrefix());
    }

    Envelope action(String actionType, Map<String, ?> payload) {
        return Envelope.action(appProperties.getRouting().getRoutingKey(), actionType, payload);
    }

    int deliver(ConnectionGroup group, Envelope envelope) {
        Envelope stamped = envelope.with(Constants.TIMESTAMP_KEY, clock.millis());
        ioMessageLogger.logBroadcast(group, stamped);
        return deliverRaw(group, envelopeCodec.encode(stamped));
    }

    int deliverRaw(ConnectionGroup group, String text) {
        int delivered = 0;
        for (SocketConnection member : group.getMembers()) {
            try {
                if (transport.send(member.getHandle(), text)) {
                    delivered++;
                } else {
                    log.warn("Skipped delivery to {} in group {}: transport refused the frame", member.getHandle(), group.getId());
                    metricsCollector.incrementCounter("socket.messages.delivered", "status", "failed");
                }
            } catch (RuntimeException e) {
                log.warn("Skipped delivery to {} in group {}: {}", member.getHandle(), group.getId(), e.getMessage());
                metricsCollector.incrementCounter("socket.messages.delivered", "status", "failed");
            }
        }
        if (delivered > 0) {
            metricsCollector.incrementCounter("socket.messages.delivered", delivered, "status", "success");
        }
        return delivered;
    }
}
