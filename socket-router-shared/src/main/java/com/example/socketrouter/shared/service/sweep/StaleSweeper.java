package com.example.socketrouter.shared.service.sweep;

import com.example.socketrouter.shared.aspect.Monitored;
import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.config.MonitoringConfig.SocketMetricsCollector;
import com.example.socketrouter.shared.dto.SweepReport;
import com.example.socketrouter.shared.model.SocketConnection;
import com.example.socketrouter.shared.service.group.GroupAddressor;
import com.example.socketrouter.shared.service.registry.ConnectionRegistry;
import com.example.socketrouter.shared.service.registry.ConnectionScope;
import com.example.socketrouter.shared.util.Constants.ActionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Two-phase liveness sweep. {@link #cleanupStale} marks connections pending and
 * pings them; any reply or outbound send refreshes them back to active.
 * {@link #purgeInactive} deletes those still pending after the grace window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("sweeper")
public class StaleSweeper {

    private final ConnectionRegistry connectionRegistry;
    private final GroupAddressor groupAddressor;
    private final SocketMetricsCollector metricsCollector;
    private final AppProperties appProperties;
    private final Clock clock;

    public SweepReport cleanupStale(ConnectionScope scope) {
        List<SocketConnection> flipped = connectionRegistry.markInactive(scope);
        int pinged = groupAddressor.fromConnections(flipped).broadcastAction(ActionType.PING.name(), Map.of());
        int purged = purgeInactive(scope, appProperties.getSweep().getGraceWindow());

        if (!flipped.isEmpty() || purged > 0) {
            log.debug("Stale sweep over {}: {} marked pending, {} pinged, {} purged", scope, flipped.size(), pinged, purged);
        }
        return new SweepReport(pinged, purged);
    }

    public int purgeInactive() {
        return purgeInactive(appProperties.getSweep().getGraceWindow());
    }

    public int purgeInactive(Duration window) {
        return purgeInactive(ConnectionScope.all(), window);
    }

    public int purgeInactive(ConnectionScope scope, Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Purge window must be zero or positive, got " + window);
        }
        Instant threshold = clock.instant().minus(window);
        List<SocketConnection> removed = connectionRegistry.removeInactiveBefore(scope, threshold);
        metricsCollector.setGauge("socket.connections.registered", connectionRegistry.size());
        if (!removed.isEmpty()) {
            metricsCollector.incrementCounter("socket.connections.purged", removed.size());
            log.info("Purged {} inactive connections last seen before {}", removed.size(), threshold);
        }
        return removed.size();
    }
}
