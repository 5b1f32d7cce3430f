package com.example.socketrouter.service.controller;

import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.dto.ConnectionStats;
import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.dto.SweepReport;
import com.example.socketrouter.shared.model.SocketConnection;
import com.example.socketrouter.shared.service.group.ConnectionGroup;
import com.example.socketrouter.shared.service.group.GroupAddressor;
import com.example.socketrouter.shared.service.registry.ConnectionRegistry;
import com.example.socketrouter.shared.service.registry.ConnectionScope;
import com.example.socketrouter.shared.service.sweep.StaleSweeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sockets")
@RequiredArgsConstructor
@Slf4j
public class SocketAdminController {

    private final ConnectionRegistry connectionRegistry;
    private final GroupAddressor groupAddressor;
    private final StaleSweeper staleSweeper;
    private final AppProperties appProperties;
    private final Clock clock;

    @GetMapping("/stats")
    public ResponseEntity<ConnectionStats> getStats() {
        List<SocketConnection> all = connectionRegistry.findAll(ConnectionScope.all());
        int active = (int) all.stream().filter(SocketConnection::isActive).count();
        ConnectionStats stats = ConnectionStats.builder()
                .totalConnections(all.size())
                .activeConnections(active)
                .pendingConnections(all.size() - active)
                .connectedUsers(connectionRegistry.countUsers())
                .timestamp(OffsetDateTime.now(clock))
                .build();
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/connected/{userId}")
    public ResponseEntity<Boolean> isUserConnected(@PathVariable String userId) {
        boolean connected = !connectionRegistry.findAll(ConnectionScope.builder().userId(userId).build()).isEmpty();
        return ResponseEntity.ok(connected);
    }

    @GetMapping("/connections")
    public ResponseEntity<List<SocketConnection>> getConnections(
            @RequestParam(required = false) String path,
            @RequestParam(required = false) String userId) {
        return ResponseEntity.ok(connectionRegistry.findAll(scope(path, userId)));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<SweepReport> cleanupStale(
            @RequestParam(required = false) String path,
            @RequestParam(required = false) String userId) {
        log.info("Stale connection cleanup requested for path={}, userId={}", path, userId);
        return ResponseEntity.ok(staleSweeper.cleanupStale(scope(path, userId)));
    }

    @PostMapping("/purge")
    public ResponseEntity<Map<String, Object>> purgeInactive() {
        int purged = staleSweeper.purgeInactive();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("purged", purged);
        result.put("graceWindow", appProperties.getSweep().getGraceWindow().toString());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/broadcast")
    public ResponseEntity<Map<String, Object>> broadcast(
            @RequestParam(required = false) String path,
            @RequestBody Map<String, Object> body) {
        String routingKey = appProperties.getRouting().getRoutingKey();
        Envelope envelope = Envelope.of(body);
        if (envelope.actionType(routingKey).isEmpty()) {
            throw new IllegalArgumentException("Broadcast body must carry a '" + routingKey + "' field");
        }
        ConnectionGroup group = groupAddressor.fromScope(path != null ? ConnectionScope.forPath(path) : ConnectionScope.all());
        int delivered = group.broadcast(envelope);
        log.info("Broadcast {} to {} of {} connections on path {}", envelope.getString(routingKey), delivered, group.size(), path);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("groupId", group.getId());
        result.put("members", group.size());
        result.put("delivered", delivered);
        return ResponseEntity.ok(result);
    }

    private static ConnectionScope scope(String path, String userId) {
        return ConnectionScope.builder().path(path).userId(userId).build();
    }
}
