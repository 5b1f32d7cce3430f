package com.example.socketrouter.shared.service.registry;

import com.example.socketrouter.shared.config.AppProperties;
import com.example.socketrouter.shared.exception.ConnectionLimitExceededException;
import com.example.socketrouter.shared.model.SocketConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryConnectionRegistryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private static final int THREADS = 8;

    private AppProperties properties;
    private InMemoryConnectionRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setup() {
        properties = new AppProperties();
        registry = new InMemoryConnectionRegistry(properties);
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }

    /**
     * Starts every task at the same barrier and returns their results in task order.
     */
    private <T> List<T> runTogether(int parties, IntFunction<T> task) throws Exception {
        CyclicBarrier start = new CyclicBarrier(parties);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < parties; i++) {
            int index = i;
            Callable<T> call = () -> {
                start.await(10, TimeUnit.SECONDS);
                return task.apply(index);
            };
            futures.add(executor.submit(call));
        }
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }
        return results;
    }

    private Optional<SocketConnection> tryUpsert(String handle, String userId, Instant at) {
        try {
            return Optional.of(upsert(handle, userId, "/t/1", at));
        } catch (ConnectionLimitExceededException e) {
            return Optional.empty();
        }
    }

    private SocketConnection upsert(String handle, String userId, String path, Instant at) {
        return registry.upsert(ConnectionRefresh.builder()
                .handle(handle)
                .userId(userId)
                .sessionId("s-" + handle)
                .path(path)
                .userIp("10.0.0.1")
                .timestamp(at)
                .build());
    }

    @Test
    void upsertCreatesThenRefreshesTheSameRecord() {
        SocketConnection created = upsert("h1", "alice", "/t/1", T0);
        assertNotNull(created.getId());
        assertTrue(created.isActive());
        assertEquals(T0, created.getConnectedAt());

        registry.markInactive(ConnectionScope.all());
        SocketConnection refreshed = upsert("h1", "alice", "/t/1", T0.plusSeconds(30));

        assertEquals(created.getId(), refreshed.getId());
        assertEquals(T0, refreshed.getConnectedAt());
        assertEquals(T0.plusSeconds(30), refreshed.getLastPing());
        assertTrue(refreshed.isActive());
        assertEquals(1, registry.size());
    }

    @Test
    void refreshWithoutSessionOrIpKeepsExistingValues() {
        upsert("h1", "alice", "/t/1", T0);
        SocketConnection refreshed = registry.upsert(ConnectionRefresh.builder()
                .handle("h1")
                .userId("alice")
                .path("/t/1")
                .timestamp(T0.plusSeconds(1))
                .build());

        assertEquals("s-h1", refreshed.getSessionId());
        assertEquals("10.0.0.1", refreshed.getUserIp());
    }

    @Test
    void connectionLimitOnlyAppliesToNewRecordsOfKnownUsers() {
        properties.getConnection().setMaxConnectionsPerUser(2);
        upsert("h1", "alice", "/t/1", T0);
        upsert("h2", "alice", "/t/1", T0);

        ConnectionLimitExceededException e =
                assertThrows(ConnectionLimitExceededException.class, () -> upsert("h3", "alice", "/t/1", T0));
        assertEquals("alice", e.getUserId());
        assertEquals(2, e.getLimit());

        // refreshing an existing record and anonymous connections are unaffected
        upsert("h2", "alice", "/t/1", T0.plusSeconds(5));
        upsert("a1", null, "/t/1", T0);
        upsert("a2", null, "/t/1", T0);
        upsert("a3", null, "/t/1", T0);
        assertEquals(5, registry.size());
        assertFalse(registry.find("h3").isPresent());
    }

    @Test
    void markInactiveReturnsOnlyRecordsItFlipped() {
        upsert("h1", "alice", "/t/1", T0);
        upsert("h2", "alice", "/t/1", T0);
        upsert("h3", "alice", "/t/2", T0);
        upsert("h4", "bob", "/t/1", T0);

        List<SocketConnection> flipped = registry.markInactive(ConnectionScope.forUserAndPath("alice", "/t/1"));
        assertEquals(2, flipped.size());
        assertTrue(flipped.stream().noneMatch(SocketConnection::isActive));

        List<SocketConnection> again = registry.markInactive(ConnectionScope.forUserAndPath("alice", "/t/1"));
        assertTrue(again.isEmpty());

        assertTrue(registry.find("h3").orElseThrow().isActive());
        assertTrue(registry.find("h4").orElseThrow().isActive());
    }

    @Test
    void markInactiveHonoursExcludedConnection() {
        SocketConnection self = upsert("h1", "alice", "/t/1", T0);
        upsert("h2", "alice", "/t/1", T0);

        List<SocketConnection> flipped = registry.markInactive(
                ConnectionScope.forUserAndPath("alice", "/t/1").excluding(self.getId()));

        assertEquals(1, flipped.size());
        assertEquals("h2", flipped.get(0).getHandle());
        assertTrue(registry.find("h1").orElseThrow().isActive());
    }

    @Test
    void removeInactiveBeforeDeletesOnlyPendingRecordsOlderThanThreshold() {
        upsert("old", "alice", "/t/1", T0);
        upsert("fresh", "alice", "/t/1", T0.plus(Duration.ofMinutes(4)));
        upsert("active", "alice", "/t/1", T0);
        registry.markInactive(ConnectionScope.all());
        upsert("active", "alice", "/t/1", T0);

        List<SocketConnection> removed =
                registry.removeInactiveBefore(ConnectionScope.all(), T0.plus(Duration.ofMinutes(1)));

        assertEquals(1, removed.size());
        assertEquals("old", removed.get(0).getHandle());
        assertTrue(registry.find("fresh").isPresent());
        assertTrue(registry.find("active").isPresent());
    }

    @Test
    void findAllAndCountUsers() {
        upsert("h1", "alice", "/t/1", T0);
        upsert("h2", "alice", "/t/2", T0);
        upsert("h3", "bob", "/t/1", T0);
        upsert("h4", null, "/t/1", T0);

        assertEquals(3, registry.findAll(ConnectionScope.forPath("/t/1")).size());
        assertEquals(2, registry.countUsers());
        assertTrue(registry.remove("h4").isPresent());
        assertFalse(registry.remove("h4").isPresent());
        assertEquals(3, registry.size());
    }

    @Test
    void simultaneousConnectsOfOneUserNeverExceedTheLimit() throws Exception {
        properties.getConnection().setMaxConnectionsPerUser(1);

        for (int round = 0; round < 200; round++) {
            String prefix = "r" + round + "-";
            List<Optional<SocketConnection>> results =
                    runTogether(THREADS, i -> tryUpsert(prefix + i, "alice", T0));

            assertEquals(1, results.stream().filter(Optional::isPresent).count(), "round " + round);
            assertEquals(1, registry.findAll(ConnectionScope.forUserAndPath("alice", "/t/1")).size(), "round " + round);

            registry.findAll(ConnectionScope.forUserAndPath("alice", "/t/1")).forEach(c -> registry.remove(c.getHandle()));
        }
    }

    @Test
    void limitIsReleasedByRemoveAndPurge() {
        properties.getConnection().setMaxConnectionsPerUser(1);
        upsert("h1", "alice", "/t/1", T0);
        assertThrows(ConnectionLimitExceededException.class, () -> upsert("h2", "alice", "/t/1", T0));

        registry.remove("h1");
        upsert("h2", "alice", "/t/1", T0);

        registry.markInactive(ConnectionScope.all());
        assertEquals(1, registry.removeInactiveBefore(ConnectionScope.all(), T0.plusSeconds(1)).size());
        assertEquals("h3", upsert("h3", "alice", "/t/1", T0).getHandle());
    }

    @Test
    void concurrentUpsertsOfOneHandleShareOneRecord() throws Exception {
        List<SocketConnection> results = runTogether(THREADS, i -> upsert("h1", "alice", "/t/1", T0.plusSeconds(i)));

        Set<String> ids = ConcurrentHashMap.newKeySet();
        results.forEach(c -> ids.add(c.getId()));
        assertEquals(1, ids.size());
        assertEquals(1, registry.size());
    }

    @Test
    void concurrentMarkInactiveFlipsEachRecordExactlyOnce() throws Exception {
        for (int i = 0; i < 50; i++) {
            upsert("h" + i, i % 2 == 0 ? "alice" : "bob", "/t/1", T0);
        }

        List<List<SocketConnection>> flipped = runTogether(THREADS, i -> registry.markInactive(ConnectionScope.all()));

        Set<String> handles = ConcurrentHashMap.newKeySet();
        AtomicInteger total = new AtomicInteger();
        flipped.forEach(batch -> batch.forEach(c -> {
            handles.add(c.getHandle());
            total.incrementAndGet();
        }));
        assertEquals(50, total.get());
        assertEquals(50, handles.size());
        assertTrue(registry.findAll(ConnectionScope.all()).stream().noneMatch(SocketConnection::isActive));
    }

    @Test
    void refreshRacingAPurgeNeverLosesTheRefresh() throws Exception {
        Instant threshold = T0.plusSeconds(5);
        for (int round = 0; round < 200; round++) {
            registry.remove("h1");
            String originalId = upsert("h1", "alice", "/t/1", T0).getId();
            registry.markInactive(ConnectionScope.all());

            List<Object> results = runTogether(2, i -> i == 0
                    ? upsert("h1", "alice", "/t/1", T0.plusSeconds(10))
                    : registry.removeInactiveBefore(ConnectionScope.all(), threshold));

            List<?> purged = (List<?>) results.get(1);
            SocketConnection current = registry.find("h1").orElseThrow();
            assertTrue(current.isActive(), "round " + round);
            assertEquals(T0.plusSeconds(10), current.getLastPing(), "round " + round);
            if (purged.isEmpty()) {
                assertEquals(originalId, current.getId(), "round " + round);
            } else {
                assertEquals(1, purged.size(), "round " + round);
                assertFalse(originalId.equals(current.getId()), "round " + round);
            }
        }
    }
}
