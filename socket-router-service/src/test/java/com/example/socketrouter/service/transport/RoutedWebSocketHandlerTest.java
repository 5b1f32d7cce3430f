package com.example.socketrouter.service.transport;

import com.example.socketrouter.shared.config.MonitoringConfig.SocketMetricsCollector;
import com.example.socketrouter.shared.exception.ConnectionLimitExceededException;
import com.example.socketrouter.shared.exception.ProtocolViolationException;
import com.example.socketrouter.shared.service.lifecycle.ConnectionLifecycle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RoutedWebSocketHandlerTest {

    private ConnectionLifecycle lifecycle;
    private SocketMetricsCollector metrics;
    private RoutedWebSocketHandler handler;

    @BeforeEach
    void setup() {
        lifecycle = mock(ConnectionLifecycle.class);
        metrics = new SocketMetricsCollector(new SimpleMeterRegistry());
        handler = new RoutedWebSocketHandler(lifecycle, new ReactiveSocketTransport(), metrics);
    }

    @Test
    void malformedFrameIsCountedAsProtocolError() {
        doThrow(new ProtocolViolationException("not a JSON object"))
                .when(lifecycle).onReceive(eq("h1"), anyString());

        assertDoesNotThrow(() -> handler.receive("h1", "not json"));

        assertEquals(1, metrics.getCounterValue("socket.errors", "type", "protocol"));
        verify(lifecycle, never()).onDisconnect(any());
    }

    @Test
    void unexpectedFailureKeepsTheSessionOpen() {
        doThrow(new ConnectionLimitExceededException("alice", 1))
                .doNothing()
                .when(lifecycle).onReceive(eq("h1"), anyString());

        assertDoesNotThrow(() -> handler.receive("h1", "{\"type\":\"UPDATE_USER\"}"));
        assertDoesNotThrow(() -> handler.receive("h1", "{\"type\":\"HELLO\"}"));

        verify(lifecycle, times(2)).onReceive(eq("h1"), anyString());
        verify(lifecycle, never()).onDisconnect(any());
        assertEquals(1, metrics.getCounterValue("socket.errors", "type", "handler"));
    }
}
