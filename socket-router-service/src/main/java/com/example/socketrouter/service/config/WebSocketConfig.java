package com.example.socketrouter.service.config;

import com.example.socketrouter.service.transport.ReactiveSocketTransport;
import com.example.socketrouter.service.transport.RoutedWebSocketHandler;
import com.example.socketrouter.shared.config.MonitoringConfig.SocketMetricsCollector;
import com.example.socketrouter.shared.service.lifecycle.ConnectionLifecycle;
import com.example.socketrouter.shared.service.lifecycle.ConnectionLifecycleFactory;
import com.example.socketrouter.shared.service.lifecycle.SocketEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps every {@link SocketEndpoint} bean to its own lifecycle. The websocket
 * handler adapter comes from the WebFlux configuration.
 */
@Configuration
@Slf4j
public class WebSocketConfig {

    @Bean
    public HandlerMapping webSocketHandlerMapping(List<SocketEndpoint> endpoints,
                                                  ConnectionLifecycleFactory lifecycleFactory,
                                                  ReactiveSocketTransport transport,
                                                  SocketMetricsCollector metricsCollector) {
        Map<String, WebSocketHandler> handlers = new LinkedHashMap<>();
        for (SocketEndpoint endpoint : endpoints) {
            ConnectionLifecycle lifecycle = lifecycleFactory.create(endpoint);
            handlers.put(endpoint.getPathPattern(), new RoutedWebSocketHandler(lifecycle, transport, metricsCollector));
            log.info("Mapped websocket endpoint '{}' to {} ({} routes, login required: {})",
                    endpoint.getName(), endpoint.getPathPattern(),
                    endpoint.getRouteTable().getPatterns().size(), endpoint.isLoginRequired());
        }
        SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping(handlers);
        mapping.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return mapping;
    }
}
