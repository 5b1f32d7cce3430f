package com.example.socketrouter.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the background purge of pending connections. Embedding
 * applications that drive {@code StaleSweeper} themselves set
 * {@code socket-router.scheduling.enabled=false}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "socket-router.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConditionalConfig {
}
