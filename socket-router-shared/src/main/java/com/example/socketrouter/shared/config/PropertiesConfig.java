package com.example.socketrouter.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PropertiesConfig {

    @Bean
    @ConfigurationProperties(prefix = "socket-router")
    public AppProperties appProperties() {
        // Binding of socket-router.routing.*, socket-router.sweep.* and
        // socket-router.connection.* is handled by @ConfigurationProperties.
        return new AppProperties();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
