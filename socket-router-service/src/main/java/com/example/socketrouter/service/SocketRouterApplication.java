package com.example.socketrouter.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Websocket routing service.
 * <p>
 * Connections are tracked in an in-memory registry, inbound JSON messages are
 * routed by their {@code type} field, and a scheduled sweep purges connections
 * that stopped answering pings.
 */
@SpringBootApplication(scanBasePackages = "com.example.socketrouter")
@EnableConfigurationProperties
public class SocketRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocketRouterApplication.class, args);
    }
}
