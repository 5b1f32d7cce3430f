package com.example.socketrouter.shared.dto;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class ConnectionStats {
    int totalConnections;
    int activeConnections;
    int pendingConnections;
    long connectedUsers;
    OffsetDateTime timestamp;
}
