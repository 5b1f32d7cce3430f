package com.example.socketrouter.shared.service.registry;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Session state written on every refresh. A null {@code userIp} or
 * {@code sessionId} keeps whatever the record already holds.
 */
@Value
@Builder
public class ConnectionRefresh {
    String handle;
    String userId;
    String sessionId;
    String path;
    String userIp;
    Instant timestamp;
}
