package com.example.socketrouter.shared.dto;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Body of every failed admin API call. {@code correlationId} echoes the
 * request's correlation header so a client report can be matched to the logs.
 */
@Value
@Builder
public class ErrorResponse {
    OffsetDateTime timestamp;
    int status;
    String error;
    String message;
    String path;
    String correlationId;
}
