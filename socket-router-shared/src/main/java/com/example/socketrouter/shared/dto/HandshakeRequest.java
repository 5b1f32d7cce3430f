package com.example.socketrouter.shared.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * What the transport knows about a connection at handshake time.
 * Header names are lower-cased by the transport adapter.
 */
@Value
@Builder
public class HandshakeRequest {
    String handle;
    String path;
    String peerAddress;
    @Singular
    Map<String, String> headers;
    @Singular("cookie")
    Map<String, String> cookies;

    public String header(String name) {
        return headers.get(name.toLowerCase());
    }
}
