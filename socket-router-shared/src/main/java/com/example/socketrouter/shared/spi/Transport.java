package com.example.socketrouter.shared.spi;

/**
 * The byte-delivery layer underneath the router. Implementations own the
 * sockets; this layer only references them by handle name.
 */
public interface Transport {

    /**
     * Delivers one text frame to the connection behind {@code handle}.
     *
     * @return false when the handle is unknown, not yet accepted, or the frame could not be queued
     */
    boolean send(String handle, String text);

    /**
     * Completes the transport handshake. Until this is called the connection is half-open.
     */
    void acceptHandshake(String handle);
}
