package com.example.socketrouter.service.transport;

import com.example.socketrouter.shared.spi.Transport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outbound side of every open websocket session, one sink per handle.
 * Frames are only delivered once the handshake has been accepted.
 */
@Component
@Slf4j
public class ReactiveSocketTransport implements Transport {

    private final Map<String, Sinks.Many<String>> outboundSinks = new ConcurrentHashMap<>();
    private final Set<String> acceptedHandles = ConcurrentHashMap.newKeySet();

    /**
     * Registers a session and returns the stream of frames to write to it.
     */
    public Flux<String> open(String handle) {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        outboundSinks.put(handle, sink);
        log.debug("Opened outbound stream for handle {}", handle);
        return sink.asFlux();
    }

    public void close(String handle) {
        acceptedHandles.remove(handle);
        Sinks.Many<String> sink = outboundSinks.remove(handle);
        if (sink != null) {
            sink.tryEmitComplete();
            log.debug("Closed outbound stream for handle {}", handle);
        }
    }

    @Override
    public void acceptHandshake(String handle) {
        if (outboundSinks.containsKey(handle)) {
            acceptedHandles.add(handle);
        } else {
            log.warn("Cannot accept handshake for unknown handle {}", handle);
        }
    }

    @Override
    public boolean send(String handle, String text) {
        Sinks.Many<String> sink = outboundSinks.get(handle);
        if (sink == null || !acceptedHandles.contains(handle)) {
            return false;
        }
        // tryEmitNext fails with FAIL_NON_SERIALIZED under concurrent emitters
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(text);
        }
        if (result.isFailure()) {
            log.warn("Failed to emit websocket frame for handle {}. Result: {}", handle, result);
            return false;
        }
        return true;
    }

    public boolean isOpen(String handle) {
        return outboundSinks.containsKey(handle);
    }

    public int openCount() {
        return outboundSinks.size();
    }
}
