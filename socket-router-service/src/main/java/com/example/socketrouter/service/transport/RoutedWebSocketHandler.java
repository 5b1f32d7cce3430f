package com.example.socketrouter.service.transport;

import com.example.socketrouter.shared.config.MonitoringConfig.SocketMetricsCollector;
import com.example.socketrouter.shared.dto.DisconnectInfo;
import com.example.socketrouter.shared.dto.HandshakeRequest;
import com.example.socketrouter.shared.dto.HandshakeResult;
import com.example.socketrouter.shared.exception.ProtocolViolationException;
import com.example.socketrouter.shared.service.lifecycle.ConnectionLifecycle;
import com.example.socketrouter.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpCookie;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;

/**
 * Bridges WebFlux websocket sessions to one {@link ConnectionLifecycle}.
 * Inbound frames of a session are dispatched one at a time, in arrival order.
 */
@Slf4j
@RequiredArgsConstructor
public class RoutedWebSocketHandler implements WebSocketHandler {

    private final ConnectionLifecycle lifecycle;
    private final ReactiveSocketTransport transport;
    private final SocketMetricsCollector metricsCollector;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String handle = session.getId();
        HandshakeRequest request = toHandshakeRequest(handle, session.getHandshakeInfo());

        Mono<Void> outbound = session.send(transport.open(handle).map(session::textMessage));

        HandshakeResult result = lifecycle.onConnect(request);
        if (result == HandshakeResult.REJECTED) {
            transport.close(handle);
            return session.close(CloseStatus.POLICY_VIOLATION);
        }

        Mono<Void> inbound = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> Mono.fromRunnable(() -> receive(handle, text))
                        .subscribeOn(Schedulers.boundedElastic()))
                .then();

        return Mono.zip(inbound, outbound)
                .then(session.closeStatus().defaultIfEmpty(CloseStatus.NO_STATUS_CODE))
                .doOnNext(status -> disconnect(handle, status.getCode(), status.getReason()))
                // error and cancel paths; a second disconnect for the handle is a no-op
                .doFinally(signal -> disconnect(handle, Constants.ABNORMAL_CLOSE_CODE, "session terminated: " + signal))
                .then();
    }

    void receive(String handle, String text) {
        try {
            lifecycle.onReceive(handle, text);
        } catch (ProtocolViolationException e) {
            log.warn("Dropping malformed websocket frame from {}: {}", handle, e.getMessage());
            metricsCollector.incrementCounter("socket.errors", "type", "protocol");
        } catch (IllegalStateException e) {
            log.debug("Dropping websocket frame for closed handle {}: {}", handle, e.getMessage());
        } catch (RuntimeException e) {
            // keep the session open; one failed frame is not a dropped connection
            log.error("Failed to process websocket frame from {}", handle, e);
            metricsCollector.incrementCounter("socket.errors", "type", "handler");
        }
    }

    private void disconnect(String handle, int code, String reason) {
        transport.close(handle);
        lifecycle.onDisconnect(DisconnectInfo.of(handle, code, reason));
    }

    static HandshakeRequest toHandshakeRequest(String handle, HandshakeInfo info) {
        HandshakeRequest.HandshakeRequestBuilder builder = HandshakeRequest.builder()
                .handle(handle)
                .path(info.getUri().getPath())
                .peerAddress(peerAddress(info.getRemoteAddress()));
        info.getHeaders().forEach((name, values) -> {
            if (!values.isEmpty()) {
                builder.header(name.toLowerCase(), String.join(",", values));
            }
        });
        for (Map.Entry<String, List<HttpCookie>> cookie : info.getCookies().entrySet()) {
            if (!cookie.getValue().isEmpty()) {
                builder.cookie(cookie.getKey(), cookie.getValue().get(0).getValue());
            }
        }
        return builder.build();
    }

    private static String peerAddress(InetSocketAddress address) {
        if (address == null) {
            return null;
        }
        return address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
    }
}
