package com.example.socketrouter.shared.util;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.exception.ProtocolViolationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON wire codec for {@link Envelope}. Inbound frames must be JSON objects.
 */
@Component
@RequiredArgsConstructor
public class EnvelopeCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * A codec configured like the Spring Boot default mapper, for use outside a context.
     */
    public static EnvelopeCodec create() {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new EnvelopeCodec(mapper);
    }

    public Envelope decode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ProtocolViolationException("Expected JSON websocket message to be an object, but got an empty frame");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProtocolViolationException("Malformed JSON websocket message: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            String kind = node == null ? "nothing" : node.getNodeType().name().toLowerCase();
            throw new ProtocolViolationException("Expected JSON websocket message to be an object, but got " + kind);
        }
        return Envelope.of(objectMapper.convertValue(node, MAP_TYPE));
    }

    public String encode(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Envelope payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
