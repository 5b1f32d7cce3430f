package com.example.socketrouter.shared.dto;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeTest {

    @Test
    void actionTypeIsEmptyWhenMissingOrBlank() {
        assertFalse(Envelope.empty().actionType("type").isPresent());
        assertFalse(Envelope.of(Map.of("type", "")).actionType("type").isPresent());
        assertEquals("7", Envelope.of(Map.of("type", 7)).actionType("type").orElseThrow());
    }

    @Test
    void payloadCannotShadowTheRoutingKey() {
        Envelope envelope = Envelope.action("type", "CHAT", Map.of("type", "HIJACK", "text", "hi"));

        assertEquals("CHAT", envelope.getString("type"));
        assertEquals(List.of("text", "type"), List.copyOf(envelope.asMap().keySet()));
    }

    @Test
    void withReturnsACopy() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("type", "PING");
        Envelope original = Envelope.of(source);
        source.put("late", true);

        Envelope stamped = original.with("TIMESTAMP", 1L);

        assertFalse(original.containsKey("late"));
        assertFalse(original.containsKey("TIMESTAMP"));
        assertTrue(stamped.containsKey("TIMESTAMP"));
        assertThrows(UnsupportedOperationException.class, () -> stamped.asMap().put("x", 1));
    }
}
