package com.example.socketrouter.shared.util;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.exception.ProtocolViolationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeCodecTest {

    private final EnvelopeCodec codec = EnvelopeCodec.create();

    @Test
    void decodesNestedObjects() {
        Envelope envelope = codec.decode("{\"type\":\"MOVE\",\"seat\":3,\"cards\":[\"As\",\"Kd\"],\"meta\":{\"fast\":true}}");

        assertEquals("MOVE", envelope.actionType("type").orElseThrow());
        assertEquals(3, envelope.get("seat"));
        assertEquals(List.of("As", "Kd"), envelope.get("cards"));
        assertEquals(Map.of("fast", true), envelope.get("meta"));
    }

    @Test
    void rejectsAnythingButAnObject() {
        assertThrows(ProtocolViolationException.class, () -> codec.decode(null));
        assertThrows(ProtocolViolationException.class, () -> codec.decode("   "));
        assertThrows(ProtocolViolationException.class, () -> codec.decode("{\"type\":"));
        assertThrows(ProtocolViolationException.class, () -> codec.decode("\"HELLO\""));
        ProtocolViolationException e = assertThrows(ProtocolViolationException.class, () -> codec.decode("[]"));
        assertTrue(e.getMessage().contains("array"));
    }

    @Test
    void encodesInstantsAsIsoStrings() {
        String json = codec.encode(Envelope.of(Map.of("last_ping", Instant.parse("2024-03-01T12:00:00Z"))));

        assertEquals("{\"last_ping\":\"2024-03-01T12:00:00Z\"}", json);
    }
}
