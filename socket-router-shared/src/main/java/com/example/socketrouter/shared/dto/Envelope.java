package com.example.socketrouter.shared.dto;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One structured websocket message: a JSON object with a routing key and
 * free-form payload fields. Immutable; {@link #with(String, Object)} returns a copy.
 */
@EqualsAndHashCode
public final class Envelope {

    private final Map<String, Object> fields;

    private Envelope(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Envelope of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        return new Envelope(new LinkedHashMap<>(fields));
    }

    /**
     * Builds an outbound envelope whose routing key carries {@code actionType}.
     * The routing key is written last so payload entries cannot shadow it.
     */
    public static Envelope action(String routingKey, String actionType, Map<String, ?> payload) {
        Objects.requireNonNull(routingKey, "routingKey");
        Map<String, Object> fields = new LinkedHashMap<>();
        if (payload != null) {
            fields.putAll(payload);
        }
        fields.remove(routingKey);
        fields.put(routingKey, actionType);
        return new Envelope(fields);
    }

    public static Envelope empty() {
        return new Envelope(new LinkedHashMap<>());
    }

    /**
     * @return the value under the routing key, or empty when it is absent or blank
     */
    public Optional<String> actionType(String routingKey) {
        Object value = fields.get(routingKey);
        if (value == null) {
            return Optional.empty();
        }
        String actionType = value.toString();
        return actionType.isBlank() ? Optional.empty() : Optional.of(actionType);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public String getString(String key) {
        Object value = fields.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public Envelope with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(key, value);
        return new Envelope(copy);
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
