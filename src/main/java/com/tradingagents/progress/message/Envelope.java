package com.tradingagents.progress.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wire wrapper around every bus message: {"type", "timestamp", "payload"}.
 * Immutable; a fresh instance is built per publish.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Envelope(MessageKind type, double timestamp, Map<String, Object> payload) {

    public Envelope {
        Objects.requireNonNull(type, "type");
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Validate the payload against the schema of {@code kind} and stamp it with the current time.
     *
     * @throws SchemaViolationException if a required field is missing or malformed
     */
    public static Envelope build(MessageKind kind, Map<String, Object> payload, Clock clock) {
        PayloadSchema.validate(kind, payload);
        return new Envelope(kind, epochSeconds(clock), payload);
    }

    public static double epochSeconds(Clock clock) {
        return clock.millis() / 1000.0;
    }

    public String analysisId() {
        return stringField(PayloadSchema.ANALYSIS_ID);
    }

    public String stringField(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    public Double numberField(String key) {
        Object value = payload.get(key);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    public boolean flag(String key) {
        Object value = payload.get(key);
        return value instanceof Boolean b ? b : value != null && "true".equalsIgnoreCase(value.toString());
    }
}
