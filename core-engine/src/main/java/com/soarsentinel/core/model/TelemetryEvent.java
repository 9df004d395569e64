package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Normalized telemetry describing one request against a protected service.
 *
 * <p>
 * Only {@code source_id} (alias {@code source_ip}) is mandatory on the wire;
 * every other field has a default. The payload is a free-form bag restricted
 * to strings, numbers, booleans, nulls and nested maps, which
 * {@link #validate()} enforces so detectors can read it without type errors.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable. {@link #withReceivedAt(Instant)} returns a copy.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TelemetryEvent {

    public static final String UNKNOWN = "unknown";
    static final int MAX_PAYLOAD_DEPTH = 8;

    private final String eventId;
    private final String sourceId;
    private final String service;
    private final String eventType;
    private final String domain;
    private final Map<String, Object> payload;
    private final Long timestamp;
    private final Instant receivedAt;

    @JsonCreator
    public TelemetryEvent(
            @JsonProperty("event_id") String eventId,
            @JsonProperty("source_id") @JsonAlias("source_ip") String sourceId,
            @JsonProperty("service") String service,
            @JsonProperty("event_type") String eventType,
            @JsonProperty("domain") String domain,
            @JsonProperty("payload") Map<String, Object> payload,
            @JsonProperty("timestamp") Long timestamp,
            @JsonProperty("received_at") Instant receivedAt) {
        this.eventId = eventId == null || eventId.isBlank() ? UUID.randomUUID().toString() : eventId;
        this.sourceId = sourceId == null ? null : sourceId.trim();
        this.service = service == null || service.isBlank() ? UNKNOWN : service;
        this.eventType = eventType == null || eventType.isBlank()
                ? UNKNOWN
                : eventType.trim().toLowerCase(Locale.ROOT);
        this.domain = domain == null || domain.isBlank() ? "general" : domain;
        // Shallow copy; nested maps are only exposed through the read accessors
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Collections.emptyMap();
        this.timestamp = timestamp;
        this.receivedAt = receivedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check the mandatory fields and the closed payload value union.
     *
     * @return this event, for chaining
     * @throws ValidationException naming the first missing or invalid field
     */
    public TelemetryEvent validate() {
        if (sourceId == null || sourceId.isBlank()) {
            throw new ValidationException("source_id", "source_id is required");
        }
        if (timestamp != null && timestamp < 0) {
            throw new ValidationException("timestamp", "timestamp must be a non-negative epoch second");
        }
        validatePayload(payload, "payload", 1);
        return this;
    }

    private static void validatePayload(Map<?, ?> map, String path, int depth) {
        if (depth > MAX_PAYLOAD_DEPTH) {
            throw new ValidationException(path, "payload nesting deeper than " + MAX_PAYLOAD_DEPTH);
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String fieldPath = path + "." + entry.getKey();
            Object value = entry.getValue();
            if (value == null || value instanceof String || value instanceof Number
                    || value instanceof Boolean) {
                continue;
            }
            if (value instanceof Map<?, ?> nested) {
                validatePayload(nested, fieldPath, depth + 1);
                continue;
            }
            String type = value instanceof List<?> ? "array" : value.getClass().getSimpleName();
            throw new ValidationException(fieldPath,
                    fieldPath + " has unsupported type " + type
                            + "; expected string, number, boolean or object");
        }
    }

    // ---------------------------------------------------------------
    // Payload accessors
    // ---------------------------------------------------------------

    /**
     * @param key top-level payload key
     * @return the raw value, or empty when absent or {@code null}
     */
    public Optional<Object> payloadValue(String key) {
        return Optional.ofNullable(payload.get(key));
    }

    /**
     * Retrieve a string payload value. Numbers and booleans are rendered with
     * {@code toString()}; nested maps are not strings.
     */
    public Optional<String> payloadString(String key) {
        Object raw = payload.get(key);
        if (raw == null || raw instanceof Map<?, ?>) {
            return Optional.empty();
        }
        return Optional.of(raw.toString());
    }

    /**
     * Retrieve a numeric payload value, coercing string-encoded numbers.
     */
    public Optional<Double> payloadNumber(String key) {
        Object raw = payload.get(key);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Retrieve a boolean payload value; accepts {@code "true"} / {@code "false"} strings.
     */
    public Optional<Boolean> payloadBoolean(String key) {
        Object raw = payload.get(key);
        if (raw instanceof Boolean b) {
            return Optional.of(b);
        }
        if (raw instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} when the payload has a non-null, non-blank value under {@code key}
     */
    public boolean hasPayloadValue(String key) {
        Object raw = payload.get(key);
        return raw != null && !(raw instanceof String s && s.isBlank());
    }

    /**
     * Flatten every string value in the payload, nested maps included, keyed
     * by dotted path.
     *
     * @return ordered map of path to string value
     */
    @JsonIgnore
    public Map<String, String> stringValues() {
        Map<String, String> out = new LinkedHashMap<>();
        collectStrings(payload, "", out, 1);
        return out;
    }

    private static void collectStrings(Map<?, ?> map, String prefix, Map<String, String> out, int depth) {
        if (depth > MAX_PAYLOAD_DEPTH) {
            return;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String path = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof String s) {
                out.put(path, s);
            } else if (value instanceof Map<?, ?> nested) {
                collectStrings(nested, path, out, depth + 1);
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    @JsonProperty("source_id")
    public String getSourceId() {
        return sourceId;
    }

    @JsonProperty("service")
    public String getService() {
        return service;
    }

    @JsonProperty("event_type")
    public String getEventType() {
        return eventType;
    }

    @JsonProperty("domain")
    public String getDomain() {
        return domain;
    }

    /**
     * @return unmodifiable payload map
     */
    @JsonProperty("payload")
    public Map<String, Object> getPayload() {
        return payload;
    }

    @JsonProperty("timestamp")
    public Long getTimestamp() {
        return timestamp;
    }

    /**
     * @return the instant the pipeline accepted the event, or {@code null} before that
     */
    @JsonProperty("received_at")
    public Instant getReceivedAt() {
        return receivedAt;
    }

    /**
     * Copy this event, stamping the receive time and defaulting the timestamp.
     *
     * @param instant receive time; must not be {@code null}
     * @return a new event
     */
    public TelemetryEvent withReceivedAt(Instant instant) {
        Objects.requireNonNull(instant, "receivedAt must not be null");
        return new TelemetryEvent(eventId, sourceId, service, eventType, domain, payload,
                timestamp != null ? timestamp : instant.getEpochSecond(), instant);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder, mostly for programmatic producers and tests.
     */
    public static class Builder {
        private String eventId;
        private String sourceId;
        private String service;
        private String eventType;
        private String domain;
        private final Map<String, Object> payload = new LinkedHashMap<>();
        private Long timestamp;
        private Instant receivedAt;

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder payload(String key, Object value) {
            this.payload.put(key, value);
            return this;
        }

        public Builder payload(Map<String, Object> values) {
            this.payload.putAll(values);
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public TelemetryEvent build() {
            return new TelemetryEvent(eventId, sourceId, service, eventType, domain, payload,
                    timestamp, receivedAt);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryEvent that))
            return false;
        return Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "TelemetryEvent{" +
                "eventId='" + eventId + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", service='" + service + '\'' +
                ", eventType='" + eventType + '\'' +
                ", payloadKeys=" + payload.keySet() +
                '}';
    }
}
