package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A correlated, human-facing record derived from an anomaly that survived
 * suppression.
 *
 * <p>
 * Alerts are created by the correlator and, apart from the acknowledgement
 * flag, never change afterwards. Inbound alerts posted to the execute endpoint
 * may use the short names {@code id} and {@code source}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code alertId}, {@code title}, {@code severity}
 * and {@code createdAt} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Alert {

    @JsonAlias("id")
    private String alertId;

    private String title;
    private String description;
    private Severity severity;

    @JsonAlias("source")
    private String sourceId;

    private String service;

    @JsonAlias("timestamp")
    private Instant createdAt;

    private volatile boolean acknowledged;
    private volatile Instant acknowledgedAt;

    private Map<String, Object> evidence;
    private String recommendation;
    private String ruleId;
    private String anomalyId;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.alertId = Objects.requireNonNull(builder.alertId, "alertId must not be null");
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.description = builder.description;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null").toAlertLevel();
        this.sourceId = builder.sourceId;
        this.service = builder.service;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.evidence = builder.evidence != null ? new LinkedHashMap<>(builder.evidence) : null;
        this.recommendation = builder.recommendation;
        this.ruleId = builder.ruleId;
        this.anomalyId = builder.anomalyId;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Validation / derived values
    // ---------------------------------------------------------------

    /**
     * Check the minimal fields an alert submitted from outside must carry.
     *
     * @return this alert, for chaining
     * @throws ValidationException naming the first missing field
     */
    public Alert validate() {
        if (alertId == null || alertId.isBlank()) {
            throw new ValidationException("alert_id", "alert_id (or id) is required");
        }
        if (title == null || title.isBlank()) {
            throw new ValidationException("title", "title is required");
        }
        if (severity == null) {
            throw new ValidationException("severity", "severity is required");
        }
        return this;
    }

    /**
     * Source the IP-scoped actions target: {@code source_id}, then
     * {@code evidence.source_ip}. Empty string when neither is present.
     */
    @JsonIgnore
    public String effectiveSourceId() {
        if (sourceId != null && !sourceId.isBlank()) {
            return sourceId;
        }
        return evidenceString("source_ip");
    }

    /**
     * Service the isolation action targets: {@code service}, then
     * {@code evidence.service}, then the source. Empty string when none is present.
     */
    @JsonIgnore
    public String effectiveService() {
        if (service != null && !service.isBlank() && !TelemetryEvent.UNKNOWN.equals(service)) {
            return service;
        }
        String fromEvidence = evidenceString("service");
        if (!fromEvidence.isEmpty() && !TelemetryEvent.UNKNOWN.equals(fromEvidence)) {
            return fromEvidence;
        }
        return effectiveSourceId();
    }

    private String evidenceString(String key) {
        Object value = evidence != null ? evidence.get(key) : null;
        return value != null ? value.toString().trim() : "";
    }

    /**
     * Mark this alert acknowledged. Repeated calls keep the first timestamp.
     *
     * @param at acknowledgement time
     * @return {@code true} if the alert was not yet acknowledged
     */
    public synchronized boolean acknowledge(Instant at) {
        if (acknowledged) {
            return false;
        }
        this.acknowledged = true;
        this.acknowledgedAt = at;
        return true;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String alertId;
        private String title;
        private String description;
        private Severity severity;
        private String sourceId;
        private String service;
        private Instant createdAt;
        private Map<String, Object> evidence;
        private String recommendation;
        private String ruleId;
        private String anomalyId;

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
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

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder evidence(Map<String, Object> evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder anomalyId(String anomalyId) {
            this.anomalyId = anomalyId;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getAlertId() {
        return alertId;
    }

    public void setAlertId(String alertId) {
        this.alertId = alertId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity != null ? severity.toAlertLevel() : null;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public void setAcknowledged(boolean acknowledged) {
        this.acknowledged = acknowledged;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public void setAcknowledgedAt(Instant acknowledgedAt) {
        this.acknowledgedAt = acknowledgedAt;
    }

    /**
     * @return unmodifiable evidence map, or {@code null} if not set
     */
    public Map<String, Object> getEvidence() {
        return evidence != null ? Collections.unmodifiableMap(evidence) : null;
    }

    public void setEvidence(Map<String, Object> evidence) {
        this.evidence = evidence != null ? new LinkedHashMap<>(evidence) : null;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public void setRecommendation(String recommendation) {
        this.recommendation = recommendation;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public void setAnomalyId(String anomalyId) {
        this.anomalyId = anomalyId;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(alertId, alert.alertId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "alertId='" + alertId + '\'' +
                ", title='" + title + '\'' +
                ", severity=" + severity +
                ", sourceId='" + sourceId + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", acknowledged=" + acknowledged +
                '}';
    }
}
