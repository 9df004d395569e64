package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A rule-engine finding tied to one telemetry event.
 *
 * <p>
 * Created by a detector (or submitted by an external scorer) and never
 * mutated after it has been handed to the correlator.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Anomaly {

    private String anomalyId;
    private String ruleId;
    private String ruleName;
    private Severity severity;
    private double confidence;
    private String description;
    private Map<String, Object> evidence;
    private String recommendation;
    private String sourceId;
    private String service;
    private String sourceEventId;
    private Instant detectedAt;

    /** No-arg constructor required by Jackson. */
    public Anomaly() {
    }

    private Anomaly(Builder builder) {
        this.anomalyId = builder.anomalyId != null ? builder.anomalyId : UUID.randomUUID().toString();
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.ruleName = builder.ruleName;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.confidence = builder.confidence;
        this.description = builder.description;
        this.evidence = builder.evidence != null ? new LinkedHashMap<>(builder.evidence) : null;
        this.recommendation = builder.recommendation;
        this.sourceId = builder.sourceId;
        this.service = builder.service;
        this.sourceEventId = builder.sourceEventId;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check the fields an externally submitted anomaly must carry.
     *
     * @return this anomaly, for chaining
     * @throws ValidationException naming the first invalid field
     */
    public Anomaly validate() {
        if (ruleId == null || ruleId.isBlank()) {
            throw new ValidationException("rule_id", "rule_id is required");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new ValidationException("confidence", "confidence must be within [0, 1]");
        }
        return this;
    }

    /**
     * The source this anomaly is attributed to: {@code source_id}, then
     * {@code evidence.source_ip}, then {@code "unknown"}.
     */
    @JsonIgnore
    public String effectiveSourceId() {
        if (sourceId != null && !sourceId.isBlank()) {
            return sourceId;
        }
        Object fromEvidence = evidence != null ? evidence.get("source_ip") : null;
        return fromEvidence != null && !fromEvidence.toString().isBlank()
                ? fromEvidence.toString()
                : TelemetryEvent.UNKNOWN;
    }

    /**
     * Fluent builder for {@link Anomaly}. {@code ruleId}, {@code severity}
     * and {@code detectedAt} are required.
     */
    public static class Builder {
        private String anomalyId;
        private String ruleId;
        private String ruleName;
        private Severity severity;
        private double confidence;
        private String description;
        private Map<String, Object> evidence;
        private String recommendation;
        private String sourceId;
        private String service;
        private String sourceEventId;
        private Instant detectedAt;

        public Builder anomalyId(String anomalyId) {
            this.anomalyId = anomalyId;
            return this;
        }

        public Builder rule(ThreatRule rule) {
            this.ruleId = rule.id();
            this.ruleName = rule.displayName();
            this.recommendation = rule.recommendation();
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
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

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder sourceEventId(String sourceEventId) {
            this.sourceEventId = sourceEventId;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getAnomalyId() {
        return anomalyId;
    }

    public void setAnomalyId(String anomalyId) {
        this.anomalyId = anomalyId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public void setRuleName(String ruleName) {
        this.ruleName = ruleName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
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

    public String getSourceEventId() {
        return sourceEventId;
    }

    public void setSourceEventId(String sourceEventId) {
        this.sourceEventId = sourceEventId;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Objects.equals(anomalyId, that.anomalyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyId);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "anomalyId='" + anomalyId + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", severity=" + severity +
                ", confidence=" + confidence +
                ", sourceId='" + sourceId + '\'' +
                ", description='" + description + '\'' +
                '}';
    }
}
