package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One attempted state mutation (or no-op) taken in response to an alert or
 * an operator call. Immutable; appended once to the action log.
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class Action {

    private final String actionId;
    private final ActionType actionType;
    private final String target;
    private final ActionStatus status;
    private final String message;
    private final Instant executedAt;
    private final String alertId;
    private final Map<String, Object> details;

    private Action(Builder builder) {
        this.actionId = builder.actionId != null ? builder.actionId : UUID.randomUUID().toString();
        this.actionType = Objects.requireNonNull(builder.actionType, "actionType must not be null");
        this.target = builder.target;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.message = builder.message;
        this.executedAt = Objects.requireNonNull(builder.executedAt, "executedAt must not be null");
        this.alertId = builder.alertId;
        this.details = builder.details.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getActionId() {
        return actionId;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public String getTarget() {
        return target;
    }

    public ActionStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public Instant getExecutedAt() {
        return executedAt;
    }

    /**
     * @return id of the triggering alert, or {@code null} for operator calls
     */
    public String getAlertId() {
        return alertId;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Fluent builder for {@link Action}. {@code actionType}, {@code status}
     * and {@code executedAt} are required.
     */
    public static class Builder {
        private String actionId;
        private ActionType actionType;
        private String target;
        private ActionStatus status;
        private String message;
        private Instant executedAt;
        private String alertId;
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Builder actionId(String actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder actionType(ActionType actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder status(ActionStatus status) {
            this.status = status;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder executedAt(Instant executedAt) {
            this.executedAt = executedAt;
            return this;
        }

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Action build() {
            return new Action(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Action that))
            return false;
        return Objects.equals(actionId, that.actionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(actionId);
    }

    @Override
    public String toString() {
        return "Action{" +
                "type=" + actionType.id() +
                ", target='" + target + '\'' +
                ", status=" + status.id() +
                ", alertId='" + alertId + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
