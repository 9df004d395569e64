package com.soarsentinel.core.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Anomaly;

import java.util.List;

/**
 * What one event produced on its way through the pipeline.
 *
 * @since 1.0.0
 */
public final class PipelineResult {

    private final String eventId;
    private final List<Anomaly> anomalies;
    private final List<Alert> alerts;
    private final List<Action> actions;

    PipelineResult(String eventId, List<Anomaly> anomalies, List<Alert> alerts, List<Action> actions) {
        this.eventId = eventId;
        this.anomalies = List.copyOf(anomalies);
        this.alerts = List.copyOf(alerts);
        this.actions = List.copyOf(actions);
    }

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    @JsonProperty("anomalies_detected")
    public int getAnomaliesDetected() {
        return anomalies.size();
    }

    @JsonProperty("anomalies")
    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    @JsonProperty("alerts_created")
    public int getAlertsCreated() {
        return alerts.size();
    }

    @JsonProperty("actions_executed")
    public int getActionsExecuted() {
        return actions.size();
    }

    @JsonIgnore
    public List<Alert> getAlerts() {
        return alerts;
    }

    @JsonIgnore
    public List<Action> getActions() {
        return actions;
    }

    @Override
    public String toString() {
        return "PipelineResult{eventId='" + eventId + "', anomalies=" + anomalies.size()
                + ", alerts=" + alerts.size() + ", actions=" + actions.size() + '}';
    }
}
