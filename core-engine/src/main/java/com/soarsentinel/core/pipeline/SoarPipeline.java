package com.soarsentinel.core.pipeline;

import com.soarsentinel.core.correlation.AlertCorrelator;
import com.soarsentinel.core.correlation.Correlation;
import com.soarsentinel.core.detection.RuleEngine;
import com.soarsentinel.core.metrics.SentinelMetrics;
import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.TelemetryEvent;
import com.soarsentinel.core.notify.NoopNotifier;
import com.soarsentinel.core.notify.Notifier;
import com.soarsentinel.core.response.ResponseOrchestrator;
import com.soarsentinel.core.response.SourceLocks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * End-to-end flow for one event: detect, correlate, respond, notify.
 *
 * <h3>Ordering</h3>
 * <p>
 * Correlation and response for one source run under that source's striped
 * lock, so actions for a source are logged in the order its alerts were
 * correlated. Different sources proceed in parallel. Notifications are sent
 * after the lock is released.
 * </p>
 *
 * <h3>Auto-response</h3>
 * <p>
 * With auto-response disabled the pipeline stops after detection and only
 * reports anomalies; alerts are then created explicitly via
 * {@link #createAlert(Anomaly)} and playbooks run via {@link #execute(Alert)}.
 * </p>
 *
 * @since 1.0.0
 */
public class SoarPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SoarPipeline.class);

    private final RuleEngine engine;
    private final AlertCorrelator correlator;
    private final ResponseOrchestrator orchestrator;
    private final SourceLocks locks;
    private final Notifier notifier;
    private final SentinelMetrics metrics;
    private final Clock clock;
    private final boolean autoRespond;

    private SoarPipeline(Builder builder) {
        this.engine = Objects.requireNonNull(builder.engine, "engine must not be null");
        this.correlator = Objects.requireNonNull(builder.correlator, "correlator must not be null");
        this.orchestrator = Objects.requireNonNull(builder.orchestrator, "orchestrator must not be null");
        this.locks = Objects.requireNonNull(builder.locks, "locks must not be null");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(builder.clock, "clock must not be null");
        this.notifier = builder.notifier != null ? builder.notifier : NoopNotifier.INSTANCE;
        this.autoRespond = builder.autoRespond;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------

    /**
     * Run one event through the pipeline.
     *
     * @param event inbound event; validated here and stamped with the pipeline clock
     * @return anomalies found and, with auto-response, the alerts and actions they caused
     * @throws com.soarsentinel.core.model.ValidationException if the event is malformed
     */
    public PipelineResult process(TelemetryEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        long start = System.nanoTime();
        // Windows assume arrival order, so a client-supplied received_at is replaced
        TelemetryEvent stamped = event.validate().withReceivedAt(clock.instant());

        List<Anomaly> anomalies = engine.evaluate(stamped);
        if (anomalies.isEmpty() || !autoRespond) {
            metrics.recordLatency(System.nanoTime() - start);
            return new PipelineResult(stamped.getEventId(), anomalies,
                    Collections.emptyList(), Collections.emptyList());
        }

        List<Alert> alerts = new ArrayList<>();
        List<Action> actions = new ArrayList<>();
        List<List<Action>> perAlert = new ArrayList<>();

        ReentrantLock lock = locks.forSource(stamped.getSourceId());
        lock.lock();
        try {
            for (Anomaly anomaly : anomalies) {
                Correlation correlation = correlator.correlate(anomaly);
                if (correlation.isSuppressed()) {
                    continue;
                }
                Alert alert = correlation.getAlert().orElseThrow();
                List<Action> executed = orchestrator.respond(alert);
                alerts.add(alert);
                actions.addAll(executed);
                perAlert.add(executed);
            }
        } finally {
            lock.unlock();
        }

        for (int i = 0; i < alerts.size(); i++) {
            notifier.alertRaised(alerts.get(i));
            notifier.actionsExecuted(alerts.get(i), perAlert.get(i));
        }

        metrics.recordLatency(System.nanoTime() - start);
        LOG.debug("Event {} from '{}': {} anomalies, {} alerts, {} actions", stamped.getEventId(),
                stamped.getSourceId(), anomalies.size(), alerts.size(), actions.size());
        return new PipelineResult(stamped.getEventId(), anomalies, alerts, actions);
    }

    /**
     * Run a batch of events in order.
     */
    public List<PipelineResult> processAll(List<TelemetryEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        List<PipelineResult> results = new ArrayList<>(events.size());
        for (TelemetryEvent event : events) {
            results.add(process(event));
        }
        return results;
    }

    /**
     * Correlate an externally produced anomaly without running its playbook.
     *
     * @param anomaly anomaly posted by an external scorer or operator; validated here
     * @return the created alert, or the suppression result
     */
    public Correlation createAlert(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        anomaly.validate();
        if (anomaly.getDetectedAt() == null) {
            anomaly.setDetectedAt(clock.instant());
        }
        Correlation correlation;
        ReentrantLock lock = locks.forSource(anomaly.effectiveSourceId());
        lock.lock();
        try {
            correlation = correlator.correlate(anomaly);
        } finally {
            lock.unlock();
        }
        correlation.getAlert().ifPresent(notifier::alertRaised);
        return correlation;
    }

    /**
     * Run the playbook for an alert supplied by the caller.
     *
     * @param alert alert to respond to; validated here
     * @return the recorded actions
     */
    public List<Action> execute(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        alert.validate();
        if (alert.getCreatedAt() == null) {
            alert.setCreatedAt(clock.instant());
        }
        List<Action> actions = orchestrator.respond(alert);
        notifier.actionsExecuted(alert, actions);
        return actions;
    }

    public RuleEngine getEngine() {
        return engine;
    }

    public AlertCorrelator getCorrelator() {
        return correlator;
    }

    public ResponseOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public SentinelMetrics getMetrics() {
        return metrics;
    }

    public boolean isAutoRespond() {
        return autoRespond;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link SoarPipeline}. All collaborators except the
     * notifier are required; auto-response defaults to enabled.
     */
    public static class Builder {
        private RuleEngine engine;
        private AlertCorrelator correlator;
        private ResponseOrchestrator orchestrator;
        private SourceLocks locks;
        private Notifier notifier;
        private SentinelMetrics metrics;
        private Clock clock;
        private boolean autoRespond = true;

        private Builder() {
        }

        public Builder engine(RuleEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder correlator(AlertCorrelator correlator) {
            this.correlator = correlator;
            return this;
        }

        public Builder orchestrator(ResponseOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        public Builder locks(SourceLocks locks) {
            this.locks = locks;
            return this;
        }

        public Builder notifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder metrics(SentinelMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder autoRespond(boolean autoRespond) {
            this.autoRespond = autoRespond;
            return this;
        }

        public SoarPipeline build() {
            return new SoarPipeline(this);
        }
    }
}
