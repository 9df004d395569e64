package com.soarsentinel.core.detection;

import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.TelemetryEvent;
import com.soarsentinel.core.model.ThreatRule;

import java.util.Optional;

/**
 * Contract for all detectors.
 * <p>
 * A detector enforces exactly one catalogue rule. Window-based detectors keep
 * per-source state internally and must be safe for concurrent calls; the
 * others are stateless.
 * </p>
 * <p>
 * Implementations must not throw on missing or mistyped payload fields: a
 * rule that cannot read what it needs simply does not fire.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate a single event.
     *
     * @param event the incoming event, already stamped with its receive time
     * @return an {@link Anomaly} if the rule fires, empty otherwise
     */
    Optional<Anomaly> evaluate(TelemetryEvent event);

    /**
     * @return the catalogue rule this detector enforces
     */
    ThreatRule getRule();
}
