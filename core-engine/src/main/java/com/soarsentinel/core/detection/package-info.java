/**
 * Rule engine: turns telemetry events into anomalies.
 *
 * <p>
 * {@link com.soarsentinel.core.detection.RuleEngine} runs one
 * {@link com.soarsentinel.core.detection.AnomalyDetector} per enabled rule,
 * created by {@link com.soarsentinel.core.detection.DetectorFactory} from the
 * catalogue kind of the rule:
 * </p>
 * <ul>
 * <li>{@link com.soarsentinel.core.detection.PatternDetector}: regex
 * signatures over payload strings</li>
 * <li>{@link com.soarsentinel.core.detection.RateSpikeDetector}: events per
 * source within a sliding window</li>
 * <li>{@link com.soarsentinel.core.detection.DistinctValueDetector}: distinct
 * field values per source within a sliding window</li>
 * <li>{@link com.soarsentinel.core.detection.ThresholdDetector}: static
 * numeric threshold</li>
 * <li>{@link com.soarsentinel.core.detection.CredentialDetector}: protected
 * access without credentials</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.soarsentinel.core.detection;
