/**
 * Domain model shared by every stage of the pipeline.
 *
 * <ul>
 * <li>{@link com.soarsentinel.core.model.TelemetryEvent}: validated inbound
 * telemetry</li>
 * <li>{@link com.soarsentinel.core.model.Anomaly}: a single rule firing</li>
 * <li>{@link com.soarsentinel.core.model.Alert}: deduplicated, human-facing
 * finding</li>
 * <li>{@link com.soarsentinel.core.model.Action}: one recorded defensive
 * step</li>
 * <li>{@link com.soarsentinel.core.model.ThreatRule}: closed rule catalogue
 * binding detector, template and playbook</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.soarsentinel.core.model;
