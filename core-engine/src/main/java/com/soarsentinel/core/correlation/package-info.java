/**
 * Correlation of anomalies into alerts: cooldown suppression keyed by rule
 * and source, the bounded alert book and its acknowledgement lifecycle.
 */
package com.soarsentinel.core.correlation;
