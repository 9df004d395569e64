/**
 * Wiring of detection, correlation and response into a single per-event flow.
 */
package com.soarsentinel.core.pipeline;
