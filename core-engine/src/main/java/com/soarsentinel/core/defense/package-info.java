/**
 * Defensive state: blocked and throttled sources, isolated services and the
 * action log, behind one store with per-key atomic mutations.
 */
package com.soarsentinel.core.defense;
