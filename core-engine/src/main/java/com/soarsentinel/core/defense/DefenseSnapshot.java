package com.soarsentinel.core.defense;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Consistent point-in-time copy of the defense state. Lists and maps are
 * sorted and unmodifiable.
 *
 * @since 1.0.0
 */
public final class DefenseSnapshot {

    private final List<String> blockedIps;
    private final Map<String, Integer> throttledIps;
    private final List<String> isolatedServices;
    private final int actionsExecuted;

    DefenseSnapshot(List<String> blockedIps, Map<String, Integer> throttledIps,
                    List<String> isolatedServices, int actionsExecuted) {
        this.blockedIps = Collections.unmodifiableList(blockedIps);
        this.throttledIps = Collections.unmodifiableMap(throttledIps);
        this.isolatedServices = Collections.unmodifiableList(isolatedServices);
        this.actionsExecuted = actionsExecuted;
    }

    @JsonProperty("blocked_ips")
    public List<String> getBlockedIps() {
        return blockedIps;
    }

    @JsonProperty("throttled_ips")
    public Map<String, Integer> getThrottledIps() {
        return throttledIps;
    }

    @JsonProperty("isolated_services")
    public List<String> getIsolatedServices() {
        return isolatedServices;
    }

    /**
     * @return number of actions currently retained in the action log
     */
    @JsonProperty("actions_executed")
    public int getActionsExecuted() {
        return actionsExecuted;
    }

    @Override
    public String toString() {
        return "DefenseSnapshot{blocked=" + blockedIps.size() + ", throttled=" + throttledIps.size()
                + ", isolated=" + isolatedServices.size() + ", actions=" + actionsExecuted + '}';
    }
}
