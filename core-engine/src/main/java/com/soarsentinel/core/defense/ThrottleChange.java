package com.soarsentinel.core.defense;

/**
 * Result of a throttle upsert.
 *
 * @since 1.0.0
 */
public final class ThrottleChange {

    private final Integer previousLimit;
    private final int currentLimit;
    private final boolean applied;

    ThrottleChange(Integer previousLimit, int currentLimit, boolean applied) {
        this.previousLimit = previousLimit;
        this.currentLimit = currentLimit;
        this.applied = applied;
    }

    /**
     * @return the limit in place before the call, or {@code null} if the source was not throttled
     */
    public Integer getPreviousLimit() {
        return previousLimit;
    }

    /**
     * @return the limit in place after the call
     */
    public int getCurrentLimit() {
        return currentLimit;
    }

    /**
     * @return {@code true} if the stored limit changed
     */
    public boolean isApplied() {
        return applied;
    }

    @Override
    public String toString() {
        return "ThrottleChange{previous=" + previousLimit + ", current=" + currentLimit
                + ", applied=" + applied + '}';
    }
}
