package com.soarsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one attempted action.
 *
 * @since 1.0.0
 */
public enum ActionStatus {

    /** State was changed, or a pure notification went out. */
    SUCCESS("success"),

    /** The desired state was already in effect, or there was no usable target. */
    SKIPPED("skipped"),

    /** The defense state store rejected the mutation. */
    FAILED("failed");

    private final String id;

    ActionStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
