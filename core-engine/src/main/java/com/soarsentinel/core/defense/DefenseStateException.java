package com.soarsentinel.core.defense;

/**
 * A defense state mutation could not be applied, e.g. because the blocked
 * source capacity is exhausted. The caller records a failed action and moves on.
 *
 * @since 1.0.0
 */
public class DefenseStateException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DefenseStateException(String message) {
        super(message);
    }
}
