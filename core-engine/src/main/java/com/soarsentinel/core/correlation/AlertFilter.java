package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.ValidationException;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * View over the alert book.
 *
 * @since 1.0.0
 */
public enum AlertFilter implements Predicate<Alert> {

    ALL {
        @Override
        public boolean test(Alert alert) {
            return true;
        }
    },
    ACTIVE {
        @Override
        public boolean test(Alert alert) {
            return !alert.isAcknowledged();
        }
    },
    ACKNOWLEDGED {
        @Override
        public boolean test(Alert alert) {
            return alert.isAcknowledged();
        }
    };

    /**
     * @param value {@code all}, {@code active} or {@code acknowledged}; {@code null} means all
     * @throws ValidationException for any other value
     */
    public static AlertFilter parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("filter",
                    "filter must be one of all, active, acknowledged; got '" + value + "'", e);
        }
    }
}
