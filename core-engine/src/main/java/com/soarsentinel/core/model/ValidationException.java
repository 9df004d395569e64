package com.soarsentinel.core.model;

/**
 * Raised when an inbound event, alert or parameter is malformed.
 *
 * <p>
 * Validation failures are rejected before they enter the pipeline and are
 * never retried internally. The offending field is carried so the HTTP layer
 * can name it in the error body.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * @return dotted path of the missing or invalid field, e.g. {@code payload.query}
     */
    public String getField() {
        return field;
    }
}
