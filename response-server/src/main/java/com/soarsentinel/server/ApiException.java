package com.soarsentinel.server;

/**
 * Request failure that maps directly to an HTTP status and error code.
 *
 * @since 1.0.0
 */
public class ApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String error;

    public ApiException(int status, String error, String message) {
        super(message);
        this.status = status;
        this.error = error;
    }

    static ApiException notFound(String message) {
        return new ApiException(404, "not_found", message);
    }

    static ApiException methodNotAllowed(String method, String path) {
        return new ApiException(405, "method_not_allowed", method + " is not supported on " + path);
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }
}
