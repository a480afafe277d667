package com.wildtrack.errors;

/**
 * Network-level failure (I/O error, timeout, non-2xx status) that is worth retrying.
 */
public class TransientTransportException extends WildtrackException {

    private static final long serialVersionUID = 1L;

    /** HTTP status that caused the failure, or {@code -1} for I/O errors and timeouts. */
    private final int statusCode;

    public TransientTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransientTransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
