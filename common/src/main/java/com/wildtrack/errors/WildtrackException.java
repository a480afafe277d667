package com.wildtrack.errors;

/**
 * Root of the pipeline's unchecked exception hierarchy.
 */
public class WildtrackException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public WildtrackException(String message) {
        super(message);
    }

    public WildtrackException(String message, Throwable cause) {
        super(message, cause);
    }
}
