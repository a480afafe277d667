package com.wildtrack.errors;

/**
 * Raised when the shared group store fails while moving a staging file between states.
 */
public class StateTransitionException extends WildtrackException {

    private static final long serialVersionUID = 1L;

    public StateTransitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
