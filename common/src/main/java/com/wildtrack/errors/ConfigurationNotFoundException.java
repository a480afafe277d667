package com.wildtrack.errors;

/**
 * Raised when an integration has no configuration entry for the requested action.
 * Fatal for the run: an operator has to fix the integration setup, so it is never retried.
 */
public class ConfigurationNotFoundException extends WildtrackException {

    private static final long serialVersionUID = 1L;

    public ConfigurationNotFoundException(String message) {
        super(message);
    }
}
