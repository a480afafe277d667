package com.wildtrack.integration;

import com.wildtrack.errors.ConfigurationNotFoundException;
import com.wildtrack.model.Integration;

/**
 * Resolves the typed settings an integration holds for an action.
 */
public interface ConfigurationResolver {

    /**
     * Looks up the configuration registered for {@code actionId} and converts its data
     * into {@code settingsType}.
     *
     * @throws ConfigurationNotFoundException if the integration has no entry for the action
     */
    <T> T resolve(Integration integration, String actionId, Class<T> settingsType);
}
