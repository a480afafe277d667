package com.wildtrack.integration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildtrack.errors.ConfigurationNotFoundException;
import com.wildtrack.errors.WildtrackException;
import com.wildtrack.model.Integration;
import com.wildtrack.model.IntegrationConfiguration;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves settings from the configuration list carried by the {@link Integration} itself,
 * converting the free-form data map with Jackson.
 */
@Slf4j
public class DefaultConfigurationResolver implements ConfigurationResolver {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public <T> T resolve(Integration integration, String actionId, Class<T> settingsType) {
        IntegrationConfiguration configuration = integration.findConfiguration(actionId)
                .orElseThrow(() -> new ConfigurationNotFoundException(
                        "Settings for action '" + actionId + "' in integration " + integration.getId()
                                + " are missing. Please fix the integration setup in the portal."));
        try {
            return objectMapper.convertValue(configuration.getData(), settingsType);
        } catch (IllegalArgumentException e) {
            log.error("Invalid '{}' settings for integration {}: {}",
                    actionId, integration.getId(), e.getMessage());
            throw new WildtrackException("Invalid '" + actionId + "' settings for integration "
                    + integration.getId(), e);
        }
    }
}
