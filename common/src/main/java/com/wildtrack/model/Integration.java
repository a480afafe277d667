package com.wildtrack.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A configured connection to one vendor account.
 *
 * <p>The id scopes everything the pipeline persists: staged blobs live under it and the
 * staging groups are prefixed with it, so integrations never share state.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Integration {

    private String id;
    private String name;
    private List<IntegrationConfiguration> configurations = new ArrayList<>();

    /**
     * Returns the configuration entry registered for the given action, if any.
     */
    public Optional<IntegrationConfiguration> findConfiguration(String actionId) {
        if (configurations == null) {
            return Optional.empty();
        }
        return configurations.stream()
                .filter(c -> actionId.equals(c.getAction()))
                .findFirst();
    }
}
