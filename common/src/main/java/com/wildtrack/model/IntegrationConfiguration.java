package com.wildtrack.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Settings an integration holds for one action (e.g. {@code auth}, {@code pull_observations}).
 * The {@code data} map is free-form and converted to a typed settings class on demand.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntegrationConfiguration {

    private String action;
    private Map<String, Object> data = new HashMap<>();
}
