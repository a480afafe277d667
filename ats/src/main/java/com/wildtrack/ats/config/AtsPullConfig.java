package com.wildtrack.ats.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Endpoints polled by the {@code pull_observations} action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AtsPullConfig {

    @JsonProperty("data_endpoint")
    private String dataEndpoint;

    @JsonProperty("transmissions_endpoint")
    private String transmissionsEndpoint;
}
