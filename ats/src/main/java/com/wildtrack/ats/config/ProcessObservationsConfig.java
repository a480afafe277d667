package com.wildtrack.ats.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProcessObservationsConfig {

    public static final int DEFAULT_OBSERVATIONS_PER_REQUEST = 200;

    /** Observations sent per dispatch call. */
    @JsonProperty("observations_per_request")
    private int observationsPerRequest = DEFAULT_OBSERVATIONS_PER_REQUEST;
}
