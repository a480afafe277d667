package com.wildtrack.ats.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters of the per-file actions ({@code get_file_status}, {@code reprocess_file}).
 * The batch size is only read by reprocessing; when absent the integration's
 * {@code process_observations} setting applies.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileRequest {

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("observations_per_request")
    private Integer observationsPerRequest;

    public FileRequest(String filename) {
        this(filename, null);
    }
}
