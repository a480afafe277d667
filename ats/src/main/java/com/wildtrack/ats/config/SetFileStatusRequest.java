package com.wildtrack.ats.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wildtrack.staging.FileStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters of the {@code set_file_status} action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetFileStatusRequest {

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("status")
    private FileStatus status;
}
