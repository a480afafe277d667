package com.wildtrack.ats.pipeline;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What one pull staged: the number of data points in the payload and the blob holding it.
 */
@Value
public class PullResult {

    int observationsExtracted;
    String fileName;

    public Map<String, Object> toResponse() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("observations_extracted", observationsExtracted);
        response.put("file_name", fileName);
        return response;
    }
}
