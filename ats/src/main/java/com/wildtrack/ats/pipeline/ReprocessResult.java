package com.wildtrack.ats.pipeline;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of reprocessing one file.  A failed run reports zero observations and a message.
 */
@Value
public class ReprocessResult {

    int observationsProcessed;
    String message;

    public static ReprocessResult processed(int observations) {
        return new ReprocessResult(observations, null);
    }

    public static ReprocessResult failed(String filename, String error) {
        return new ReprocessResult(0, "Reprocess for file '" + filename + "' failed. Error: " + error + ".");
    }

    public boolean isFailed() {
        return message != null;
    }

    public Map<String, Object> toResponse() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("observations_processed", observationsProcessed);
        if (message != null) {
            response.put("message", message);
        }
        return response;
    }
}
