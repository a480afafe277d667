package com.wildtrack.ats.pipeline;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of processing every pending file of an integration: the observations dispatched
 * and, per file that could not be processed, the reason.
 */
@Value
public class PendingRunResult {

    int observationsProcessed;
    Map<String, String> failedFiles;

    public static PendingRunResult empty() {
        return new PendingRunResult(0, Collections.emptyMap());
    }

    public PendingRunResult plus(int observations) {
        return new PendingRunResult(observationsProcessed + observations, failedFiles);
    }

    public PendingRunResult withFailure(String filename, String reason) {
        Map<String, String> failures = new LinkedHashMap<>(failedFiles);
        failures.put(filename, reason);
        return new PendingRunResult(observationsProcessed, Collections.unmodifiableMap(failures));
    }

    public boolean hasFailures() {
        return !failedFiles.isEmpty();
    }

    public Map<String, Object> toResponse() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("observations_processed", observationsProcessed);
        if (hasFailures()) {
            response.put("failed_files", failedFiles);
        }
        return response;
    }
}
