package com.wildtrack.staging;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response of the file status actions: {@code file_status} plus an optional message.
 */
@Value
public class FileStatusResult {

    public static final String NOT_FOUND = "Not found";

    String fileStatus;
    String message;

    public static FileStatusResult of(FileStatus status) {
        return new FileStatusResult(status.getValue(), null);
    }

    public static FileStatusResult notFound() {
        return new FileStatusResult(NOT_FOUND, null);
    }

    public Map<String, Object> toResponse() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("file_status", fileStatus);
        if (message != null) {
            response.put("message", message);
        }
        return response;
    }
}
