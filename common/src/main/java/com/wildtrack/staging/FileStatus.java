package com.wildtrack.staging;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle states of a staged payload file.  Each state is backed by one group in the
 * {@link com.wildtrack.state.GroupStore}.
 */
public enum FileStatus {

    PENDING("pending", "pending_files"),
    IN_PROGRESS("in_progress", "in_progress_files"),
    PROCESSED("processed", "processed_files");

    private final String value;
    private final String groupSuffix;

    FileStatus(String value, String groupSuffix) {
        this.value = value;
        this.groupSuffix = groupSuffix;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    String getGroupSuffix() {
        return groupSuffix;
    }

    @JsonCreator
    public static FileStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown file status: " + value));
    }
}
