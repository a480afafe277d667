package com.wildtrack.ats.config;

/**
 * Action ids under which an integration carries its ATS settings.
 */
public final class AtsActions {

    public static final String AUTH = "auth";
    public static final String PULL_OBSERVATIONS = "pull_observations";
    public static final String PROCESS_OBSERVATIONS = "process_observations";
    public static final String GET_FILE_STATUS = "get_file_status";
    public static final String SET_FILE_STATUS = "set_file_status";
    public static final String REPROCESS_FILE = "reprocess_file";

    private AtsActions() {
    }
}
