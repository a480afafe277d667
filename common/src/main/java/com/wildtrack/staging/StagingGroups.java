package com.wildtrack.staging;

/**
 * Names of the three staging groups of one integration, e.g.
 * {@code 6f1c…:ats_pending_files}.
 */
public final class StagingGroups {

    private final String integrationId;
    private final String prefix;

    public StagingGroups(String integrationId, String prefix) {
        this.integrationId = integrationId;
        this.prefix = prefix;
    }

    public String groupFor(FileStatus status) {
        return integrationId + ":" + prefix + "_" + status.getGroupSuffix();
    }

    public String pending() {
        return groupFor(FileStatus.PENDING);
    }

    public String inProgress() {
        return groupFor(FileStatus.IN_PROGRESS);
    }

    public String processed() {
        return groupFor(FileStatus.PROCESSED);
    }
}
