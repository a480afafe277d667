package com.wildtrack.staging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StagingGroupsTest {

    @Test
    void groupNamesAreScopedByIntegration() {
        StagingGroups groups = new StagingGroups("abc", "ats");

        assertEquals("abc:ats_pending_files", groups.pending());
        assertEquals("abc:ats_in_progress_files", groups.inProgress());
        assertEquals("abc:ats_processed_files", groups.processed());
        assertEquals(groups.processed(), groups.groupFor(FileStatus.PROCESSED));
    }

    @Test
    void statusParsesWireValuesAndNames() {
        assertEquals(FileStatus.IN_PROGRESS, FileStatus.fromValue("in_progress"));
        assertEquals(FileStatus.PROCESSED, FileStatus.fromValue("PROCESSED"));
        assertThrows(IllegalArgumentException.class, () -> FileStatus.fromValue("done"));
    }
}
