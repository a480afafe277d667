package com.wildtrack.ats.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class AtsFileNamesTest {

    @Test
    void prefixIsUtcTimestampWithMicroseconds() {
        Clock clock = Clock.fixed(Instant.parse("2023-01-25T17:04:05.123456Z"), ZoneId.of("America/Denver"));

        assertEquals("20230125170405123456", new AtsFileNames(clock).newPrefix());
    }

    @Test
    void filesOfOnePullSharePrefix() {
        String dataPoints = AtsFileNames.dataPointsFile("20230125170405123456", "int-1");
        String transmissions = AtsFileNames.transmissionsFile("20230125170405123456", "int-1");

        assertEquals("20230125170405123456_int-1_data_points.xml", dataPoints);
        assertEquals("20230125170405123456_int-1_transmissions.xml", transmissions);
        assertEquals(transmissions, AtsFileNames.transmissionsFileFor(dataPoints));
    }

    @Test
    void companionOfOtherNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AtsFileNames.transmissionsFileFor("test_file.xml"));
        assertThrows(IllegalArgumentException.class, () -> AtsFileNames.transmissionsFileFor(null));
    }
}
