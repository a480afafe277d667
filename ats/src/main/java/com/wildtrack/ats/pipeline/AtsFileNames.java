package com.wildtrack.ats.pipeline;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Blob names of one pull: a UTC timestamp with microseconds, the integration id and the
 * payload kind.  The two files of a pull share the timestamp prefix, which is how the
 * processor finds the transmissions that belong to a data-points file.
 */
public class AtsFileNames {

    static final String TRANSMISSIONS_SUFFIX = "_transmissions.xml";
    static final String DATA_POINTS_SUFFIX = "_data_points.xml";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSSSSS").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public AtsFileNames(Clock clock) {
        this.clock = clock;
    }

    /** Timestamp prefix for a new pull. */
    public String newPrefix() {
        return TIMESTAMP.format(clock.instant());
    }

    public static String transmissionsFile(String prefix, String integrationId) {
        return prefix + "_" + integrationId + TRANSMISSIONS_SUFFIX;
    }

    public static String dataPointsFile(String prefix, String integrationId) {
        return prefix + "_" + integrationId + DATA_POINTS_SUFFIX;
    }

    /**
     * Companion transmissions file of a data-points file.
     *
     * @throws IllegalArgumentException if the name is not a data-points file name
     */
    public static String transmissionsFileFor(String dataPointsFile) {
        if (dataPointsFile == null || !dataPointsFile.endsWith(DATA_POINTS_SUFFIX)) {
            throw new IllegalArgumentException("Not a data points file name: " + dataPointsFile);
        }
        return dataPointsFile.substring(0, dataPointsFile.length() - DATA_POINTS_SUFFIX.length())
                + TRANSMISSIONS_SUFFIX;
    }
}
