package com.wildtrack.ats.transform;

import com.wildtrack.ats.model.VendorLocationRecord;
import com.wildtrack.ats.time.TimeCorrectionEngine;
import com.wildtrack.model.TransformedObservation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps one device's location fixes to downstream observations.
 *
 * <p>The device id becomes both {@code source} and {@code source_name}; the recorded time is
 * the naive vendor timestamp with the device's offset attached; every optional vendor field
 * that is present travels in {@code additional}.</p>
 */
@Slf4j
public class ObservationTransformer {

    private final TimeCorrectionEngine timeCorrection;

    public ObservationTransformer(TimeCorrectionEngine timeCorrection) {
        this.timeCorrection = timeCorrection;
    }

    public List<TransformedObservation> transform(String deviceId, List<VendorLocationRecord> records,
                                                  int offsetHours, String integrationId) {
        // validated once per device so an invalid offset is reported once per run
        int offset = timeCorrection.effectiveOffset(deviceId, offsetHours, integrationId);

        List<TransformedObservation> observations = new ArrayList<>(records.size());
        for (VendorLocationRecord record : records) {
            observations.add(TransformedObservation.builder()
                    .source(record.getAtsSerialNum())
                    .sourceName(record.getAtsSerialNum())
                    .recordedAt(timeCorrection.applyOffset(record.getDateYearAndJulian(), offset))
                    .location(new TransformedObservation.Location(record.getLatitude(), record.getLongitude()))
                    .additional(record.optionalFields())
                    .build());
        }
        log.debug("Transformed {} data points of device {} with GMT offset {}", observations.size(), deviceId, offset);
        return observations;
    }
}
