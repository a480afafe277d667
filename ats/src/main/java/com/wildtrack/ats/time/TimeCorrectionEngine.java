package com.wildtrack.ats.time;

import com.wildtrack.ats.model.VendorTransmissionRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Turns the collars' naive wall-clock timestamps into offset-aware instants.
 *
 * <p>ATS collars report local time.  The only place the vendor tells us a device's offset is
 * the {@code GmtOffset} of its transmissions, so offsets are derived per run from the
 * transmissions pulled alongside the data points.</p>
 *
 * <p>Offsets are whole hours within ±24.  Anything beyond is treated as invalid and replaced
 * by 0.  Offsets past ±18h, which {@link ZoneOffset} cannot carry, are applied to the instant
 * and the result is expressed in UTC.</p>
 */
@Slf4j
public class TimeCorrectionEngine {

    /** Largest offset, in hours, a device can legitimately report. */
    public static final int MAX_OFFSET_HOURS = 24;

    private static final int MAX_ZONE_OFFSET_HOURS = 18;

    private static final long SECONDS_PER_DAY = 86_400L;

    /**
     * Maps each device to the {@code GmtOffset} of its first transmission (input order).
     * A first transmission without an offset maps its device to 0.
     */
    public Map<String, Integer> deriveOffsets(List<VendorTransmissionRecord> transmissions, String integrationId) {
        if (transmissions == null || transmissions.isEmpty()) {
            log.warn("No transmissions were pulled for integration ID: {}.", integrationId);
            log.warn("-- Setting GMT offset to 0 for devices in integration ID: {}.", integrationId);
            return Collections.emptyMap();
        }

        Map<String, Integer> offsets = new LinkedHashMap<>();
        for (VendorTransmissionRecord transmission : transmissions) {
            Integer offset = transmission.getGmtOffset();
            offsets.putIfAbsent(transmission.getCollarSerialNum(), offset == null ? 0 : offset);
        }
        log.info("-- Integration ID: {}, GMT offsets: {} --", integrationId, offsets);
        return offsets;
    }

    /**
     * The offset to apply for a device: {@code offsetHours} itself, or 0 when it is out of
     * range.  Logs one attention-flagged error per call for an invalid value, so call it once
     * per device and run.
     */
    public int effectiveOffset(String deviceId, int offsetHours, String integrationId) {
        if (Math.abs(offsetHours) > MAX_OFFSET_HOURS) {
            log.atError()
                    .addKeyValue("needs_attention", true)
                    .addKeyValue("integration_id", integrationId)
                    .addKeyValue("device_id", deviceId)
                    .log("GMT offset invalid for device '{}' value '{}'", deviceId, offsetHours);
            return 0;
        }
        return offsetHours;
    }

    /**
     * Attaches an already validated offset to a naive timestamp.  The wall-clock fields are
     * kept as they are when the offset fits a {@link ZoneOffset}; otherwise the same instant
     * is returned in UTC.
     */
    public OffsetDateTime applyOffset(LocalDateTime naiveTimestamp, int offsetHours) {
        if (Math.abs(offsetHours) > MAX_ZONE_OFFSET_HOURS) {
            return naiveTimestamp.minusHours(offsetHours).atOffset(ZoneOffset.UTC);
        }
        return naiveTimestamp.atOffset(ZoneOffset.ofHours(offsetHours));
    }

    /**
     * Validates the offset for the device and attaches it to the timestamp.
     */
    public OffsetDateTime applyOffset(String deviceId, LocalDateTime naiveTimestamp, int offsetHours,
                                      String integrationId) {
        return applyOffset(naiveTimestamp, effectiveOffset(deviceId, offsetHours, integrationId));
    }

    // ── Nearest transmission ─────────────────────────────────────────────

    /**
     * Picks the transmission whose date is nearest to {@code target}, looking at the first
     * transmission sent at or after it.
     *
     * <ol>
     *   <li>Distinct dates are sorted ascending; the running "previous" date starts at the
     *       latest one.</li>
     *   <li>At the first date {@code d >= target}: {@code d} wins when its distance is strictly
     *       smaller than the previous date's, otherwise the previous date wins.</li>
     *   <li>No date at or after {@code target}: the latest transmission.</li>
     * </ol>
     *
     * <p>Distances are whole days, floored, so a date one hour before the target is one day
     * away.  Because "previous" starts at the latest date, a target before every transmission
     * is compared against the latest one.  When several transmissions share the winning date
     * the first in input order is returned.</p>
     */
    public Optional<VendorTransmissionRecord> findNearestTransmission(
            Collection<VendorTransmissionRecord> transmissions, LocalDateTime target) {
        if (transmissions == null || transmissions.isEmpty()) {
            return Optional.empty();
        }

        TreeSet<LocalDateTime> dates = new TreeSet<>();
        for (VendorTransmissionRecord transmission : transmissions) {
            dates.add(transmission.getDateSent());
        }

        LocalDateTime previous = dates.last();
        LocalDateTime chosen = null;
        for (LocalDateTime date : dates) {
            if (!date.isBefore(target)) {
                chosen = Math.abs(daysBetween(target, date)) < Math.abs(daysBetween(target, previous))
                        ? date
                        : previous;
                break;
            }
            previous = date;
        }
        if (chosen == null) {
            chosen = dates.last();
        }

        return firstSentAt(transmissions, chosen);
    }

    private static Optional<VendorTransmissionRecord> firstSentAt(Collection<VendorTransmissionRecord> transmissions,
                                                                  LocalDateTime date) {
        return transmissions.stream()
                .filter(transmission -> transmission.getDateSent().equals(date))
                .findFirst();
    }

    static long daysBetween(LocalDateTime from, LocalDateTime to) {
        return Math.floorDiv(Duration.between(from, to).getSeconds(), SECONDS_PER_DAY);
    }
}
