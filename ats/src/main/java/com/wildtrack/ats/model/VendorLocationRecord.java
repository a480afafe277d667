package com.wildtrack.ats.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One location fix ("data point") reported by an ATS collar.
 *
 * <p>The recorded timestamp is naive: it is the collar's wall-clock time and only becomes an
 * instant once the device's GMT offset is applied.  The optional vendor fields are kept as
 * the vendor wrote them, because their encoding varies between firmware versions.</p>
 */
@Value
@Builder
public class VendorLocationRecord {

    String atsSerialNum;
    Double longitude;
    Double latitude;
    LocalDateTime dateYearAndJulian;

    String numSats;
    String hdop;
    String fixTime;
    String dimension;
    String activity;
    String temperature;
    String mortality;
    String lowBattVoltage;

    /**
     * The optional vendor fields that are present, under their downstream (snake_case) names.
     * Flags that read as booleans are passed on as booleans; anything else verbatim.
     */
    public Map<String, Object> optionalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfNotNull(fields, "num_sats", numSats);
        putIfNotNull(fields, "hdop", hdop);
        putIfNotNull(fields, "fix_time", fixTime);
        putIfNotNull(fields, "dimension", dimension);
        putIfNotNull(fields, "activity", activity);
        putIfNotNull(fields, "temperature", temperature);
        putIfNotNull(fields, "mortality", VendorValues.booleanOrVerbatim(mortality));
        putIfNotNull(fields, "low_batt_voltage", VendorValues.booleanOrVerbatim(lowBattVoltage));
        return fields;
    }

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
