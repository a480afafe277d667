package com.wildtrack.ats.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VendorValuesTest {

    @ParameterizedTest
    @ValueSource(strings = {"true", "True", "1", "yes", "Y", " on "})
    void trueLiterals(String raw) {
        assertEquals(Optional.of(Boolean.TRUE), VendorValues.parseBoolean(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "FALSE", "0", "No", "n", "off"})
    void falseLiterals(String raw) {
        assertEquals(Optional.of(Boolean.FALSE), VendorValues.parseBoolean(raw));
    }

    @Test
    void otherTextIsNotABoolean() {
        assertTrue(VendorValues.parseBoolean("maybe").isEmpty());
        assertTrue(VendorValues.parseBoolean(null).isEmpty());
        assertEquals("maybe", VendorValues.booleanOrVerbatim("maybe"));
        assertNull(VendorValues.booleanOrVerbatim(null));
    }

    @Test
    void timestampsInVendorLayouts() {
        LocalDateTime expected = LocalDateTime.of(2023, 1, 25, 19, 0);

        assertEquals(expected, VendorValues.parseTimestamp("2023-01-25T19:00:00"));
        assertEquals(expected, VendorValues.parseTimestamp("2023-01-25 19:00:00"));
        assertEquals(expected, VendorValues.parseTimestamp("2023-01-25T19:00:00-06:00"));
        assertEquals(expected.withNano(123_000_000), VendorValues.parseTimestamp("2023-01-25T19:00:00.123"));
    }

    @Test
    void garbageTimestampIsRejected() {
        assertThrows(DateTimeParseException.class, () -> VendorValues.parseTimestamp("25/01/2023"));
    }
}
