package com.wildtrack.ats.model;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lenient readers for the scalar encodings found in ATS responses.
 */
public final class VendorValues {

    private static final Set<String> TRUE_LITERALS = Set.of("true", "1", "yes", "y", "on", "t");
    private static final Set<String> FALSE_LITERALS = Set.of("false", "0", "no", "n", "off", "f");

    private VendorValues() {
        // utility class
    }

    /**
     * Reads a boolean literal ({@code true/false}, {@code 1/0}, {@code yes/no}, ...).
     */
    public static Optional<Boolean> parseBoolean(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(normalized)) {
            return Optional.of(Boolean.TRUE);
        }
        if (FALSE_LITERALS.contains(normalized)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /**
     * The boolean the value stands for, or the value itself when it is not a boolean literal.
     */
    public static Object booleanOrVerbatim(String raw) {
        if (raw == null) {
            return null;
        }
        return parseBoolean(raw).<Object>map(b -> b).orElse(raw);
    }

    /**
     * Parses a vendor timestamp into naive wall-clock time.
     *
     * <p>Accepts ISO local date-times with {@code T} or a space as separator, with or without
     * fractional seconds.  An explicit offset is dropped: the device offset is applied later.</p>
     *
     * @throws DateTimeParseException if the text is not a timestamp
     */
    public static LocalDateTime parseTimestamp(String raw) {
        String text = raw.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(text).toLocalDateTime();
        }
    }
}
