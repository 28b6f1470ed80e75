package in.kirim.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * ISO-8601 parsing for user supplied instants.
 *
 * Accepts an instant ("2026-01-07T05:30:00Z"), an offset date-time
 * ("2026-01-07T12:30:00+07:00") or a local date-time ("2026-01-07T12:30"),
 * the last one interpreted in the configured zone.
 */
public final class Timestamps {

    private static final Pattern OFFSET_SUFFIX = Pattern.compile(".*T.*[+-]\\d{2}:?\\d{2}$");

    public static Optional<Instant> parse(String text, ZoneId zone) {
        if (text == null) return Optional.empty();
        String value = text.trim();
        if (value.isEmpty()) return Optional.empty();
        try {
            if (value.endsWith("Z") || OFFSET_SUFFIX.matcher(value).matches()) {
                return Optional.of(OffsetDateTime.parse(value).toInstant());
            }
            return Optional.of(LocalDateTime.parse(value).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Timestamps() {}
}
