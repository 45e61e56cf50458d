package io.remindrunr.schedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats the date inputs accepted by the API.
 *
 * <p>Supported inputs are {@code "YYYY/M/D HH:MM"} (interpreted in the given zone)
 * and ISO-8601 with or without offset.</p>
 */
public final class FlexibleDates {

    private static final Pattern SLASHED = Pattern.compile("^(\\d{4})/(\\d{1,2})/(\\d{1,2})\\s+(\\d{1,2}):(\\d{2})$");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy/M/d HH:mm");

    private FlexibleDates() {
    }

    public static Instant parse(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            throw new InvalidScheduleException("Date string is required");
        }
        String input = value.trim();

        Matcher m = SLASHED.matcher(input);
        if (m.matches()) {
            try {
                return LocalDateTime.of(
                        Integer.parseInt(m.group(1)),
                        Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(3)),
                        Integer.parseInt(m.group(4)),
                        Integer.parseInt(m.group(5))
                ).atZone(zone).toInstant();
            } catch (DateTimeException e) {
                throw new InvalidScheduleException("Invalid date values: " + input, e);
            }
        }

        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(input, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleException(
                    "Invalid date format. Supported formats: \"YYYY/M/D HH:MM\" or ISO 8601", e);
        }
    }

    public static String format(Instant instant, ZoneId zone) {
        return ZonedDateTime.ofInstant(instant, zone).format(DISPLAY);
    }
}
