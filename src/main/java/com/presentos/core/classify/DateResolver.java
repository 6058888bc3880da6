package com.presentos.core.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lenient ISO-8601 parsing for dates produced by the classifier.
 * <p>
 * Accepts offset and zoned date-times as-is, interprets local date-times in the
 * router's zone and maps a bare date to 23:59 local time on that day.
 */
final class DateResolver {

    private static final Logger log = LoggerFactory.getLogger(DateResolver.class);

    private static final Set<String> EMPTY_MARKERS = Set.of("null", "none", "n/a", "unspecified");
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59);

    private DateResolver() {}

    static Optional<OffsetDateTime> parse(String value, ZoneId zone) {
        if (value == null || value.isBlank() || EMPTY_MARKERS.contains(value.strip().toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        String text = value.strip();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned.toOffsetDateTime());
            }
            return Optional.of(((LocalDateTime) parsed).atZone(zone).toOffsetDateTime());
        } catch (DateTimeParseException e) {
            return parseDate(text, zone);
        }
    }

    private static Optional<OffsetDateTime> parseDate(String text, ZoneId zone) {
        try {
            return Optional.of(LocalDate.parse(text).atTime(END_OF_DAY).atZone(zone).toOffsetDateTime());
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }
}
