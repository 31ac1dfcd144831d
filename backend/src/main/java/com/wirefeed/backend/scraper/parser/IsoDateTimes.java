package com.wirefeed.backend.scraper.parser;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lenient ISO 8601 parsing for machine-readable page timestamps.
 * <p>
 * Accepts an offset written as {@code Z}, {@code +HH:MM} or {@code +HHMM}, or no
 * offset at all, in which case the value is taken as UTC. Results are in UTC.
 */
@Slf4j
final class IsoDateTimes {

    private static final DateTimeFormatter ISO_OPTIONAL_OFFSET = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    private IsoDateTimes() {
    }

    /**
     * @return the instant in UTC, or {@code null} when the value is blank or not ISO 8601
     */
    static OffsetDateTime parse(String value) {
        if (value == null || value.isBlank()) return null;
        String text = value.trim();
        try {
            TemporalAccessor parsed = ISO_OPTIONAL_OFFSET.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            OffsetDateTime dateTime = parsed instanceof OffsetDateTime
                    ? (OffsetDateTime) parsed
                    : ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
            return dateTime.withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Malformed datetime '{}'", value);
            return null;
        }
    }
}
