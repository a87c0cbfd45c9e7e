package com.mouse.cricket.utils;

import lombok.extern.slf4j.Slf4j;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Turns the date/time text of a fixtures card into an absolute instant.
 * Accepts "19 Oct 2026, 14:30 GMT", the same text without a zone (read in the
 * default zone) and ISO-8601 date-times.
 */
@Slf4j
public final class MatchTimeParser {

    private static final DateTimeFormatter CARD_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d MMM yyyy, HH:mm")
            .optionalStart()
            .appendLiteral(' ')
            .appendZoneText(TextStyle.SHORT)
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private MatchTimeParser() {}

    public static Optional<Instant> parse(String text, ZoneId defaultZone) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim().replaceAll("\\s+", " ");

        return attempt(value, () -> fromCard(value, defaultZone))
                .or(() -> attempt(value, () -> OffsetDateTime.parse(value).toInstant()))
                .or(() -> attempt(value, () -> LocalDateTime.parse(value).atZone(defaultZone).toInstant()));
    }

    private static Instant fromCard(String value, ZoneId defaultZone) {
        TemporalAccessor parsed = CARD_FORMAT.parseBest(value, ZonedDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        return ((LocalDateTime) parsed).atZone(defaultZone).toInstant();
    }

    private static Optional<Instant> attempt(String value, Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            log.trace("'{}' did not match: {}", value, e.getMessage());
            return Optional.empty();
        }
    }
}
