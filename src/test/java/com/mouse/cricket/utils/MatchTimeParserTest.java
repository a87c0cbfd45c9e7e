package com.mouse.cricket.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class MatchTimeParserTest {

    @Test
    void parse_cardTextWithZone_usesThatZone() {
        assertThat(MatchTimeParser.parse("19 Oct 2026, 14:30 GMT", ZoneId.of("Asia/Kolkata")))
                .contains(Instant.parse("2026-10-19T14:30:00Z"));
    }

    @Test
    void parse_cardTextWithoutZone_usesDefaultZone() {
        assertThat(MatchTimeParser.parse("19 Oct 2026, 14:30", ZoneOffset.UTC))
                .contains(Instant.parse("2026-10-19T14:30:00Z"));
        assertThat(MatchTimeParser.parse("19 Oct 2026, 20:00", ZoneId.of("Asia/Kolkata")))
                .contains(Instant.parse("2026-10-19T14:30:00Z"));
    }

    @Test
    void parse_extraWhitespaceAndLowercaseMonth_isTolerated() {
        assertThat(MatchTimeParser.parse("  5 oct 2026,   09:05 ", ZoneOffset.UTC))
                .contains(Instant.parse("2026-10-05T09:05:00Z"));
    }

    @Test
    void parse_isoInstantAndOffset_areAccepted() {
        assertThat(MatchTimeParser.parse("2026-10-19T14:30:00Z", ZoneOffset.UTC))
                .contains(Instant.parse("2026-10-19T14:30:00Z"));
        assertThat(MatchTimeParser.parse("2026-10-19T20:00:00+05:30", ZoneOffset.UTC))
                .contains(Instant.parse("2026-10-19T14:30:00Z"));
    }

    @Test
    void parse_isoLocalDateTime_usesDefaultZone() {
        assertThat(MatchTimeParser.parse("2026-10-19T16:30:00", ZoneId.of("Europe/Paris")))
                .contains(Instant.parse("2026-10-19T14:30:00Z"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "Today, 2:30 PM", "TBC", "32 Oct 2026, 14:30"})
    void parse_unparseable_returnsEmpty(String text) {
        assertThat(MatchTimeParser.parse(text, ZoneOffset.UTC)).isEmpty();
    }
}
