package io.github.drompincen.remindclaw.runtime.reminder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;

import static org.assertj.core.api.Assertions.assertThat;

class NaturalDateParserTest {

    // Monday
    private static final ZonedDateTime NOW = ZonedDateTime.of(2026, 3, 2, 8, 0, 0, 0, ZoneId.of("UTC"));

    private final NaturalDateParser parser = new NaturalDateParser();

    @ParameterizedTest
    @CsvSource({
            "tomorrow, 2026-03-03T09:00",
            "tomorrow at 3pm, 2026-03-03T15:00",
            "Tomorrow 10:30 AM, 2026-03-03T10:30",
            "today at 5:30pm, 2026-03-02T17:30",
            "tonight, 2026-03-02T20:00",
            "next monday, 2026-03-09T09:00",
            "friday at 10am, 2026-03-06T10:00",
            "on wed at noon, 2026-03-04T12:00",
            "dec 25, 2026-12-25T09:00",
            "25 december, 2026-12-25T09:00",
            "the 4th of july at 8pm, 2026-07-04T20:00",
            "2024-12-25, 2024-12-25T00:00",
            "2024-12-25 10:00, 2024-12-25T10:00",
            "2026-04-01T07:15, 2026-04-01T07:15",
            "3pm, 2026-03-02T15:00",
            "at midnight, 2026-03-02T00:00",
            "next week, 2026-03-09T08:00",
            "next month, 2026-04-02T08:00"
    })
    void readsCommonPhrases(String text, String expected) {
        Temporal result = parser.parse(text, NOW).orElseThrow();

        assertThat(result).isEqualTo(LocalDateTime.parse(expected));
    }

    @Test
    void monthNameWithYearAndTime() {
        Temporal result = parser.parse("December 25, 2027 at 8pm", NOW).orElseThrow();

        assertThat(result).isEqualTo(LocalDateTime.of(2027, 12, 25, 20, 0));
    }

    @Test
    void isoInstantKeepsItsZone() {
        Temporal result = parser.parse("2026-03-01T10:00:00Z", NOW).orElseThrow();

        assertThat(Instant.from(result)).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"blorp", "feb 30", "13pm", "someday at 9", "tomorrow at teatime", ""})
    void unreadablePhrasesYieldNothing(String text) {
        assertThat(parser.parse(text, NOW)).isEmpty();
    }
}
