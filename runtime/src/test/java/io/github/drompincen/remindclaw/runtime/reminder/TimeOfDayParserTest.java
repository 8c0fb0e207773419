package io.github.drompincen.remindclaw.runtime.reminder;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeOfDayParserTest {

    @ParameterizedTest
    @CsvSource({
            "9am, 09:00",
            "9 AM, 09:00",
            "12am, 00:00",
            "12pm, 12:00",
            "10:30pm, 22:30",
            "7 p.m., 19:00",
            "14:00, 14:00",
            "08:15:30, 08:15:30",
            "noon, 12:00",
            "midnight, 00:00"
    })
    void parsesClockTimes(String text, String expected) {
        assertThat(TimeOfDayParser.parse(text)).contains(LocalTime.parse(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"25:00", "0am", "13pm", "9:75", "lunch", " "})
    void rejectsInvalidTimes(String text) {
        assertThat(TimeOfDayParser.parse(text)).isEmpty();
    }
}
