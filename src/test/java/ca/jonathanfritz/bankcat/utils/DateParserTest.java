package ca.jonathanfritz.bankcat.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

class DateParserTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "2023/01/05",
            "2023-01-05",
            "20230105",
            "2023/1/5",
            "05/01/2023",
            "5/1/2023",
            "05-01-2023",
            "5 Jan 2023",
            "05 Jan 2023",
            "5 January 2023",
            "2023-01-05T10:15:00",
            "2023-01-05T10:15:00+02:00",
            "Jan 5, 2023",
            "January 5, 2023",
            "2023-01-05 10:15:00.000",
            "2023-01-05 10:15:00.5",
            "2023-01-05 10:15:00",
            "2023-01-05 10:15",
            "2023/01/05 10:15:00",
            "05/01/2023 10:15",
            "  2023/01/05  "
    })
    void knownFormatsTest(String value) {
        assertThat(DateParser.parse(value), equalTo(Optional.of(LocalDate.of(2023, 1, 5))));
    }

    @Test
    void dayFirstIsPreferredTest() {
        assertThat(DateParser.parse("03/04/2024"), equalTo(Optional.of(LocalDate.of(2024, 4, 3))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"01/13/2023", "1/13/2023", "01/13/2023 08:30"})
    void monthFirstWhenDayFirstIsImpossibleTest(String value) {
        assertThat(DateParser.parse(value), equalTo(Optional.of(LocalDate.of(2023, 1, 13))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "yesterday", "2023/02/30", "2023-13-01", "32/01/2023"})
    void unparseableTest(String value) {
        assertThat(DateParser.parse(value), equalTo(Optional.empty()));
    }

    @Test
    void nullTest() {
        assertThat(DateParser.parse(null), equalTo(Optional.empty()));
    }
}
