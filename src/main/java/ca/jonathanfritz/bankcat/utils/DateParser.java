package ca.jonathanfritz.bankcat.utils;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient date parsing for statement columns whose format varies between exports.
 * Day-first formats are preferred over month-first ones for ambiguous values like 03/04/2024.
 */
public class DateParser {

    private static final List<DateTimeFormatter> FORMATTERS = List.of(
            // date only
            formatter("uuuu/MM/dd"),
            formatter("uuuu-MM-dd"),
            formatter("uuuuMMdd"),
            formatter("uuuu/M/d"),
            formatter("uuuu-M-d"),
            formatter("dd/MM/uuuu"),
            formatter("d/M/uuuu"),
            formatter("dd-MM-uuuu"),
            formatter("MM/dd/uuuu"),
            formatter("M/d/uuuu"),
            formatter("d MMM uuuu"),
            formatter("dd MMM uuuu"),
            formatter("d MMMM uuuu"),
            formatter("MMM d, uuuu"),
            formatter("MMMM d, uuuu"),

            // date and time, the time part is discarded
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            formatterWithFraction("uuuu-MM-dd HH:mm:ss"),
            formatter("uuuu-MM-dd HH:mm:ss"),
            formatter("uuuu-MM-dd HH:mm"),
            formatter("uuuu/MM/dd HH:mm:ss"),
            formatter("uuuu/MM/dd HH:mm"),
            formatter("dd/MM/uuuu HH:mm:ss"),
            formatter("dd/MM/uuuu HH:mm"),
            formatter("MM/dd/uuuu HH:mm:ss"),
            formatter("MM/dd/uuuu HH:mm")
    );

    private DateParser() {
    }

    /**
     * Attempts to parse the specified value with each known date or date-time format in turn
     *
     * @param value the date as it appears in a statement file
     * @return the parsed date, or empty if the value is blank or matches no known format
     */
    public static Optional<LocalDate> parse(String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }

        final String trimmed = value.trim();
        return FORMATTERS.stream()
                .map(formatter -> parse(trimmed, formatter))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Optional<LocalDate> parse(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(value, formatter));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter formatter(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter formatterWithFraction(String pattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
