package com.flagship.leave_audit.input;

import com.flagship.leave_audit.input.exception.DateParseException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses date cells into {@link LocalDate} under a {@link DatePolicy}.
 *
 * Ambiguous numeric dates are read day-first: "03/04/2024" is 3 April 2024.
 * Year-first ISO dates are always read as year-month-day. Two-digit years fall in the
 * century window starting {@value #SHORT_YEAR_WINDOW_START} years before today, so
 * "01/03/85" is 1985.
 *
 * An instance accumulates lenient coercion counts for one load, so create one per
 * input pass.
 */
@Slf4j
public class TemporalNormalizer {

    static final int SHORT_YEAR_WINDOW_START = 50;

    private static final LocalDate SHORT_YEAR_BASE = LocalDate.now().minusYears(SHORT_YEAR_WINDOW_START);

    private static final List<DateTimeFormatter> FORMATS = List.of(
        formatter("uuuu-M-d"),
        formatter("uuuu/M/d"),
        formatter("d/M/uuuu"),
        formatter("d-M-uuuu"),
        formatter("d.M.uuuu"),
        shortYearFormatter("d/M/"),
        formatter("d MMM uuuu"),
        formatter("d MMMM uuuu"),
        formatter("d-MMM-uuuu"),
        shortYearFormatter("d-MMM-")
    );

    // Trailing time of day, as written by spreadsheet and database exports
    private static final Pattern TIME_SUFFIX =
        Pattern.compile("^(.+?)[T ]\\d{1,2}:\\d{2}(:\\d{2}(\\.\\d+)?)?(Z|[+-]\\d{2}:?\\d{2})?$");

    private final DatePolicy policy;
    private final Map<String, DateParseWarning> warnings = new LinkedHashMap<>();

    public TemporalNormalizer(DatePolicy policy) {
        this.policy = policy;
    }

    public static TemporalNormalizer strict() {
        return new TemporalNormalizer(DatePolicy.STRICT);
    }

    public static TemporalNormalizer lenient() {
        return new TemporalNormalizer(DatePolicy.LENIENT);
    }

    /**
     * Reads a date column from a row.
     *
     * @return The parsed date, or null when the cell is blank or (leniently) unparseable
     * @throws DateParseException under the strict policy when the cell does not parse
     */
    public LocalDate normalize(InputTable.Row row, String table, String column) {
        String raw = row.get(column);
        if (raw == null) {
            return null;
        }

        LocalDate parsed = parseDayFirst(raw);
        if (parsed != null) {
            return parsed;
        }

        if (policy == DatePolicy.STRICT) {
            throw new DateParseException(table, column, row.getRowNumber(), raw);
        }

        String key = table + "." + column;
        DateParseWarning previous = warnings.get(key);
        int count = previous == null ? 1 : previous.getRowCount() + 1;
        warnings.put(key, new DateParseWarning(table, column, count));
        log.debug("Coerced unparseable date {}.{} row {}: '{}'", table, column, row.getRowNumber(), raw);
        return null;
    }

    /**
     * Lenient coercion counts collected so far, in first-seen order.
     */
    public List<DateParseWarning> getWarnings() {
        return new ArrayList<>(warnings.values());
    }

    /**
     * Number of coerced cells for one table column (0 when none).
     */
    public int coercedCount(String table, String column) {
        DateParseWarning warning = warnings.get(table + "." + column);
        return warning == null ? 0 : warning.getRowCount();
    }

    /**
     * Parses a date string using the accepted shapes, day-first where ambiguous.
     *
     * @return The date, or null if no accepted shape matches
     */
    public static LocalDate parseDayFirst(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        Matcher matcher = TIME_SUFFIX.matcher(value);
        if (matcher.matches()) {
            value = matcher.group(1).trim();
        }

        for (DateTimeFormatter format : FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException e) {
                // try the next shape
            }
        }
        return null;
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter shortYearFormatter(String dayMonthPrefix) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(dayMonthPrefix)
            .appendValueReduced(ChronoField.YEAR, 2, 2, SHORT_YEAR_BASE)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
