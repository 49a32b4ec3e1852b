package com.flagship.leave_audit.input;

import com.flagship.leave_audit.input.exception.DateParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemporalNormalizerTest {

    private static InputTable.Row row(int number, String column, String value) {
        Map<String, String> cells = new HashMap<>();
        cells.put(column, value);
        return new InputTable.Row(number, cells);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "03/04/2024, 2024-04-03",
        "3/4/2024, 2024-04-03",
        "2024-04-03, 2024-04-03",
        "03-04-2024, 2024-04-03",
        "03.04.2024, 2024-04-03",
        "03/04/24, 2024-04-03",
        "3 Apr 2024, 2024-04-03",
        "3 april 2024, 2024-04-03",
        "03-Apr-2024, 2024-04-03",
        "03/04/2024 00:00:00, 2024-04-03",
        "2024-04-03T09:30:00, 2024-04-03"
    })
    @DisplayName("Accepted shapes parse day-first")
    void testDayFirstShapes(String raw, String expected) {
        assertEquals(LocalDate.parse(expected), TemporalNormalizer.parseDayFirst(raw));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "01/03/85, 1985-03-01",
        "15/03/99, 1999-03-15",
        "01-Mar-85, 1985-03-01",
        "30/06/00, 2000-06-30",
        "30/06/24, 2024-06-30"
    })
    @DisplayName("Two-digit years fall in the century window ending about fifty years ahead")
    void testTwoDigitYears(String raw, String expected) {
        assertEquals(LocalDate.parse(expected), TemporalNormalizer.parseDayFirst(raw));
    }

    @Test
    @DisplayName("Missing-value tokens are absent dates, not strict failures")
    void testMissingValueTokens() {
        TemporalNormalizer strict = TemporalNormalizer.strict();

        assertNull(strict.normalize(row(1, "end_date", "N/A"), "employees", "end_date"));
        assertNull(strict.normalize(row(2, "end_date", "NaN"), "employees", "end_date"));
        assertNull(strict.normalize(row(3, "end_date", " null "), "employees", "end_date"));
    }

    @Test
    @DisplayName("Impossible and non-date values do not parse")
    void testUnparseable() {
        assertNull(TemporalNormalizer.parseDayFirst("31/02/2024"));
        assertNull(TemporalNormalizer.parseDayFirst("13/13/2024"));
        assertNull(TemporalNormalizer.parseDayFirst("not a date"));
        assertNull(TemporalNormalizer.parseDayFirst("   "));
    }

    @Test
    @DisplayName("Strict policy fails on the first unparseable value, naming table, column and row")
    void testStrictFails() {
        // Given
        TemporalNormalizer strict = TemporalNormalizer.strict();

        // When
        DateParseException e = assertThrows(DateParseException.class,
            () -> strict.normalize(row(4, "event_date", "2024-13-45"), "leave_ledger", "event_date"));

        // Then
        assertEquals("leave_ledger", e.getTable());
        assertEquals("event_date", e.getColumn());
        assertEquals(4, e.getRowNumber());
        assertEquals("2024-13-45", e.getRawValue());
    }

    @Test
    @DisplayName("Blank cells are absent under both policies")
    void testBlankIsAbsent() {
        assertNull(TemporalNormalizer.strict().normalize(row(1, "end_date", ""), "employees", "end_date"));
        assertNull(TemporalNormalizer.lenient().normalize(row(1, "end_date", null), "employees", "end_date"));
    }

    @Test
    @DisplayName("Lenient policy coerces unparseable values to absent and counts them per column")
    void testLenientCounts() {
        // Given
        TemporalNormalizer lenient = TemporalNormalizer.lenient();

        // When
        LocalDate first = lenient.normalize(row(1, "start_date", "garbage"), "employees", "start_date");
        lenient.normalize(row(2, "start_date", "31/02/2020"), "employees", "start_date");
        LocalDate valid = lenient.normalize(row(3, "start_date", "01/02/2020"), "employees", "start_date");
        lenient.normalize(row(1, "as_of_date", "??"), "balances_snapshot", "as_of_date");

        // Then
        assertNull(first);
        assertEquals(LocalDate.of(2020, 2, 1), valid);
        assertEquals(2, lenient.coercedCount("employees", "start_date"));
        assertEquals(0, lenient.coercedCount("employees", "end_date"));
        assertEquals(List.of(
            new DateParseWarning("employees", "start_date", 2),
            new DateParseWarning("balances_snapshot", "as_of_date", 1)
        ), lenient.getWarnings());
    }
}
