package com.flagship.leave_audit.input;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A loaded CSV table with headers already resolved to canonical column names.
 *
 * Cell values are kept as trimmed strings; typing happens in {@link InputLoader}.
 */
@Value
public class InputTable {

    /**
     * Cell contents read as a missing value, matched after trimming.
     */
    public static final Set<String> MISSING_VALUE_TOKENS = Set.of(
        "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
        "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null"
    );

    TableSchema schema;
    Set<String> columns;
    List<Row> rows;

    public String getName() {
        return schema.getTableName();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * One data line. Row numbers are 1-based and count data lines after the header.
     */
    @Value
    public static class Row {
        int rowNumber;
        Map<String, String> cells;

        /**
         * Returns the trimmed cell value, or null when the column is absent, the cell is
         * blank or it holds one of the {@link InputTable#MISSING_VALUE_TOKENS}.
         */
        public String get(String column) {
            String value = cells.get(column);
            if (value == null || value.isBlank()) {
                return null;
            }
            String trimmed = value.trim();
            return MISSING_VALUE_TOKENS.contains(trimmed) ? null : trimmed;
        }
    }
}
