package com.flagship.leave_audit.input;

import com.flagship.leave_audit.input.exception.SchemaException;

import java.util.List;
import java.util.Set;

/**
 * Confirms that a table carries every required column before anything reads it.
 */
public final class SchemaValidator {

    private SchemaValidator() {
    }

    public static void requireColumns(InputTable table) {
        requireColumns(table.getName(), table.getColumns(), table.getSchema().getRequiredColumns());
    }

    /**
     * @throws SchemaException naming the table and the sorted missing columns
     */
    public static void requireColumns(String tableName, Set<String> present, Set<String> required) {
        List<String> missing = required.stream()
            .filter(column -> !present.contains(column))
            .sorted()
            .toList();
        if (!missing.isEmpty()) {
            throw new SchemaException(tableName, missing);
        }
    }
}
