package com.flagship.leave_audit.input.exception;

import java.util.List;

/**
 * Thrown when an input table lacks one or more required columns.
 */
public class SchemaException extends LeaveAuditException {

    private final List<String> missingColumns;

    public SchemaException(String table, List<String> missingColumns) {
        super(table, String.format("%s missing required columns: %s", table, missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    /**
     * Missing canonical column names, sorted.
     */
    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
