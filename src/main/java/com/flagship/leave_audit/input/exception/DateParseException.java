package com.flagship.leave_audit.input.exception;

/**
 * Thrown under the strict date policy when a non-blank date cell cannot be parsed.
 */
public class DateParseException extends LeaveAuditException {

    private final String column;
    private final int rowNumber;
    private final String rawValue;

    public DateParseException(String table, String column, int rowNumber, String rawValue) {
        super(table, String.format("%s.%s row %d: unparseable date '%s'", table, column, rowNumber, rawValue));
        this.column = column;
        this.rowNumber = rowNumber;
        this.rawValue = rawValue;
    }

    public String getColumn() {
        return column;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public String getRawValue() {
        return rawValue;
    }
}
