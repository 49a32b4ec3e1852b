package com.flagship.leave_audit.input.exception;

/**
 * Thrown when a non-blank numeric cell does not hold a number.
 */
public class InvalidValueException extends LeaveAuditException {

    public InvalidValueException(String table, String column, int rowNumber, String rawValue) {
        super(table, String.format("%s.%s row %d: expected a number but found '%s'",
                table, column, rowNumber, rawValue));
    }
}
