package com.flagship.leave_audit.input.exception;

/**
 * Thrown when a required input file is missing or cannot be read.
 */
public class InputFileException extends LeaveAuditException {

    public InputFileException(String table, String message) {
        super(table, message);
    }

    public InputFileException(String table, String message, Throwable cause) {
        super(table, message, cause);
    }
}
