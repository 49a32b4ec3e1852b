package com.flagship.leave_audit.input.exception;

/**
 * Base type for errors that abort an audit run.
 *
 * Structural input problems (missing columns, unparseable dates under the strict
 * policy, malformed numbers) are fatal. Per-row data anomalies are never thrown;
 * the rule engine reports them as findings instead.
 */
public class LeaveAuditException extends RuntimeException {

    private final String table;

    public LeaveAuditException(String table, String message) {
        super(message);
        this.table = table;
    }

    public LeaveAuditException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    /**
     * Name of the input table the error relates to.
     */
    public String getTable() {
        return table;
    }
}
