package com.flagship.leave_audit.input;

/**
 * How unparseable date cells are treated while loading a table.
 */
public enum DatePolicy {
    /**
     * Any non-blank date that does not parse aborts the run.
     */
    STRICT,

    /**
     * Unparseable dates become absent and are counted as warnings.
     */
    LENIENT
}
