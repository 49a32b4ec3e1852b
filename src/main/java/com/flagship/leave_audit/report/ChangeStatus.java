package com.flagship.leave_audit.report;

/**
 * How a finding moved between two runs.
 */
public enum ChangeStatus {
    /**
     * Present now, absent in the previous run.
     */
    NEW,

    /**
     * Present in both runs.
     */
    PERSISTED,

    /**
     * Present in the previous run only.
     */
    RESOLVED
}
