package com.flagship.leave_audit.finding;

/**
 * The audit modules a run executes. Each owns a subset of the rule catalogue and
 * writes its own findings file.
 */
public enum AuditModule {
    LEAVE_LEAKAGE("leave_leakage", "Leave Leakage (Ledger vs Snapshot)"),
    LSL_EXPOSURE("lsl_exposure", "Long Service Leave (LSL) Exposure");

    private final String id;
    private final String displayName;

    AuditModule(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * Identifier written to the {@code source_module} column.
     */
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }
}
