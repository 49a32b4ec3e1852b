package com.flagship.leave_audit.finding;

/**
 * The fixed rule catalogue. Declaration order is the presentation order.
 */
public enum RuleCode {

    NEGATIVE_BALANCE(AuditModule.LEAVE_LEAKAGE, Severity.HIGH,
        "Check recent leave postings and manual adjustments for this leave type. "
            + "Correct the balance or confirm that negative leave was approved under policy."),

    EVENT_SIGN_ANOMALY(AuditModule.LEAVE_LEAKAGE, Severity.MEDIUM,
        "Review how this event was posted. Accruals should add units and leave taken "
            + "should deduct units; reverse and re-post the event with the correct sign."),

    TAKEN_BEFORE_START_DATE(AuditModule.LEAVE_LEAKAGE, Severity.HIGH,
        "Confirm the employee start date and the leave dates. Remove or re-date leave "
            + "recorded before employment began."),

    CASUAL_ACCRUAL_PRESENT(AuditModule.LEAVE_LEAKAGE, Severity.HIGH,
        "Confirm the employment type. Casual employees should not accrue annual or "
            + "personal leave; review the pay configuration and reverse incorrect accruals."),

    BALANCE_MISMATCH_LEDGER_VS_SNAPSHOT(AuditModule.LEAVE_LEAKAGE, Severity.HIGH,
        "Reconcile the stated balance against ledger history up to the snapshot date. "
            + "Identify missing, duplicated or back-dated events and correct the source record."),

    LSL_MISSING_FOR_ELIGIBLE_EMPLOYEE(AuditModule.LSL_EXPOSURE, Severity.HIGH,
        "Confirm whether LSL is being tracked outside the payroll system. "
            + "If not, review historical service records and determine appropriate "
            + "LSL accruals/provisions."),

    LSL_NEGATIVE_BALANCE(AuditModule.LSL_EXPOSURE, Severity.HIGH,
        "Review LSL configuration and any manual adjustments. "
            + "Correct posting/mapping issues and re-run."),

    LSL_ZERO_BALANCE_FOR_LONG_TENURE(AuditModule.LSL_EXPOSURE, Severity.HIGH,
        "Confirm whether LSL has been intentionally excluded or whether accruals "
            + "have not been configured correctly for this employee."),

    LSL_BALANCE_SUSPICIOUSLY_LOW(AuditModule.LSL_EXPOSURE, Severity.MEDIUM,
        "Review LSL accrual rules and historical balances to confirm whether the "
            + "low LSL balance is expected for this employee.");

    private final AuditModule module;
    private final Severity severity;
    private final String nextAction;

    RuleCode(AuditModule module, Severity severity, String nextAction) {
        this.module = module;
        this.severity = severity;
        this.nextAction = nextAction;
    }

    public AuditModule getModule() {
        return module;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * Remediation guidance attached to every finding of this rule.
     */
    public String getNextAction() {
        return nextAction;
    }
}
