package com.flagship.leave_audit.finding;

import lombok.Value;

/**
 * One detected rule violation.
 *
 * Created once per violation instance per run and never mutated. Two findings from
 * different runs are the same issue when their {@code findingId}s match.
 */
@Value
public class Finding {
    String employeeId;
    String leaveType;
    String asOfDate;
    RuleCode ruleCode;
    Severity severity;
    String message;
    Double diffUnits;
    String evidence;
    String findingId;
    String nextAction;

    public AuditModule getModule() {
        return ruleCode.getModule();
    }
}
