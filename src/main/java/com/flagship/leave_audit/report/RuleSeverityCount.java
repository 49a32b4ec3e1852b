package com.flagship.leave_audit.report;

import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.finding.Severity;
import lombok.Value;

@Value
public class RuleSeverityCount {
    RuleCode ruleCode;
    Severity severity;
    long findingCount;
}
