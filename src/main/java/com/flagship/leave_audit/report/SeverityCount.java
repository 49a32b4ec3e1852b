package com.flagship.leave_audit.report;

import com.flagship.leave_audit.finding.Severity;
import lombok.Value;

@Value
public class SeverityCount {
    Severity severity;
    long findingCount;
}
