package com.flagship.leave_audit.report;

import lombok.Value;

@Value
public class FindingChange {
    String findingId;
    String ruleCode;
    String employeeId;
    String leaveType;
    String asOfDate;
    ChangeStatus status;
}
