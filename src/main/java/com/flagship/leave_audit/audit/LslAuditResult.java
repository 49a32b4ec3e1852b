package com.flagship.leave_audit.audit;

import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.input.DateParseWarning;
import com.flagship.leave_audit.lsl.ExposureBand;
import com.flagship.leave_audit.lsl.LslState;
import lombok.Value;

import java.util.List;

/**
 * Output of the LSL exposure module.
 */
@Value
public class LslAuditResult {
    List<Finding> findings;
    List<LslState> states;
    ExposureBand exposure;
    List<DateParseWarning> dateWarnings;
}
