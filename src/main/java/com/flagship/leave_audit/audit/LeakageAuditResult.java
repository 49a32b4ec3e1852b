package com.flagship.leave_audit.audit;

import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.ledger.ReconciliationRow;
import lombok.Value;

import java.util.List;

/**
 * Output of the leave leakage module: findings plus the reconciliation table.
 */
@Value
public class LeakageAuditResult {
    List<Finding> findings;
    List<ReconciliationRow> reconciliation;
}
