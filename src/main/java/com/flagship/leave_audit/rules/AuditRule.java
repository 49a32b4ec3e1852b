package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.RuleCode;

import java.util.List;

/**
 * A single business rule.
 *
 * Implementations are stateless: the same context always yields the same findings in
 * the same order, and rules never depend on one another.
 */
public interface AuditRule {

    RuleCode getRuleCode();

    List<Finding> evaluate(AuditContext context);
}
