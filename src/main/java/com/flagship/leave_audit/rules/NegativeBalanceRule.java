package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.finding.Evidence;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.FindingFactory;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.input.TableSchema;
import com.flagship.leave_audit.ledger.SnapshotRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags every snapshot row stating a balance below zero.
 */
@Component
@RequiredArgsConstructor
public class NegativeBalanceRule implements AuditRule {

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.NEGATIVE_BALANCE;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        List<Finding> findings = new ArrayList<>();
        for (SnapshotRow row : context.getSnapshot()) {
            Double balance = row.getBalanceUnits();
            if (balance == null || !(balance < 0)) {
                continue;
            }

            Evidence evidence = Evidence.builder()
                .source(TableSchema.BALANCES_SNAPSHOT.getFileName())
                .primaryKeys(Evidence.keys(row.getEmployeeId(), row.getLeaveType(), row.getAsOfDate()))
                .value("balance_units", balance)
                .threshold("minimum_balance_units", 0.0)
                .explanation("The stated snapshot balance is below zero.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence,
                "Snapshot balance is negative (" + balance + ")."));
        }
        return findings;
    }
}
