package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.finding.Evidence;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.FindingFactory;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.input.TableSchema;
import com.flagship.leave_audit.ledger.ReconciliationRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags reconciliation rows whose rounded difference exceeds the balance tolerance.
 */
@Component
@RequiredArgsConstructor
public class BalanceMismatchRule implements AuditRule {

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.BALANCE_MISMATCH_LEDGER_VS_SNAPSHOT;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        double tolerance = context.getParameters().getBalanceTolerance();
        List<Finding> findings = new ArrayList<>();

        for (ReconciliationRow row : context.getReconciliation()) {
            Double diff = row.getDiffUnits();
            if (diff == null || !(Math.abs(diff) > tolerance)) {
                continue;
            }

            Evidence evidence = Evidence.builder()
                .source(TableSchema.LEAVE_LEDGER.getFileName())
                .source(TableSchema.BALANCES_SNAPSHOT.getFileName())
                .primaryKeys(Evidence.keys(row.getEmployeeId(), row.getLeaveType(), row.getAsOfDate()))
                .value("balance_units", row.getBalanceUnits())
                .value("ledger_balance_units", row.getLedgerBalanceUnits())
                .value("diff_units", diff)
                .threshold("tolerance_units", tolerance)
                .explanation("The balance replayed from ledger events up to the snapshot date "
                    + "differs from the stated snapshot balance.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence,
                "Ledger-derived balance (" + row.getLedgerBalanceUnits()
                    + ") does not match snapshot balance (" + row.getBalanceUnits() + ").",
                diff));
        }
        return findings;
    }
}
