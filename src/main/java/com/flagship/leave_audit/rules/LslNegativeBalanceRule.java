package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.finding.Evidence;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.FindingFactory;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.input.TableSchema;
import com.flagship.leave_audit.lsl.LslState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags any stated LSL balance below zero, regardless of tenure.
 */
@Component
@RequiredArgsConstructor
public class LslNegativeBalanceRule implements AuditRule {

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.LSL_NEGATIVE_BALANCE;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        List<Finding> findings = new ArrayList<>();

        for (LslState state : context.getLslStates()) {
            if (!state.hasLslBalance() || !(state.getLslBalanceUnits() < 0)) {
                continue;
            }

            Evidence evidence = Evidence.builder()
                .source(TableSchema.BALANCES_SNAPSHOT.getFileName())
                .primaryKeys(Evidence.keys(state.getEmployeeId(), LslRules.LSL, state.getReportingDate()))
                .value("lsl_balance_units", state.getLslBalanceUnits())
                .value("service_years", state.getServiceYears())
                .threshold("expected", "lsl_balance_units >= 0")
                .explanation("Negative LSL balances are usually invalid and indicate data or configuration issues.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence, String.format(Locale.ROOT,
                "LSL balance is negative (%.2f units).", state.getLslBalanceUnits())));
        }
        return findings;
    }
}
