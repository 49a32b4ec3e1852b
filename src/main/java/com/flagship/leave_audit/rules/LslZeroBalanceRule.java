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
 * Flags eligible employees whose LSL row states exactly zero units.
 *
 * An absent LSL row is not zero; that case belongs to {@link LslMissingForEligibleRule}.
 */
@Component
@RequiredArgsConstructor
public class LslZeroBalanceRule implements AuditRule {

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.LSL_ZERO_BALANCE_FOR_LONG_TENURE;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        double eligibilityYears = context.getParameters().getLslEligibilityYears();
        List<Finding> findings = new ArrayList<>();

        for (LslState state : context.getLslStates()) {
            if (!state.hasServiceAtLeast(eligibilityYears) || !state.hasLslBalance()
                    || state.getLslBalanceUnits() != 0.0) {
                continue;
            }

            Evidence evidence = Evidence.builder()
                .source(TableSchema.EMPLOYEES.getFileName())
                .source(TableSchema.BALANCES_SNAPSHOT.getFileName())
                .primaryKeys(Evidence.keys(state.getEmployeeId(), LslRules.LSL, state.getReportingDate()))
                .value("service_years", state.getServiceYears())
                .value("lsl_balance_units", state.getLslBalanceUnits())
                .threshold("eligibility_years", eligibilityYears)
                .explanation("Eligible employees typically accrue some LSL over time; "
                    + "a zero balance may indicate missing configuration or tracking.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence, String.format(Locale.ROOT,
                "Employee has %.1f years of service but an LSL balance of 0 units.", state.getServiceYears())));
        }
        return findings;
    }
}
