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
 * Flags employees at full LSL tenure holding a positive balance below the low floor.
 *
 * Zero and negative balances are left to their own rules.
 */
@Component
@RequiredArgsConstructor
public class LslBalanceSuspiciouslyLowRule implements AuditRule {

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.LSL_BALANCE_SUSPICIOUSLY_LOW;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        double fullYears = context.getParameters().getLslFullYears();
        double lowFloor = context.getParameters().getLslLowFloorUnits();
        List<Finding> findings = new ArrayList<>();

        for (LslState state : context.getLslStates()) {
            if (!state.hasServiceAtLeast(fullYears) || !state.hasLslBalance()) {
                continue;
            }
            double balance = state.getLslBalanceUnits();
            if (!(balance > 0 && balance < lowFloor)) {
                continue;
            }

            Evidence evidence = Evidence.builder()
                .source(TableSchema.EMPLOYEES.getFileName())
                .source(TableSchema.BALANCES_SNAPSHOT.getFileName())
                .primaryKeys(Evidence.keys(state.getEmployeeId(), LslRules.LSL, state.getReportingDate()))
                .value("service_years", state.getServiceYears())
                .value("lsl_balance_units", balance)
                .threshold("full_entitlement_reference_years", fullYears)
                .threshold("low_balance_floor_units", lowFloor)
                .explanation("Long-tenured employees usually hold more LSL. "
                    + "A very low balance may indicate configuration or data issues.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence, String.format(Locale.ROOT,
                "Employee has %.1f years of service but only %.2f units of LSL.",
                state.getServiceYears(), balance)));
        }
        return findings;
    }
}
