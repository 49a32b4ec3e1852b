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
 * Flags employees past the LSL eligibility milestone with no LSL row in the snapshot.
 */
@Component
@RequiredArgsConstructor
public class LslMissingForEligibleRule implements AuditRule {

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.LSL_MISSING_FOR_ELIGIBLE_EMPLOYEE;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        double eligibilityYears = context.getParameters().getLslEligibilityYears();
        List<Finding> findings = new ArrayList<>();

        for (LslState state : context.getLslStates()) {
            if (!state.hasServiceAtLeast(eligibilityYears) || state.hasLslBalance()) {
                continue;
            }

            Evidence evidence = Evidence.builder()
                .source(TableSchema.EMPLOYEES.getFileName())
                .source(TableSchema.BALANCES_SNAPSHOT.getFileName())
                .primaryKeys(Evidence.keys(state.getEmployeeId(), LslRules.LSL, state.getSnapshotDate()))
                .value("service_years", state.getServiceYears())
                .value("lsl_balance_present", false)
                .threshold("eligibility_years", eligibilityYears)
                .explanation("Employee has reached the configured LSL eligibility milestone, "
                    + "but no LSL balance record was found in the snapshot.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence, String.format(Locale.ROOT,
                "Employee has %.1f years of service but no LSL balance record.", state.getServiceYears())));
        }
        return findings;
    }
}
