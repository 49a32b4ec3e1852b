package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.finding.Severity;
import com.flagship.leave_audit.lsl.LslState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flagship.leave_audit.rules.RuleTestSupport.lslState;
import static org.junit.jupiter.api.Assertions.*;

/**
 * LSL rules
 *
 * A missing LSL row and a stated zero balance are different conditions and must
 * never be reported by the same rule.
 */
class LslRulesTest {

    private final RuleEngine ruleEngine = new RuleEngine(RuleTestSupport.allRules());

    private List<RuleCode> ruleCodes(List<Finding> findings) {
        return findings.stream().map(Finding::getRuleCode).toList();
    }

    private AuditContext context(LslState... states) {
        return AuditContext.builder().lslStates(List.of(states)).build();
    }

    @Test
    @DisplayName("Eligible employee without an LSL row is reported as missing")
    void testMissingForEligible() {
        // Given: 7.5 years of service against a 7 year milestone, no LSL row
        AuditContext context = context(lslState("E1", 7.5, null));

        // When
        List<Finding> findings = ruleEngine.evaluate(AuditModule.LSL_EXPOSURE, context);

        // Then
        assertEquals(List.of(RuleCode.LSL_MISSING_FOR_ELIGIBLE_EMPLOYEE), ruleCodes(findings));
        assertEquals("LSL", findings.get(0).getLeaveType());
        assertEquals("2024-06-30", findings.get(0).getAsOfDate());
    }

    @Test
    @DisplayName("Eligible employee with a zero LSL balance is reported as zero, not missing")
    void testZeroBalanceIsNotMissing() {
        // Given: Same tenure, LSL balance of exactly 0.0
        AuditContext context = context(lslState("E1", 7.5, 0.0));

        // When
        List<Finding> findings = ruleEngine.evaluate(AuditModule.LSL_EXPOSURE, context);

        // Then
        assertEquals(List.of(RuleCode.LSL_ZERO_BALANCE_FOR_LONG_TENURE), ruleCodes(findings));
    }

    @Test
    @DisplayName("Employees below eligibility or with unknown tenure are not reported as missing")
    void testBelowEligibility() {
        // Given
        AuditContext context = context(lslState("E1", 6.99, null), lslState("E2", null, null));

        // When
        List<Finding> findings = ruleEngine.evaluate(AuditModule.LSL_EXPOSURE, context);

        // Then
        assertTrue(findings.isEmpty());
    }

    @Test
    @DisplayName("Negative LSL balance is reported regardless of tenure")
    void testNegativeBalance() {
        // Given
        AuditContext context = context(lslState("E1", 0.5, -2.0));

        // When
        List<Finding> findings = ruleEngine.evaluate(RuleCode.LSL_NEGATIVE_BALANCE, context);

        // Then
        assertEquals(1, findings.size());
        assertTrue(findings.get(0).getMessage().contains("-2.00"));
    }

    @Test
    @DisplayName("Low balance fires only for positive balances under the floor at full tenure")
    void testSuspiciouslyLow() {
        // Given: Full tenure is 10 years and the floor is 20 units
        AuditContext context = context(
            lslState("LOW", 12.0, 5.0),
            lslState("AT_FLOOR", 12.0, 20.0),
            lslState("ZERO", 12.0, 0.0),
            lslState("NEGATIVE", 12.0, -1.0),
            lslState("SHORT", 9.9, 5.0));

        // When
        List<Finding> findings = ruleEngine.evaluate(RuleCode.LSL_BALANCE_SUSPICIOUSLY_LOW, context);

        // Then
        assertEquals(1, findings.size());
        assertEquals("LOW", findings.get(0).getEmployeeId());
        assertEquals(Severity.MEDIUM, findings.get(0).getSeverity());
    }

    @Test
    @DisplayName("Thresholds come from the audit parameters")
    void testConfiguredEligibility() {
        // Given: Eligibility lowered to 5 years
        AuditContext context = AuditContext.builder()
            .lslStates(List.of(lslState("E1", 5.5, null)))
            .parameters(AuditParameters.builder().lslEligibilityYears(5.0).build())
            .build();

        // When
        List<Finding> findings = ruleEngine.evaluate(RuleCode.LSL_MISSING_FOR_ELIGIBLE_EMPLOYEE, context);

        // Then
        assertEquals(1, findings.size());
        assertTrue(findings.get(0).getEvidence().contains("\"eligibility_years\":5.0"));
    }
}
