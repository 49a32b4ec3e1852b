package com.flagship.leave_audit.rules;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds shared by the rules and the exposure estimator.
 */
@Value
@Builder
public class AuditParameters {

    /**
     * Absolute ledger/snapshot difference above which a mismatch finding is raised.
     */
    @Builder.Default
    double balanceTolerance = 0.01;

    /**
     * Absolute difference above which a reconciliation row is risk-flagged (15 minutes).
     */
    @Builder.Default
    double riskTolerance = 0.25;

    @Builder.Default
    double lslEligibilityYears = 7.0;

    @Builder.Default
    double lslFullYears = 10.0;

    @Builder.Default
    double hoursPerDay = 7.6;

    @Builder.Default
    double hoursPerWeek = 38.0;

    @Builder.Default
    double lslLowFloorUnits = 20.0;

    /**
     * True when some service length is eligible for LSL but short of the full entitlement.
     */
    public boolean hasPartialServiceBand() {
        return lslFullYears > lslEligibilityYears;
    }

    public static AuditParameters defaults() {
        return AuditParameters.builder().build();
    }
}
