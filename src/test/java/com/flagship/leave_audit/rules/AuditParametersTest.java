package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.lsl.ExposureEstimator;
import com.flagship.leave_audit.lsl.GapHours;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuditParametersTest {

    private static AuditParameters years(double eligibility, double full) {
        return AuditParameters.builder().lslEligibilityYears(eligibility).lslFullYears(full).build();
    }

    @Test
    @DisplayName("Partial service band exists only when full years exceed eligibility years")
    void testPartialServiceBand() {
        assertTrue(AuditParameters.defaults().hasPartialServiceBand());
        assertFalse(years(10.0, 10.0).hasPartialServiceBand());
        assertFalse(years(10.0, 7.0).hasPartialServiceBand());
    }

    @Test
    @DisplayName("Equal milestones leave no partial band: below is nothing, at or above is the full band")
    void testEqualMilestonesBand() {
        ExposureEstimator estimator = new ExposureEstimator();
        AuditParameters equal = years(10.0, 10.0);

        assertEquals(GapHours.NONE, estimator.heuristicGapHours(9.99, equal));
        assertEquals(38.0 * 3, estimator.heuristicGapHours(10.0, equal).getLow(), 1e-9);
    }
}
