package com.flagship.leave_audit.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding for leave units and money figures.
 */
public final class Units {

    private Units() {
    }

    /**
     * Rounds to two decimal places, half-even on the exact binary value of the double.
     * Non-finite values are returned unchanged.
     */
    public static double round2(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static Double round2(Double value) {
        return value == null ? null : round2(value.doubleValue());
    }
}
