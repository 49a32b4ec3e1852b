package com.flagship.leave_audit.lsl;

import lombok.Value;

/**
 * Heuristic band of LSL hours an employee would be expected to hold.
 */
@Value
public class GapHours {

    public static final GapHours NONE = new GapHours(0.0, 0.0);

    double low;
    double high;

    /**
     * Gap remaining after an existing balance, floored at zero on both bounds.
     */
    public GapHours minusBalance(double balanceUnits) {
        return new GapHours(Math.max(0.0, low - balanceUnits), Math.max(0.0, high - balanceUnits));
    }
}
