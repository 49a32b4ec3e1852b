package com.flagship.leave_audit.lsl;

import lombok.Value;

/**
 * Heuristic (low, high) estimate of unprovided LSL value across employees.
 *
 * Indicative only. This is not a statutory entitlement calculation and must always be
 * presented with {@link #NOTE}.
 */
@Value
public class ExposureBand {

    public static final String NOTE =
        "Indicative-only estimate based on heuristics, not statutory entitlement calculations.";
    public static final String CURRENCY = "AUD";

    double totalLow;
    double totalHigh;
    int employeesCounted;

    public String getNote() {
        return NOTE;
    }

    public String getCurrency() {
        return CURRENCY;
    }
}
