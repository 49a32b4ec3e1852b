package com.flagship.leave_audit.ledger;

import java.util.Locale;

/**
 * Kind of leave ledger event.
 *
 * ACCRUAL events are expected to carry non-negative units and TAKEN events
 * non-positive units. Anything else in the source file loads as UNKNOWN.
 */
public enum EventType {
    ACCRUAL,
    TAKEN,
    UNKNOWN;

    public static EventType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "ACCRUAL" -> ACCRUAL;
            case "TAKEN" -> TAKEN;
            default -> UNKNOWN;
        };
    }
}
