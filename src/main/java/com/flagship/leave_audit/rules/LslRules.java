package com.flagship.leave_audit.rules;

final class LslRules {

    /**
     * Leave type reported on every LSL finding.
     */
    static final String LSL = "LSL";

    private LslRules() {
    }
}
