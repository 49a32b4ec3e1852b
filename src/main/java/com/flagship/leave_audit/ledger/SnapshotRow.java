package com.flagship.leave_audit.ledger;

import lombok.Value;

import java.time.LocalDate;
import java.util.Locale;

/**
 * A point-in-time stated leave balance, independent of ledger replay.
 */
@Value
public class SnapshotRow {
    String employeeId;
    String leaveType;
    LocalDate asOfDate;
    Double balanceUnits;
    int rowNumber;

    /**
     * Long service leave rows are recognised by "LSL" anywhere in the leave type.
     */
    public boolean isLongServiceLeave() {
        return leaveType != null && leaveType.toUpperCase(Locale.ROOT).contains("LSL");
    }
}
