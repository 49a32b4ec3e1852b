package com.flagship.leave_audit.lsl;

import lombok.Value;

import java.time.LocalDate;

/**
 * Per-employee long service leave position, rebuilt in full on every run.
 *
 * {@code serviceYears} is null when the start date is unknown or the snapshot
 * carries no dated rows. {@code lslBalanceUnits} is null when no LSL row exists,
 * which is distinct from a stated balance of zero.
 */
@Value
public class LslState {
    String employeeId;
    LocalDate startDate;
    LocalDate endDate;
    Double serviceYears;
    Double lslBalanceUnits;
    LocalDate lslAsOfDate;
    Double hourlyRate;
    LocalDate snapshotDate;

    public boolean hasLslBalance() {
        return lslBalanceUnits != null;
    }

    public boolean hasServiceAtLeast(double years) {
        return serviceYears != null && serviceYears >= years;
    }

    /**
     * Date to report LSL findings against: the LSL row's date, else the snapshot date.
     */
    public LocalDate getReportingDate() {
        return lslAsOfDate != null ? lslAsOfDate : snapshotDate;
    }
}
