package com.flagship.leave_audit.ledger;

import lombok.Value;

import java.time.LocalDate;

/**
 * Snapshot balance compared with the balance replayed from the ledger up to the
 * snapshot date. Both derived figures are rounded to two decimal places.
 */
@Value
public class ReconciliationRow {
    String employeeId;
    String leaveType;
    LocalDate asOfDate;
    Double balanceUnits;
    double ledgerBalanceUnits;
    Double diffUnits;
    boolean riskFlag;
    String riskReason;
}
