package com.flagship.leave_audit.input;

import com.flagship.leave_audit.employee.Employee;
import com.flagship.leave_audit.ledger.LedgerEvent;
import com.flagship.leave_audit.ledger.SnapshotRow;
import com.flagship.leave_audit.lsl.PayRate;
import lombok.Value;

import java.util.List;

/**
 * Typed, date-normalized input tables for one audit module.
 *
 * {@code ledger} is empty for the LSL path and {@code payRates} is empty when no pay
 * rate file was supplied.
 */
@Value
public class AuditDataset {
    List<Employee> employees;
    List<LedgerEvent> ledger;
    List<SnapshotRow> snapshot;
    List<PayRate> payRates;
    List<DateParseWarning> dateWarnings;
}
