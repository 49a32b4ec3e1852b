package com.flagship.leave_audit.ledger;

import lombok.Value;

import java.time.LocalDate;

/**
 * A single dated accrual or usage entry in the leave ledger.
 *
 * The ledger is append-only and unordered; events are immutable.
 * {@code rawEventType} keeps the source text so that UNKNOWN events stay traceable.
 */
@Value
public class LedgerEvent {
    String employeeId;
    String leaveType;
    LocalDate eventDate;
    EventType eventType;
    String rawEventType;
    Double units;
    int rowNumber;
}
