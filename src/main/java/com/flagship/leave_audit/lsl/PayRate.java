package com.flagship.leave_audit.lsl;

import lombok.Value;

import java.time.LocalDate;

/**
 * Optional pay information used to price LSL exposure.
 */
@Value
public class PayRate {
    String employeeId;
    Double hourlyRate;
    Double annualSalary;
    LocalDate asOfDate;
    int rowNumber;
}
