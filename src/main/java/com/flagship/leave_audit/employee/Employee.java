package com.flagship.leave_audit.employee;

import lombok.Value;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Employee reference data for an audit run. Loaded once, never mutated.
 */
@Value
public class Employee {
    String employeeId;
    String employmentType;
    Double fte;
    LocalDate startDate;
    LocalDate endDate;

    public static final String CASUAL = "CASUAL";

    public boolean isCasual() {
        return employmentType != null && CASUAL.equals(employmentType.trim().toUpperCase(Locale.ROOT));
    }
}
