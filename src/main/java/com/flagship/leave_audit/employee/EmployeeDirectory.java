package com.flagship.leave_audit.employee;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup side of the ledger-to-employee left join.
 *
 * Every ledger event is looked up; an event whose employee is not on file simply has
 * no match. When an employee id appears more than once, the last row wins.
 */
@Slf4j
public class EmployeeDirectory {

    private final Map<String, Employee> byId;

    private EmployeeDirectory(Map<String, Employee> byId) {
        this.byId = byId;
    }

    public static EmployeeDirectory of(Collection<Employee> employees) {
        Map<String, Employee> byId = new HashMap<>();
        int duplicates = 0;
        for (Employee employee : employees) {
            if (employee.getEmployeeId() == null) {
                continue;
            }
            if (byId.put(employee.getEmployeeId(), employee) != null) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            log.warn("{} duplicate employee_id rows in employees; the last row for each id is used", duplicates);
        }
        return new EmployeeDirectory(Map.copyOf(byId));
    }

    public Optional<Employee> find(String employeeId) {
        if (employeeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(employeeId));
    }
}
