package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.employee.Employee;
import com.flagship.leave_audit.employee.EmployeeDirectory;
import com.flagship.leave_audit.finding.Evidence;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.FindingFactory;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.input.TableSchema;
import com.flagship.leave_audit.ledger.EventType;
import com.flagship.leave_audit.ledger.LedgerEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags leave taken strictly before the employee's start date.
 *
 * Events for employees not on file, or with no start date or event date, cannot be
 * evaluated and are skipped.
 */
@Component
@RequiredArgsConstructor
public class TakenBeforeStartDateRule implements AuditRule {

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.TAKEN_BEFORE_START_DATE;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        EmployeeDirectory directory = context.employeeDirectory();
        List<Finding> findings = new ArrayList<>();

        for (LedgerEvent event : context.getLedger()) {
            if (event.getEventType() != EventType.TAKEN || event.getEventDate() == null) {
                continue;
            }
            Optional<Employee> employee = directory.find(event.getEmployeeId());
            if (employee.isEmpty() || employee.get().getStartDate() == null) {
                continue;
            }

            LocalDate startDate = employee.get().getStartDate();
            LocalDate eventDate = event.getEventDate();
            if (!eventDate.isBefore(startDate)) {
                continue;
            }

            Evidence evidence = Evidence.builder()
                .source(TableSchema.EMPLOYEES.getFileName())
                .source(TableSchema.LEAVE_LEDGER.getFileName())
                .primaryKeys(Evidence.keys(event.getEmployeeId(), event.getLeaveType(), eventDate))
                .value("event_date", eventDate.toString())
                .value("units", event.getUnits())
                .threshold("start_date", startDate.toString())
                .explanation("Leave cannot be taken before employment begins.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence,
                "Leave TAKEN on " + eventDate + " is before employee start date " + startDate + "."));
        }
        return findings;
    }
}
