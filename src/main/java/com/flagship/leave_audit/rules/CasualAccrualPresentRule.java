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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Flags annual or personal leave accruals for casual employees.
 */
@Component
@RequiredArgsConstructor
public class CasualAccrualPresentRule implements AuditRule {

    static final Set<String> NON_CASUAL_LEAVE_TYPES = Set.of("ANNUAL", "PERSONAL");

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.CASUAL_ACCRUAL_PRESENT;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        EmployeeDirectory directory = context.employeeDirectory();
        List<Finding> findings = new ArrayList<>();

        for (LedgerEvent event : context.getLedger()) {
            if (event.getEventType() != EventType.ACCRUAL || !isNonCasualLeaveType(event.getLeaveType())) {
                continue;
            }
            Optional<Employee> employee = directory.find(event.getEmployeeId());
            if (employee.isEmpty() || !employee.get().isCasual()) {
                continue;
            }

            Evidence evidence = Evidence.builder()
                .source(TableSchema.EMPLOYEES.getFileName())
                .source(TableSchema.LEAVE_LEDGER.getFileName())
                .primaryKeys(Evidence.keys(event.getEmployeeId(), event.getLeaveType(), event.getEventDate()))
                .value("employment_type", employee.get().getEmploymentType())
                .value("event_type", event.getEventType().name())
                .value("units", event.getUnits())
                .threshold("casual_excluded_leave_types", List.of("ANNUAL", "PERSONAL"))
                .explanation("Casual employees are not entitled to accrue annual or personal leave.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence,
                "Casual employee has leave accrual event."));
        }
        return findings;
    }

    private static boolean isNonCasualLeaveType(String leaveType) {
        return leaveType != null && NON_CASUAL_LEAVE_TYPES.contains(leaveType.trim().toUpperCase(Locale.ROOT));
    }
}
