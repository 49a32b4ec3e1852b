package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.employee.Employee;
import com.flagship.leave_audit.employee.EmployeeDirectory;
import com.flagship.leave_audit.ledger.LedgerEvent;
import com.flagship.leave_audit.ledger.ReconciliationRow;
import com.flagship.leave_audit.ledger.SnapshotRow;
import com.flagship.leave_audit.lsl.LslState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only inputs shared by all rules of a run. Collections default to empty so that
 * each module only supplies what its rules read.
 */
@Value
@Builder
public class AuditContext {

    @Builder.Default
    List<Employee> employees = List.of();

    @Builder.Default
    List<LedgerEvent> ledger = List.of();

    @Builder.Default
    List<SnapshotRow> snapshot = List.of();

    @Builder.Default
    List<ReconciliationRow> reconciliation = List.of();

    @Builder.Default
    List<LslState> lslStates = List.of();

    @Builder.Default
    AuditParameters parameters = AuditParameters.defaults();

    public EmployeeDirectory employeeDirectory() {
        return EmployeeDirectory.of(employees);
    }
}
