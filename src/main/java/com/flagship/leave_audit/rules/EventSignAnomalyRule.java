package com.flagship.leave_audit.rules;

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
import java.util.Map;

/**
 * Flags accruals with negative units and leave taken with positive units.
 */
@Component
@RequiredArgsConstructor
public class EventSignAnomalyRule implements AuditRule {

    private final FindingFactory findingFactory;

    @Override
    public RuleCode getRuleCode() {
        return RuleCode.EVENT_SIGN_ANOMALY;
    }

    @Override
    public List<Finding> evaluate(AuditContext context) {
        List<Finding> findings = new ArrayList<>();
        for (LedgerEvent event : context.getLedger()) {
            if (!hasUnexpectedSign(event)) {
                continue;
            }

            Map<String, String> keys = Evidence.keys(event.getEmployeeId(), event.getLeaveType(), event.getEventDate());
            keys.put("event_type", event.getEventType().name());

            Evidence evidence = Evidence.builder()
                .source(TableSchema.LEAVE_LEDGER.getFileName())
                .primaryKeys(keys)
                .value("event_type", event.getEventType().name())
                .value("units", event.getUnits())
                .threshold("expected_sign", event.getEventType() == EventType.ACCRUAL ? "units >= 0" : "units <= 0")
                .explanation("Accruals should add units and leave taken should deduct units.")
                .build();

            findings.add(findingFactory.create(getRuleCode(), evidence,
                event.getEventType() + " event has unexpected sign (" + event.getUnits() + ")."));
        }
        return findings;
    }

    static boolean hasUnexpectedSign(LedgerEvent event) {
        Double units = event.getUnits();
        if (units == null) {
            return false;
        }
        return (event.getEventType() == EventType.ACCRUAL && units < 0)
            || (event.getEventType() == EventType.TAKEN && units > 0);
    }
}
