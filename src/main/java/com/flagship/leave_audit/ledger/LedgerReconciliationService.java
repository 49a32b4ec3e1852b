package com.flagship.leave_audit.ledger;

import com.flagship.leave_audit.finding.RuleCode;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays the leave ledger against each snapshot row.
 *
 * For every snapshot row, the ledger balance is the sum of units of all events for the
 * same employee and leave type dated on or before the snapshot's as-of date. Events
 * without a date always count. Employees with no matching events get a ledger balance
 * of 0.0.
 *
 * Balances are derived on every run and never stored as authoritative state.
 */
@Service
@Slf4j
public class LedgerReconciliationService {

    private static final Comparator<ReconciliationRow> OUTPUT_ORDER = Comparator
        .comparing(ReconciliationRow::getEmployeeId, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(ReconciliationRow::getLeaveType, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(ReconciliationRow::getAsOfDate, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Builds the reconciliation table.
     *
     * @param snapshot Stated balances
     * @param ledger All ledger events
     * @param riskTolerance Absolute difference above which a row is flagged
     * @return One row per snapshot row, ordered by employee, leave type and date
     */
    public List<ReconciliationRow> reconcile(List<SnapshotRow> snapshot, List<LedgerEvent> ledger,
                                             double riskTolerance) {
        Map<LeaveKey, List<LedgerEvent>> eventsByKey = indexByLeaveKey(ledger);
        warnOnDuplicateSnapshotKeys(snapshot);

        List<ReconciliationRow> rows = new ArrayList<>(snapshot.size());
        for (SnapshotRow row : snapshot) {
            List<LedgerEvent> events = eventsByKey.getOrDefault(
                new LeaveKey(row.getEmployeeId(), row.getLeaveType()), List.of());
            double ledgerSum = ledgerBalanceAsOf(events, row.getAsOfDate());

            Double diff = row.getBalanceUnits() == null
                ? null
                : Units.round2(row.getBalanceUnits() - ledgerSum);
            boolean flagged = diff != null && Math.abs(diff) > riskTolerance;

            rows.add(new ReconciliationRow(
                row.getEmployeeId(),
                row.getLeaveType(),
                row.getAsOfDate(),
                row.getBalanceUnits(),
                Units.round2(ledgerSum),
                diff,
                flagged,
                flagged ? RuleCode.BALANCE_MISMATCH_LEDGER_VS_SNAPSHOT.name() : ""
            ));
        }

        rows.sort(OUTPUT_ORDER);
        long flaggedCount = rows.stream().filter(ReconciliationRow::isRiskFlag).count();
        log.info("Reconciled {} snapshot rows against {} ledger events ({} flagged above {} units)",
                rows.size(), ledger.size(), flaggedCount, riskTolerance);
        return List.copyOf(rows);
    }

    /**
     * Sums units of events dated on or before the cutoff; undated events always count
     * and events with no units contribute nothing. A missing cutoff yields 0.0.
     */
    static double ledgerBalanceAsOf(List<LedgerEvent> events, LocalDate cutoff) {
        if (cutoff == null) {
            return 0.0;
        }
        double sum = 0.0;
        for (LedgerEvent event : events) {
            LocalDate eventDate = event.getEventDate();
            if (eventDate != null && eventDate.isAfter(cutoff)) {
                continue;
            }
            if (event.getUnits() != null && !event.getUnits().isNaN()) {
                sum += event.getUnits();
            }
        }
        return sum;
    }

    private Map<LeaveKey, List<LedgerEvent>> indexByLeaveKey(List<LedgerEvent> ledger) {
        Map<LeaveKey, List<LedgerEvent>> index = new HashMap<>();
        for (LedgerEvent event : ledger) {
            index.computeIfAbsent(new LeaveKey(event.getEmployeeId(), event.getLeaveType()), k -> new ArrayList<>())
                .add(event);
        }
        return index;
    }

    private void warnOnDuplicateSnapshotKeys(List<SnapshotRow> snapshot) {
        Map<SnapshotKey, Integer> counts = new HashMap<>();
        for (SnapshotRow row : snapshot) {
            counts.merge(new SnapshotKey(row.getEmployeeId(), row.getLeaveType(), row.getAsOfDate()), 1, Integer::sum);
        }
        long duplicated = counts.values().stream().filter(count -> count > 1).count();
        if (duplicated > 0) {
            log.warn("{} (employee_id, leave_type, as_of_date) keys appear more than once in the snapshot; "
                    + "each row is reconciled separately", duplicated);
        }
    }

    @Value
    static class LeaveKey {
        String employeeId;
        String leaveType;
    }

    @Value
    static class SnapshotKey {
        String employeeId;
        String leaveType;
        LocalDate asOfDate;
    }
}
