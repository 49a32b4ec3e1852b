package com.flagship.leave_audit.lsl;

import com.flagship.leave_audit.employee.Employee;
import com.flagship.leave_audit.ledger.SnapshotRow;
import com.flagship.leave_audit.rules.AuditParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the per-employee LSL position used by the LSL rules and the exposure estimate.
 */
@Service
@Slf4j
public class LslStateBuilder {

    static final double DAYS_PER_YEAR = 365.25;
    static final int WEEKS_PER_YEAR = 52;

    /**
     * @param employees Employees, one state per row with an id
     * @param snapshot Full balance snapshot; LSL rows are picked out by leave type
     * @param payRates Optional pay rates (may be empty)
     * @param parameters Supplies hours per week for salary conversion
     */
    public List<LslState> build(List<Employee> employees, List<SnapshotRow> snapshot,
                                List<PayRate> payRates, AuditParameters parameters) {
        LocalDate snapshotDate = snapshotDate(snapshot);
        if (snapshotDate == null) {
            log.warn("Snapshot has no dated rows; service years cannot be computed");
        }

        Map<String, SnapshotRow> latestLsl = latestLslRows(snapshot);
        Map<String, Double> hourlyRates = hourlyRates(payRates, parameters.getHoursPerWeek());

        List<LslState> states = new ArrayList<>(employees.size());
        for (Employee employee : employees) {
            if (employee.getEmployeeId() == null) {
                continue;
            }
            SnapshotRow lsl = latestLsl.get(employee.getEmployeeId());
            states.add(new LslState(
                employee.getEmployeeId(),
                employee.getStartDate(),
                employee.getEndDate(),
                serviceYears(employee.getStartDate(), employee.getEndDate(), snapshotDate),
                lsl == null ? null : lsl.getBalanceUnits(),
                lsl == null ? null : lsl.getAsOfDate(),
                hourlyRates.get(employee.getEmployeeId()),
                snapshotDate
            ));
        }

        log.info("Built LSL state for {} employees (snapshot date {}, {} with LSL rows, {} with pay rates)",
                states.size(), snapshotDate, latestLsl.size(), hourlyRates.size());
        return List.copyOf(states);
    }

    /**
     * Latest dated as-of date across the whole snapshot.
     */
    public static LocalDate snapshotDate(List<SnapshotRow> snapshot) {
        return snapshot.stream()
            .map(SnapshotRow::getAsOfDate)
            .filter(Objects::nonNull)
            .max(LocalDate::compareTo)
            .orElse(null);
    }

    /**
     * Years of service from start date to the earlier of end date and snapshot date,
     * floored at zero. Null when either anchor date is unknown.
     */
    public static Double serviceYears(LocalDate startDate, LocalDate endDate, LocalDate snapshotDate) {
        if (startDate == null || snapshotDate == null) {
            return null;
        }
        LocalDate effectiveEnd = endDate != null && endDate.isBefore(snapshotDate) ? endDate : snapshotDate;
        long days = Math.max(0, ChronoUnit.DAYS.between(startDate, effectiveEnd));
        return days / DAYS_PER_YEAR;
    }

    /**
     * Latest LSL row per employee. Undated rows only count when the employee has no
     * dated LSL row; among equal dates the later file row wins.
     */
    static Map<String, SnapshotRow> latestLslRows(List<SnapshotRow> snapshot) {
        Map<String, SnapshotRow> latest = new HashMap<>();
        for (SnapshotRow row : snapshot) {
            if (row.getEmployeeId() == null || !row.isLongServiceLeave()) {
                continue;
            }
            latest.merge(row.getEmployeeId(), row, LslStateBuilder::later);
        }
        return latest;
    }

    private static SnapshotRow later(SnapshotRow current, SnapshotRow candidate) {
        if (candidate.getAsOfDate() == null) {
            return current.getAsOfDate() == null ? candidate : current;
        }
        if (current.getAsOfDate() == null) {
            return candidate;
        }
        return candidate.getAsOfDate().isBefore(current.getAsOfDate()) ? current : candidate;
    }

    /**
     * Hourly rate per employee from the latest pay rate row, converting annual salary
     * when no hourly rate is given.
     */
    static Map<String, Double> hourlyRates(List<PayRate> payRates, double hoursPerWeek) {
        Map<String, PayRate> latest = new HashMap<>();
        for (PayRate rate : payRates) {
            if (rate.getEmployeeId() == null) {
                continue;
            }
            latest.merge(rate.getEmployeeId(), rate, LslStateBuilder::laterRate);
        }

        Map<String, Double> hourly = new HashMap<>();
        for (Map.Entry<String, PayRate> entry : latest.entrySet()) {
            PayRate rate = entry.getValue();
            if (rate.getHourlyRate() != null) {
                hourly.put(entry.getKey(), rate.getHourlyRate());
            } else if (rate.getAnnualSalary() != null) {
                hourly.put(entry.getKey(), rate.getAnnualSalary() / (hoursPerWeek * WEEKS_PER_YEAR));
            }
        }
        return hourly;
    }

    private static PayRate laterRate(PayRate current, PayRate candidate) {
        if (candidate.getAsOfDate() == null) {
            return current.getAsOfDate() == null ? candidate : current;
        }
        if (current.getAsOfDate() == null) {
            return candidate;
        }
        return candidate.getAsOfDate().isBefore(current.getAsOfDate()) ? current : candidate;
    }
}
