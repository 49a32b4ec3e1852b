package com.flagship.leave_audit.report;

import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.finding.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Finding counts for the summary tables.
 *
 * Both summaries order by severity (HIGH first), then by count descending.
 */
public final class FindingSummary {

    private FindingSummary() {
    }

    public static List<RuleSeverityCount> byRuleAndSeverity(List<Finding> findings) {
        Map<RuleCode, Map<Severity, Long>> counts = new EnumMap<>(RuleCode.class);
        for (Finding finding : findings) {
            counts.computeIfAbsent(finding.getRuleCode(), k -> new EnumMap<>(Severity.class))
                .merge(finding.getSeverity(), 1L, Long::sum);
        }

        List<RuleSeverityCount> rows = new ArrayList<>();
        counts.forEach((rule, bySeverity) -> bySeverity.forEach((severity, count) ->
            rows.add(new RuleSeverityCount(rule, severity, count))));
        rows.sort(Comparator.comparing(RuleSeverityCount::getSeverity)
            .thenComparing(Comparator.comparingLong(RuleSeverityCount::getFindingCount).reversed())
            .thenComparing(row -> row.getRuleCode().name()));
        return rows;
    }

    public static List<SeverityCount> bySeverity(List<Finding> findings) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Finding finding : findings) {
            counts.merge(finding.getSeverity(), 1L, Long::sum);
        }

        List<SeverityCount> rows = new ArrayList<>();
        counts.forEach((severity, count) -> rows.add(new SeverityCount(severity, count)));
        rows.sort(Comparator.comparing(SeverityCount::getSeverity));
        return rows;
    }
}
