package com.flagship.leave_audit.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.lsl.ExposureBand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the findings of a run as a Markdown report.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarkdownReportBuilder {

    static final int EXAMPLES_PER_RULE = 3;
    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ObjectMapper objectMapper;

    public String build(String organisationName, LocalDateTime generatedAt,
                        List<Finding> findings, ExposureBand exposure) {
        List<String> lines = new ArrayList<>();
        lines.add("# Payroll Compliance Findings Report");
        lines.add("");
        lines.add("**Organisation:** " + organisationName);
        lines.add("");
        lines.add("_Generated: " + GENERATED_AT.format(generatedAt) + "_");
        lines.add("");

        if (findings.isEmpty()) {
            lines.add("No findings were produced for this run.");
            lines.add("");
        } else {
            appendSummary(lines, findings);
            appendModules(lines, findings);
            appendRuleDrivers(lines, findings);
            appendNextActions(lines);
        }

        if (exposure != null) {
            appendExposure(lines, exposure);
        }

        if (!findings.isEmpty()) {
            appendExamples(lines, findings);
            appendNotes(lines);
        }
        return String.join("\n", lines) + "\n";
    }

    private void appendSummary(List<String> lines, List<Finding> findings) {
        lines.add("## Executive summary");
        lines.add("");
        lines.add("- Total findings: **" + formatCount(findings.size()) + "**");
        lines.add("- Severity breakdown: " + FindingSummary.bySeverity(findings).stream()
            .map(count -> "**" + count.getSeverity() + "** " + formatCount(count.getFindingCount()))
            .collect(Collectors.joining(", ")));
        lines.add("");
        lines.add("**What this report is:** A structured set of compliance risk flags with evidence and next actions.");
        lines.add("**What this report is not:** Legal advice or a statutory entitlement calculation.");
        lines.add("");
    }

    private void appendModules(List<String> lines, List<Finding> findings) {
        lines.add("## Findings by module");
        lines.add("");
        for (AuditModule module : AuditModule.values()) {
            List<Finding> moduleFindings = findings.stream()
                .filter(finding -> finding.getModule() == module)
                .toList();
            if (moduleFindings.isEmpty()) {
                continue;
            }
            lines.add("- **" + module.getDisplayName() + "**: " + FindingSummary.bySeverity(moduleFindings).stream()
                .map(count -> count.getSeverity() + " " + formatCount(count.getFindingCount()))
                .collect(Collectors.joining(", ")));
        }
        lines.add("");
    }

    private void appendRuleDrivers(List<String> lines, List<Finding> findings) {
        lines.add("## Top risk drivers (by rule)");
        lines.add("");
        for (RuleSeverityCount count : FindingSummary.byRuleAndSeverity(findings)) {
            lines.add("- **" + count.getRuleCode() + "** (" + count.getSeverity() + "): "
                + formatCount(count.getFindingCount()) + " finding(s)");
        }
        lines.add("");
    }

    private void appendNextActions(List<String> lines) {
        lines.add("## Recommended next actions (prioritised)");
        lines.add("");
        lines.add("1. **Address HIGH severity findings first** (data errors, negative balances, eligibility issues).");
        lines.add("2. **Confirm rule intent against business context** for MEDIUM findings (heuristic flags, policy-specific scenarios).");
        lines.add("3. **Re-run after remediation** to confirm closure and prevent recurrence.");
        lines.add("");
    }

    private void appendNotes(List<String> lines) {
        lines.add("---");
        lines.add("### Notes");
        lines.add("- Each finding carries its evidence and a recommended next action, so it can be traced back to the input rows.");
        lines.add("- LSL exposure estimates (if present) are indicative only and depend on available pay-rate inputs.");
        lines.add("");
    }

    private void appendExposure(List<String> lines, ExposureBand exposure) {
        lines.add("## LSL exposure band (indicative only)");
        lines.add("");
        lines.add(String.format(Locale.ROOT, "- Estimated range: **%s %,.2f - %,.2f**",
            exposure.getCurrency(), exposure.getTotalLow(), exposure.getTotalHigh()));
        lines.add("- Employees priced: " + formatCount(exposure.getEmployeesCounted()));
        lines.add("");
        lines.add("> " + exposure.getNote());
        lines.add("");
    }

    private void appendExamples(List<String> lines, List<Finding> findings) {
        lines.add("## Appendix A: Rule examples with evidence (sample)");
        lines.add("");

        List<RuleCode> rules = findings.stream()
            .map(Finding::getRuleCode)
            .distinct()
            .sorted(Comparator.comparing(RuleCode::getSeverity).thenComparing(RuleCode::name))
            .toList();

        for (RuleCode rule : rules) {
            List<Finding> examples = findings.stream()
                .filter(finding -> finding.getRuleCode() == rule)
                .sorted(Comparator.comparing(Finding::getEmployeeId, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(Finding::getLeaveType, Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(EXAMPLES_PER_RULE)
                .toList();

            lines.add("### " + rule + " (" + rule.getSeverity() + "), " + rule.getModule().getDisplayName());
            lines.add("");
            for (Finding finding : examples) {
                appendExample(lines, finding);
            }
            lines.add("");
        }
    }

    private void appendExample(List<String> lines, Finding finding) {
        lines.add("- **Employee:** `" + nullToEmpty(finding.getEmployeeId())
            + "`  | **Leave type:** `" + nullToEmpty(finding.getLeaveType())
            + "`  | **As of:** `" + nullToEmpty(finding.getAsOfDate()) + "`");
        lines.add("  - **Message:** " + finding.getMessage());

        JsonNode evidence = readEvidence(finding.getEvidence());
        String explanation = evidence.path("explanation").asText("");
        if (!explanation.isEmpty()) {
            lines.add("  - **Evidence:** " + explanation);
        }

        List<String> sources = new ArrayList<>();
        evidence.path("sources").forEach(source -> sources.add("`" + source.asText() + "`"));
        if (!sources.isEmpty()) {
            lines.add("  - **Sources:** " + String.join(", ", sources));
        }

        List<String> thresholds = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = evidence.path("thresholds").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String value = field.getValue().isValueNode() ? field.getValue().asText() : field.getValue().toString();
            thresholds.add("`" + field.getKey() + "=" + value + "`");
        }
        if (!thresholds.isEmpty()) {
            lines.add("  - **Thresholds:** " + String.join(", ", thresholds));
        }

        lines.add("  - **Next action:** " + finding.getNextAction());
        lines.add("  - **Finding ID:** `" + finding.getFindingId() + "`");
    }

    private JsonNode readEvidence(String evidenceJson) {
        if (evidenceJson == null || evidenceJson.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(evidenceJson);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable evidence omitted from report: {}", e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    private static String formatCount(long count) {
        return String.format(Locale.ROOT, "%,d", count);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
