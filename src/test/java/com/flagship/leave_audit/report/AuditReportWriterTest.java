package com.flagship.leave_audit.report;

import com.flagship.leave_audit.config.JacksonConfig;
import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Evidence;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.FindingFactory;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.ledger.ReconciliationRow;
import com.flagship.leave_audit.lsl.ExposureBand;
import com.flagship.leave_audit.rules.RuleTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditReportWriterTest {

    @TempDir
    Path outputDir;

    private final FindingFactory findingFactory = RuleTestSupport.findingFactory();
    private final AuditReportWriter writer = new AuditReportWriter(new JacksonConfig().csvMapper());

    private Finding finding(RuleCode ruleCode, String employeeId) {
        Evidence evidence = Evidence.builder()
            .source("balances_snapshot.csv")
            .primaryKeys(Evidence.keys(employeeId, "ANNUAL", LocalDate.of(2024, 6, 30)))
            .value("balance_units", -1.0)
            .explanation("The stated snapshot balance is below zero.")
            .build();
        return findingFactory.create(ruleCode, evidence, "Snapshot balance is negative, check postings.");
    }

    @Test
    @DisplayName("Empty findings still produce a header line")
    void testHeaderOnly() throws IOException {
        // When
        Path file = writer.writeFindings(outputDir.resolve("modules/empty.csv"), List.of());

        // Then
        assertEquals(List.of(String.join(",", AuditReportWriter.FINDING_COLUMNS)), Files.readAllLines(file));
    }

    @Test
    @DisplayName("Findings round-trip through CSV quoting with the evidence JSON intact")
    void testFindingsFile() throws IOException {
        // Given
        Finding finding = finding(RuleCode.NEGATIVE_BALANCE, "E1");

        // When
        Path file = writer.writeFindings(outputDir.resolve("findings.csv"), List.of(finding));

        // Then
        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertTrue(lines.get(1).startsWith("E1,ANNUAL,2024-06-30,NEGATIVE_BALANCE,HIGH,"));
        assertTrue(lines.get(1).contains("\"Snapshot balance is negative, check postings.\""));
        assertTrue(lines.get(1).contains("\"\"primary_keys\"\""));
        assertTrue(lines.get(1).contains(finding.getFindingId()));
    }

    @Test
    @DisplayName("Combined findings carry the source module")
    void testCombinedFindings() throws IOException {
        // Given
        Map<AuditModule, List<Finding>> byModule = new EnumMap<>(AuditModule.class);
        byModule.put(AuditModule.LEAVE_LEAKAGE, List.of(finding(RuleCode.NEGATIVE_BALANCE, "E1")));
        byModule.put(AuditModule.LSL_EXPOSURE, List.of(finding(RuleCode.LSL_NEGATIVE_BALANCE, "E2")));

        // When
        List<String> lines = Files.readAllLines(writer.writeCombinedFindings(outputDir.resolve("combined.csv"), byModule));

        // Then
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).endsWith(",next_action,source_module"));
        assertTrue(lines.get(1).endsWith(",leave_leakage"));
        assertTrue(lines.get(2).endsWith(",lsl_exposure"));
    }

    @Test
    @DisplayName("Reconciliation table writes blanks for missing values")
    void testReconciliationFile() throws IOException {
        // Given
        List<ReconciliationRow> rows = List.of(
            new ReconciliationRow("E1", "ANNUAL", LocalDate.of(2024, 6, 30), 6.0, 10.0, -4.0, true,
                "BALANCE_MISMATCH_LEDGER_VS_SNAPSHOT"),
            new ReconciliationRow("E2", "ANNUAL", null, null, 0.0, null, false, ""));

        // When
        List<String> lines = Files.readAllLines(writer.writeReconciliation(outputDir.resolve("leakage.csv"), rows));

        // Then
        assertEquals(String.join(",", AuditReportWriter.RECONCILIATION_COLUMNS), lines.get(0));
        assertEquals("E1,ANNUAL,2024-06-30,6.0,10.0,-4.0,true,BALANCE_MISMATCH_LEDGER_VS_SNAPSHOT", lines.get(1));
        assertEquals("E2,ANNUAL,,,0.0,,false,", lines.get(2));
    }

    @Test
    @DisplayName("Summaries order by severity, then count")
    void testSummaries() throws IOException {
        // Given: Two MEDIUM findings and one HIGH finding
        List<Finding> findings = List.of(
            finding(RuleCode.EVENT_SIGN_ANOMALY, "E1"),
            finding(RuleCode.EVENT_SIGN_ANOMALY, "E2"),
            finding(RuleCode.NEGATIVE_BALANCE, "E3"));

        // When
        List<String> byRule = Files.readAllLines(writer.writeRuleSummary(outputDir.resolve("summary.csv"), findings));
        List<String> bySeverity = Files.readAllLines(
            writer.writeSeveritySummary(outputDir.resolve("by_severity.csv"), findings));

        // Then
        assertEquals(List.of("rule_code,severity,finding_count", "NEGATIVE_BALANCE,HIGH,1", "EVENT_SIGN_ANOMALY,MEDIUM,2"),
            byRule);
        assertEquals(List.of("severity,finding_count", "HIGH,1", "MEDIUM,2"), bySeverity);
    }

    @Test
    @DisplayName("Exposure summary rounds the band and carries the indicative note")
    void testExposureSummary() throws IOException {
        // When
        List<String> lines = Files.readAllLines(writer.writeExposureSummary(
            outputDir.resolve("exposure.csv"), new ExposureBand(1234.567, 2345.671, 2)));

        // Then
        assertEquals("metric,value,currency", lines.get(0));
        assertEquals("estimated_exposure_low,1234.57,AUD", lines.get(1));
        assertEquals("estimated_exposure_high,2345.67,AUD", lines.get(2));
        assertEquals("employees_priced,2,", lines.get(3));
        assertTrue(lines.get(4).startsWith("note,\"Indicative-only estimate based on heuristics,"));
    }
}
