package com.flagship.leave_audit;

import com.flagship.leave_audit.audit.AuditRunner;
import com.flagship.leave_audit.audit.LeakageAuditResult;
import com.flagship.leave_audit.audit.LeaveAuditService;
import com.flagship.leave_audit.audit.LslAuditResult;
import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.report.AuditReportWriter;
import com.flagship.leave_audit.report.FindingComparisonService;
import com.flagship.leave_audit.report.MarkdownReportBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end audit over the bundled sample data
 *
 * These tests verify that:
 * - The application context wires every rule without running the startup audit
 * - Both modules produce the expected findings on the sample data
 * - Repeated runs produce identical finding ids
 * - The runner writes every output file and compares against a previous run
 */
@SpringBootTest(properties = "audit.runner.enabled=false")
class LeaveAuditApplicationTest {

    private static final Path SAMPLE_DIR = Path.of("data/sample");

    @Autowired
    private LeaveAuditService auditService;

    @Autowired
    private AuditReportWriter reportWriter;

    @Autowired
    private MarkdownReportBuilder markdownReportBuilder;

    @Autowired
    private FindingComparisonService comparisonService;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private ApplicationContext applicationContext;

    @TempDir
    Path outputDir;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static Map<RuleCode, Long> countByRule(List<Finding> findings) {
        return findings.stream().collect(Collectors.groupingBy(
            Finding::getRuleCode, () -> new EnumMap<>(RuleCode.class), Collectors.counting()));
    }

    private AuditRunner runner(String previousFindings) {
        AuditRunner runner = new AuditRunner(auditService, reportWriter, markdownReportBuilder, comparisonService);
        ReflectionTestUtils.setField(runner, "inputDir", SAMPLE_DIR.toString());
        ReflectionTestUtils.setField(runner, "outputDir", outputDir.toString());
        ReflectionTestUtils.setField(runner, "organisationName", "Sample Organisation");
        ReflectionTestUtils.setField(runner, "previousFindings", previousFindings);
        return runner;
    }

    @Test
    @DisplayName("Context starts without the startup runner")
    void testContextLoads() {
        assertTrue(applicationContext.getBeansOfType(AuditRunner.class).isEmpty());
    }

    @Test
    @DisplayName("Leakage module finds the seeded ledger and snapshot problems")
    void testLeakageOnSampleData() {
        printTestHeader("Leakage Module on Sample Data");

        // When
        LeakageAuditResult result = auditService.runLeaveLeakage(SAMPLE_DIR);
        Map<RuleCode, Long> counts = countByRule(result.getFindings());
        printOutput("Findings by rule", counts);

        // Then
        assertEquals(2L, counts.get(RuleCode.NEGATIVE_BALANCE));
        assertEquals(2L, counts.get(RuleCode.EVENT_SIGN_ANOMALY));
        assertEquals(1L, counts.get(RuleCode.TAKEN_BEFORE_START_DATE));
        assertEquals(1L, counts.get(RuleCode.CASUAL_ACCRUAL_PRESENT));
        assertEquals(1L, counts.get(RuleCode.BALANCE_MISMATCH_LEDGER_VS_SNAPSHOT));
        assertEquals(11, result.getReconciliation().size());

        Finding mismatch = result.getFindings().stream()
            .filter(f -> f.getRuleCode() == RuleCode.BALANCE_MISMATCH_LEDGER_VS_SNAPSHOT)
            .findFirst().orElseThrow();
        assertEquals("E002", mismatch.getEmployeeId());
        assertEquals(-16.0, mismatch.getDiffUnits());
    }

    @Test
    @DisplayName("LSL module separates missing, zero, low and negative balances")
    void testLslOnSampleData() {
        printTestHeader("LSL Module on Sample Data");

        // When
        LslAuditResult result = auditService.runLslExposure(SAMPLE_DIR);
        printOutput("Findings", result.getFindings().size());
        printOutput("Exposure", result.getExposure());

        // Then
        Map<String, RuleCode> byEmployee = result.getFindings().stream()
            .collect(Collectors.toMap(Finding::getEmployeeId, Finding::getRuleCode));
        assertEquals(Map.of(
            "E002", RuleCode.LSL_MISSING_FOR_ELIGIBLE_EMPLOYEE,
            "E004", RuleCode.LSL_ZERO_BALANCE_FOR_LONG_TENURE,
            "E005", RuleCode.LSL_BALANCE_SUSPICIOUSLY_LOW,
            "E006", RuleCode.LSL_NEGATIVE_BALANCE
        ), byEmployee);
        assertEquals(7, result.getStates().size());
        assertEquals(5, result.getExposure().getEmployeesCounted());
        assertTrue(result.getExposure().getTotalHigh() >= result.getExposure().getTotalLow());
        assertTrue(result.getDateWarnings().isEmpty());
        assertTrue(meterRegistry.find("audit.findings").tag("module", "lsl_exposure").counters().size() > 0);
    }

    @Test
    @DisplayName("Identical input yields identical finding ids")
    void testIdempotentRuns() {
        // When
        List<String> first = auditService.runLeaveLeakage(SAMPLE_DIR).getFindings().stream()
            .map(Finding::getFindingId).toList();
        List<String> second = auditService.runLeaveLeakage(SAMPLE_DIR).getFindings().stream()
            .map(Finding::getFindingId).toList();

        // Then
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Runner writes every output file and classifies a repeat run as persisted")
    void testRunnerOutputs() throws IOException {
        printTestHeader("Runner Outputs");

        // Given: A first run without comparison
        Map<AuditModule, List<Finding>> firstRun = runner("").run(SAMPLE_DIR, outputDir);

        // Then
        for (String file : List.of(
                "modules/leave_leakage_findings.csv",
                "modules/leave_leakage_summary.csv",
                "modules/leave_leakage_summary_by_severity.csv",
                "modules/leakage_report.csv",
                "modules/lsl_findings.csv",
                "modules/lsl_summary.csv",
                "modules/lsl_summary_by_severity.csv",
                "modules/lsl_exposure_summary.csv",
                "combined_findings.csv",
                "report.md")) {
            assertTrue(Files.isRegularFile(outputDir.resolve(file)), file);
        }
        assertFalse(Files.exists(outputDir.resolve("finding_changes.csv")));
        assertEquals(12, Files.readAllLines(outputDir.resolve("combined_findings.csv")).size());
        assertTrue(Files.readString(outputDir.resolve("report.md")).contains("Sample Organisation"));

        // When: A second run compared with a copy of the first
        Path previous = Files.copy(outputDir.resolve("combined_findings.csv"), outputDir.resolve("previous.csv"));
        runner(previous.toString()).run(SAMPLE_DIR, outputDir);

        // Then
        List<String> changes = Files.readAllLines(outputDir.resolve("finding_changes.csv"));
        int findingCount = firstRun.values().stream().mapToInt(List::size).sum();
        assertEquals(findingCount + 1, changes.size());
        assertTrue(changes.stream().skip(1).allMatch(line -> line.endsWith(",PERSISTED")));
    }

    @Test
    @DisplayName("Missing-value LSL balances and two-digit start years are audited like their plain equivalents")
    void testLslWithMissingValuesAndShortYears(@TempDir Path inputDir) throws IOException {
        printTestHeader("LSL Module with Missing Values and Two-Digit Years");

        // Given
        Files.writeString(inputDir.resolve("employees.csv"), String.join("\n",
            "employee_id,employment_type,fte,start_date",
            "E1,FULL_TIME,1.0,01/03/85",
            "E2,FULL_TIME,1.0,01/07/2010",
            "E3,PART_TIME,0.6,15/03/99",
            ""));
        Files.writeString(inputDir.resolve("balances_snapshot.csv"), String.join("\n",
            "employee_id,leave_type,as_of_date,balance_units",
            "E1,LSL,30/06/2024,NaN",
            "E2,LSL,30/06/2024,N/A",
            "E3,LSL,30/06/2024,0",
            ""));

        // When
        LslAuditResult result = auditService.runLslExposure(inputDir);
        Map<String, RuleCode> byEmployee = result.getFindings().stream()
            .collect(Collectors.toMap(Finding::getEmployeeId, Finding::getRuleCode));
        printOutput("Findings by employee", byEmployee);

        // Then
        assertEquals(Map.of(
            "E1", RuleCode.LSL_MISSING_FOR_ELIGIBLE_EMPLOYEE,
            "E2", RuleCode.LSL_MISSING_FOR_ELIGIBLE_EMPLOYEE,
            "E3", RuleCode.LSL_ZERO_BALANCE_FOR_LONG_TENURE), byEmployee);
        assertTrue(result.getStates().get(0).getServiceYears() > 39.0);
        assertTrue(result.getDateWarnings().isEmpty());
    }
}
