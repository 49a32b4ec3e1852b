package com.flagship.leave_audit.observability;

import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Evidence;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.RuleCode;
import com.flagship.leave_audit.input.DateParseWarning;
import com.flagship.leave_audit.rules.RuleTestSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AuditMetrics metrics = new AuditMetrics(registry);

    @AfterEach
    void tearDown() {
        RunContext.clear();
    }

    @Test
    @DisplayName("Findings are counted per module, rule and severity")
    void testRecordFindings() {
        // Given
        Evidence evidence = Evidence.builder()
            .primaryKeys(Evidence.keys("E1", "ANNUAL", LocalDate.of(2024, 6, 30)))
            .build();
        Finding finding = RuleTestSupport.findingFactory().create(RuleCode.NEGATIVE_BALANCE, evidence, "negative");

        // When
        metrics.recordFindings(List.of(finding, finding));

        // Then
        assertEquals(2.0, registry.get("audit.findings")
            .tag("module", "leave_leakage")
            .tag("rule_code", "NEGATIVE_BALANCE")
            .tag("severity", "HIGH")
            .counter().count());
    }

    @Test
    @DisplayName("Coerced dates are counted by table and column")
    void testRecordDateWarnings() {
        metrics.recordDateWarnings(List.of(new DateParseWarning("employees", "start_date", 3)));

        assertEquals(3.0, registry.get("audit.dates.coerced").tag("table", "employees").counter().count());
    }

    @Test
    @DisplayName("Module timer records one sample per run and returns the result")
    void testTimeModule() {
        String result = metrics.timeModule(AuditModule.LSL_EXPOSURE, () -> "done");

        assertEquals("done", result);
        assertEquals(1, registry.get("audit.module.duration").tag("module", "lsl_exposure").timer().count());
    }

    @Test
    @DisplayName("Run id is placed in and removed from the MDC")
    void testRunContext() {
        String runId = RunContext.start();

        assertEquals(8, runId.length());
        assertEquals(runId, RunContext.getRunId());

        RunContext.clear();
        assertNull(RunContext.getRunId());
    }
}
