package com.flagship.leave_audit.audit;

import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.input.exception.LeaveAuditException;
import com.flagship.leave_audit.ledger.ReconciliationRow;
import com.flagship.leave_audit.observability.RunContext;
import com.flagship.leave_audit.report.AuditReportWriter;
import com.flagship.leave_audit.report.FindingChange;
import com.flagship.leave_audit.report.FindingComparisonService;
import com.flagship.leave_audit.report.MarkdownReportBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs both audit modules once at startup and writes every output file.
 *
 * Disabled with {@code audit.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "audit.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AuditRunner implements CommandLineRunner {

    static final String MODULES_DIR = "modules";

    private final LeaveAuditService auditService;
    private final AuditReportWriter reportWriter;
    private final MarkdownReportBuilder markdownReportBuilder;
    private final FindingComparisonService comparisonService;

    @Value("${audit.input-dir:data/sample}")
    private String inputDir;

    @Value("${audit.output-dir:outputs}")
    private String outputDir;

    @Value("${audit.organisation-name:Organisation not specified}")
    private String organisationName;

    @Value("${audit.compare.previous-findings:}")
    private String previousFindings;

    @Override
    public void run(String... args) {
        String runId = RunContext.start();
        try {
            log.info("Starting audit run {}: input={}, output={}", runId, inputDir, outputDir);
            run(Path.of(inputDir), Path.of(outputDir));
        } catch (LeaveAuditException e) {
            log.error("Audit run aborted: {}", e.getMessage());
            throw e;
        } finally {
            RunContext.clear();
        }
    }

    /**
     * Executes the leakage module, then the LSL module, writing each module's files as it
     * completes, then the combined outputs.
     */
    public Map<AuditModule, List<Finding>> run(Path input, Path output) {
        Path modules = output.resolve(MODULES_DIR);
        Map<AuditModule, List<Finding>> findingsByModule = new EnumMap<>(AuditModule.class);

        LeakageAuditResult leakage = auditService.runLeaveLeakage(input);
        reportWriter.writeFindings(modules.resolve("leave_leakage_findings.csv"), leakage.getFindings());
        reportWriter.writeRuleSummary(modules.resolve("leave_leakage_summary.csv"), leakage.getFindings());
        reportWriter.writeSeveritySummary(modules.resolve("leave_leakage_summary_by_severity.csv"), leakage.getFindings());
        reportWriter.writeReconciliation(modules.resolve("leakage_report.csv"), leakage.getReconciliation());
        findingsByModule.put(AuditModule.LEAVE_LEAKAGE, leakage.getFindings());

        LslAuditResult lsl = auditService.runLslExposure(input);
        reportWriter.writeFindings(modules.resolve("lsl_findings.csv"), lsl.getFindings());
        reportWriter.writeRuleSummary(modules.resolve("lsl_summary.csv"), lsl.getFindings());
        reportWriter.writeSeveritySummary(modules.resolve("lsl_summary_by_severity.csv"), lsl.getFindings());
        reportWriter.writeExposureSummary(modules.resolve("lsl_exposure_summary.csv"), lsl.getExposure());
        findingsByModule.put(AuditModule.LSL_EXPOSURE, lsl.getFindings());

        List<Finding> combined = new ArrayList<>();
        findingsByModule.values().forEach(combined::addAll);
        reportWriter.writeCombinedFindings(output.resolve("combined_findings.csv"), findingsByModule);

        if (previousFindings != null && !previousFindings.isBlank()) {
            List<FindingChange> changes = comparisonService.compare(combined, Path.of(previousFindings));
            reportWriter.writeFindingChanges(output.resolve("finding_changes.csv"), changes);
        }

        String report = markdownReportBuilder.build(organisationName, LocalDateTime.now(), combined, lsl.getExposure());
        reportWriter.writeText(output.resolve("report.md"), report);

        log.info("Audit complete: {} leakage finding(s), {} LSL finding(s), {} reconciliation row(s) flagged",
            leakage.getFindings().size(),
            lsl.getFindings().size(),
            leakage.getReconciliation().stream().filter(ReconciliationRow::isRiskFlag).count());
        return findingsByModule;
    }
}
