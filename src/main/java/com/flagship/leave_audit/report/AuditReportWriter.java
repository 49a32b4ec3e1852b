package com.flagship.leave_audit.report;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.ledger.ReconciliationRow;
import com.flagship.leave_audit.ledger.Units;
import com.flagship.leave_audit.lsl.ExposureBand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the tabular outputs of a run as CSV files.
 *
 * Every file gets its header line, even when there are no data rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditReportWriter {

    public static final List<String> FINDING_COLUMNS = List.of(
        "employee_id", "leave_type", "as_of_date", "rule_code", "severity", "message",
        "diff_units", "evidence", "finding_id", "next_action");

    public static final List<String> RECONCILIATION_COLUMNS = List.of(
        "employee_id", "leave_type", "as_of_date", "balance_units", "ledger_balance_units",
        "diff_units", "risk_flag", "risk_reason");

    private final CsvMapper csvMapper;

    public Path writeFindings(Path file, List<Finding> findings) {
        List<Object[]> rows = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            rows.add(findingRow(finding, null));
        }
        return writeTable(file, FINDING_COLUMNS, rows);
    }

    /**
     * Writes all modules' findings into one table with a trailing {@code source_module} column.
     */
    public Path writeCombinedFindings(Path file, Map<AuditModule, List<Finding>> findingsByModule) {
        List<String> columns = new ArrayList<>(FINDING_COLUMNS);
        columns.add("source_module");

        List<Object[]> rows = new ArrayList<>();
        findingsByModule.forEach((module, findings) -> {
            for (Finding finding : findings) {
                rows.add(findingRow(finding, module.getId()));
            }
        });
        return writeTable(file, columns, rows);
    }

    public Path writeReconciliation(Path file, List<ReconciliationRow> reconciliation) {
        List<Object[]> rows = new ArrayList<>(reconciliation.size());
        for (ReconciliationRow row : reconciliation) {
            rows.add(new Object[] {
                row.getEmployeeId(),
                row.getLeaveType(),
                row.getAsOfDate() == null ? null : row.getAsOfDate().toString(),
                row.getBalanceUnits(),
                row.getLedgerBalanceUnits(),
                row.getDiffUnits(),
                row.isRiskFlag(),
                row.getRiskReason()
            });
        }
        return writeTable(file, RECONCILIATION_COLUMNS, rows);
    }

    public Path writeRuleSummary(Path file, List<Finding> findings) {
        List<Object[]> rows = new ArrayList<>();
        for (RuleSeverityCount count : FindingSummary.byRuleAndSeverity(findings)) {
            rows.add(new Object[] {count.getRuleCode().name(), count.getSeverity().name(), count.getFindingCount()});
        }
        return writeTable(file, List.of("rule_code", "severity", "finding_count"), rows);
    }

    public Path writeSeveritySummary(Path file, List<Finding> findings) {
        List<Object[]> rows = new ArrayList<>();
        for (SeverityCount count : FindingSummary.bySeverity(findings)) {
            rows.add(new Object[] {count.getSeverity().name(), count.getFindingCount()});
        }
        return writeTable(file, List.of("severity", "finding_count"), rows);
    }

    public Path writeExposureSummary(Path file, ExposureBand exposure) {
        List<Object[]> rows = List.of(
            new Object[] {"estimated_exposure_low", Units.round2(exposure.getTotalLow()), exposure.getCurrency()},
            new Object[] {"estimated_exposure_high", Units.round2(exposure.getTotalHigh()), exposure.getCurrency()},
            new Object[] {"employees_priced", exposure.getEmployeesCounted(), ""},
            new Object[] {"note", exposure.getNote(), ""}
        );
        return writeTable(file, List.of("metric", "value", "currency"), rows);
    }

    public Path writeFindingChanges(Path file, List<FindingChange> changes) {
        List<Object[]> rows = new ArrayList<>(changes.size());
        for (FindingChange change : changes) {
            rows.add(new Object[] {
                change.getFindingId(), change.getRuleCode(), change.getEmployeeId(),
                change.getLeaveType(), change.getAsOfDate(), change.getStatus().name()
            });
        }
        return writeTable(file,
            List.of("finding_id", "rule_code", "employee_id", "leave_type", "as_of_date", "status"), rows);
    }

    public Path writeText(Path file, String content) {
        try {
            createParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        log.info("Wrote: {}", file);
        return file;
    }

    private Object[] findingRow(Finding finding, String sourceModule) {
        List<Object> cells = new ArrayList<>(List.of(
            nullToEmpty(finding.getEmployeeId()),
            nullToEmpty(finding.getLeaveType()),
            nullToEmpty(finding.getAsOfDate()),
            finding.getRuleCode().name(),
            finding.getSeverity().name(),
            finding.getMessage(),
            nullToEmpty(finding.getDiffUnits()),
            nullToEmpty(finding.getEvidence()),
            finding.getFindingId(),
            finding.getNextAction()
        ));
        if (sourceModule != null) {
            cells.add(sourceModule);
        }
        return cells.toArray();
    }

    private static Object nullToEmpty(Object value) {
        return value == null ? "" : value;
    }

    private Path writeTable(Path file, List<String> columns, List<Object[]> rows) {
        CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);

        try {
            createParent(file);
            try (SequenceWriter writer = csvMapper.writer(schema.build().withoutHeader()).writeValues(file.toFile())) {
                writer.write(columns.toArray());
                for (Object[] row : rows) {
                    writer.write(row);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        log.info("Wrote: {} ({} rows)", file, rows.size());
        return file;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
