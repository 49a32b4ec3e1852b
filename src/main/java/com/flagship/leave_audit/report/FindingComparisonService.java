package com.flagship.leave_audit.report;

import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.input.CsvTableReader;
import com.flagship.leave_audit.input.InputTable;
import com.flagship.leave_audit.input.SchemaValidator;
import com.flagship.leave_audit.input.TableSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diffs the current findings against a previous run's combined findings file, keyed
 * on finding id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FindingComparisonService {

    private final CsvTableReader csvTableReader;

    public List<FindingChange> compare(List<Finding> current, Path previousFindingsFile) {
        InputTable previous = csvTableReader.read(previousFindingsFile, TableSchema.PREVIOUS_FINDINGS);
        SchemaValidator.requireColumns(previous);
        return compare(current, previous);
    }

    /**
     * Current findings come first (NEW or PERSISTED, in current order), followed by
     * RESOLVED findings in the previous file's order. Each id is reported once.
     */
    public List<FindingChange> compare(List<Finding> current, InputTable previous) {
        Map<String, InputTable.Row> previousById = new LinkedHashMap<>();
        for (InputTable.Row row : previous.getRows()) {
            String id = row.get("finding_id");
            if (id != null) {
                previousById.putIfAbsent(id, row);
            }
        }

        List<FindingChange> changes = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Finding finding : current) {
            if (!seen.add(finding.getFindingId())) {
                continue;
            }
            ChangeStatus status = previousById.containsKey(finding.getFindingId())
                ? ChangeStatus.PERSISTED
                : ChangeStatus.NEW;
            changes.add(new FindingChange(finding.getFindingId(), finding.getRuleCode().name(),
                finding.getEmployeeId(), finding.getLeaveType(), finding.getAsOfDate(), status));
        }

        for (Map.Entry<String, InputTable.Row> entry : previousById.entrySet()) {
            if (seen.contains(entry.getKey())) {
                continue;
            }
            InputTable.Row row = entry.getValue();
            changes.add(new FindingChange(entry.getKey(), row.get("rule_code"), row.get("employee_id"),
                row.get("leave_type"), row.get("as_of_date"), ChangeStatus.RESOLVED));
        }

        Map<ChangeStatus, Integer> totals = new EnumMap<>(ChangeStatus.class);
        changes.forEach(change -> totals.merge(change.getStatus(), 1, Integer::sum));
        log.info("Compared with previous run: {}", totals);
        return changes;
    }
}
