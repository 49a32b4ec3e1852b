package com.flagship.leave_audit.input;

import com.flagship.leave_audit.employee.Employee;
import com.flagship.leave_audit.input.exception.InvalidValueException;
import com.flagship.leave_audit.input.exception.SchemaException;
import com.flagship.leave_audit.ledger.EventType;
import com.flagship.leave_audit.ledger.LedgerEvent;
import com.flagship.leave_audit.ledger.SnapshotRow;
import com.flagship.leave_audit.lsl.PayRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the input tables for each audit module.
 *
 * Order of checks per table: file present, required columns present (before any cell
 * is typed), then dates and numbers are parsed row by row.
 *
 * The leakage path uses the strict date policy for the columns its rules read; the LSL
 * path uses the lenient one and reports coerced dates as {@link DateParseWarning}s.
 * {@code fte} is informational on both paths and a malformed value is read as absent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InputLoader {

    private final CsvTableReader csvTableReader;

    /**
     * Loads employees, ledger and snapshot with strict date parsing.
     */
    public AuditDataset loadLeakageInputs(Path inputDir) {
        InputTable employeesTable = readValidated(inputDir, TableSchema.EMPLOYEES);
        InputTable ledgerTable = readValidated(inputDir, TableSchema.LEAVE_LEDGER);
        InputTable snapshotTable = readValidated(inputDir, TableSchema.BALANCES_SNAPSHOT);

        TemporalNormalizer dates = TemporalNormalizer.strict();
        // end_date is not read by any leakage rule
        TemporalNormalizer unusedDates = TemporalNormalizer.lenient();
        List<Employee> employees = toEmployees(employeesTable, dates, unusedDates);
        List<LedgerEvent> ledger = toLedgerEvents(ledgerTable, dates);
        List<SnapshotRow> snapshot = toSnapshotRows(snapshotTable, dates);

        log.info("Loaded leakage inputs: employees={}, ledgerEvents={}, snapshotRows={}",
                employees.size(), ledger.size(), snapshot.size());
        return new AuditDataset(employees, ledger, snapshot, List.of(), List.of());
    }

    /**
     * Loads employees, snapshot and optional pay rates with lenient date parsing.
     */
    public AuditDataset loadLslInputs(Path inputDir) {
        InputTable employeesTable = readValidated(inputDir, TableSchema.EMPLOYEES);
        InputTable snapshotTable = readValidated(inputDir, TableSchema.BALANCES_SNAPSHOT);

        InputTable payRatesTable = null;
        Path payRatesFile = inputDir.resolve(TableSchema.PAY_RATES.getFileName());
        if (Files.isRegularFile(payRatesFile)) {
            payRatesTable = readValidated(inputDir, TableSchema.PAY_RATES);
            if (!payRatesTable.hasColumn("hourly_rate") && !payRatesTable.hasColumn("annual_salary")) {
                throw new SchemaException(TableSchema.PAY_RATES.getTableName(), List.of("annual_salary|hourly_rate"));
            }
        } else {
            log.info("No {} found in {}; LSL exposure will not be priced", TableSchema.PAY_RATES.getFileName(), inputDir);
        }

        TemporalNormalizer dates = TemporalNormalizer.lenient();
        List<Employee> employees = toEmployees(employeesTable, dates, dates);
        List<SnapshotRow> snapshot = toSnapshotRows(snapshotTable, dates);
        List<PayRate> payRates = payRatesTable == null ? List.of() : toPayRates(payRatesTable, dates);

        List<DateParseWarning> warnings = dates.getWarnings();
        log.info("Unparseable employee start_date rows: {}",
                dates.coercedCount(TableSchema.EMPLOYEES.getTableName(), "start_date"));
        log.info("Unparseable snapshot as_of_date rows: {}",
                dates.coercedCount(TableSchema.BALANCES_SNAPSHOT.getTableName(), "as_of_date"));
        for (DateParseWarning warning : warnings) {
            log.warn("{} (treated as missing)", warning);
        }

        log.info("Loaded LSL inputs: employees={}, snapshotRows={}, payRates={}",
                employees.size(), snapshot.size(), payRates.size());
        return new AuditDataset(employees, List.of(), snapshot, payRates, warnings);
    }

    private InputTable readValidated(Path inputDir, TableSchema schema) {
        InputTable table = csvTableReader.read(inputDir.resolve(schema.getFileName()), schema);
        SchemaValidator.requireColumns(table);
        return table;
    }

    private List<Employee> toEmployees(InputTable table, TemporalNormalizer startDates, TemporalNormalizer endDates) {
        List<Employee> employees = new ArrayList<>(table.getRows().size());
        for (InputTable.Row row : table.getRows()) {
            employees.add(new Employee(
                row.get("employee_id"),
                row.get("employment_type"),
                parseNumberLeniently(table, row, "fte"),
                startDates.normalize(row, table.getName(), "start_date"),
                table.hasColumn("end_date") ? endDates.normalize(row, table.getName(), "end_date") : null
            ));
        }
        return List.copyOf(employees);
    }

    private List<LedgerEvent> toLedgerEvents(InputTable table, TemporalNormalizer dates) {
        List<LedgerEvent> events = new ArrayList<>(table.getRows().size());
        for (InputTable.Row row : table.getRows()) {
            String rawType = row.get("event_type");
            events.add(new LedgerEvent(
                row.get("employee_id"),
                row.get("leave_type"),
                dates.normalize(row, table.getName(), "event_date"),
                EventType.fromCode(rawType),
                rawType,
                parseNumber(table, row, "units"),
                row.getRowNumber()
            ));
        }
        long unknown = events.stream().filter(e -> e.getEventType() == EventType.UNKNOWN).count();
        if (unknown > 0) {
            log.warn("{} ledger rows have an event_type other than ACCRUAL or TAKEN", unknown);
        }
        return List.copyOf(events);
    }

    private List<SnapshotRow> toSnapshotRows(InputTable table, TemporalNormalizer dates) {
        List<SnapshotRow> rows = new ArrayList<>(table.getRows().size());
        for (InputTable.Row row : table.getRows()) {
            rows.add(new SnapshotRow(
                row.get("employee_id"),
                row.get("leave_type"),
                dates.normalize(row, table.getName(), "as_of_date"),
                parseNumber(table, row, "balance_units"),
                row.getRowNumber()
            ));
        }
        return List.copyOf(rows);
    }

    private List<PayRate> toPayRates(InputTable table, TemporalNormalizer dates) {
        List<PayRate> rates = new ArrayList<>(table.getRows().size());
        for (InputTable.Row row : table.getRows()) {
            rates.add(new PayRate(
                row.get("employee_id"),
                table.hasColumn("hourly_rate") ? parseNumber(table, row, "hourly_rate") : null,
                table.hasColumn("annual_salary") ? parseNumber(table, row, "annual_salary") : null,
                table.hasColumn("as_of_date") ? dates.normalize(row, table.getName(), "as_of_date") : null,
                row.getRowNumber()
            ));
        }
        return List.copyOf(rates);
    }

    /**
     * Blank and missing-value cells are absent values; anything else must parse as a
     * finite number.
     */
    static Double parseNumber(InputTable table, InputTable.Row row, String column) {
        String raw = row.get(column);
        if (raw == null) {
            return null;
        }
        Double value = toNumber(raw);
        if (value == null) {
            throw new InvalidValueException(table.getName(), column, row.getRowNumber(), raw);
        }
        return value;
    }

    /**
     * Like {@link #parseNumber} but an unparseable cell is treated as absent.
     */
    static Double parseNumberLeniently(InputTable table, InputTable.Row row, String column) {
        String raw = row.get(column);
        if (raw == null) {
            return null;
        }
        Double value = toNumber(raw);
        if (value == null) {
            log.debug("Ignoring non-numeric {}.{} row {}: '{}'", table.getName(), column, row.getRowNumber(), raw);
        }
        return value;
    }

    private static Double toNumber(String raw) {
        try {
            double value = Double.parseDouble(raw.replace(",", ""));
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
