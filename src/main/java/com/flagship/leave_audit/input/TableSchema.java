package com.flagship.leave_audit.input;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The input tables the audit reads, with their required columns and the ordered
 * header synonyms accepted for each canonical column.
 *
 * Synonyms are tried in order; the first one present in the file header wins.
 */
public enum TableSchema {

    EMPLOYEES("employees", "employees.csv",
        Set.of("employee_id", "employment_type", "fte", "start_date"),
        aliases(
            Map.entry("employee_id", List.of("employee_id", "emp_id", "employee_number")),
            Map.entry("employment_type", List.of("employment_type", "employment_status", "emp_type")),
            Map.entry("fte", List.of("fte", "fte_ratio")),
            Map.entry("start_date", List.of("start_date", "hire_date", "commencement_date")),
            Map.entry("end_date", List.of("end_date", "termination_date"))
        )),

    LEAVE_LEDGER("leave_ledger", "leave_ledger.csv",
        Set.of("employee_id", "leave_type", "event_date", "units", "event_type"),
        aliases(
            Map.entry("employee_id", List.of("employee_id", "emp_id", "employee_number")),
            Map.entry("leave_type", List.of("leave_type", "leave_code")),
            Map.entry("event_date", List.of("event_date", "transaction_date", "date")),
            Map.entry("units", List.of("units", "hours", "units_hours")),
            Map.entry("event_type", List.of("event_type", "transaction_type"))
        )),

    BALANCES_SNAPSHOT("balances_snapshot", "balances_snapshot.csv",
        Set.of("employee_id", "leave_type", "as_of_date", "balance_units"),
        aliases(
            Map.entry("employee_id", List.of("employee_id", "emp_id", "employee_number")),
            Map.entry("leave_type", List.of("leave_type", "leave_code")),
            Map.entry("as_of_date", List.of("as_of_date", "balance_date", "snapshot_date")),
            Map.entry("balance_units", List.of("balance_units", "balance", "balance_hours"))
        )),

    PAY_RATES("pay_rates", "pay_rates.csv",
        Set.of("employee_id"),
        aliases(
            Map.entry("employee_id", List.of("employee_id", "emp_id", "employee_number")),
            Map.entry("hourly_rate", List.of("hourly_rate", "base_hourly_rate", "rate")),
            Map.entry("annual_salary", List.of("annual_salary", "salary", "base_salary")),
            Map.entry("as_of_date", List.of("as_of_date", "effective_date"))
        )),

    PREVIOUS_FINDINGS("previous_findings", "combined_findings.csv",
        Set.of("finding_id", "rule_code", "employee_id"),
        aliases(
            Map.entry("finding_id", List.of("finding_id")),
            Map.entry("rule_code", List.of("rule_code")),
            Map.entry("employee_id", List.of("employee_id")),
            Map.entry("leave_type", List.of("leave_type")),
            Map.entry("as_of_date", List.of("as_of_date")),
            Map.entry("severity", List.of("severity"))
        ));

    private final String tableName;
    private final String fileName;
    private final Set<String> requiredColumns;
    private final Map<String, List<String>> columnAliases;

    TableSchema(String tableName, String fileName, Set<String> requiredColumns,
                Map<String, List<String>> columnAliases) {
        this.tableName = tableName;
        this.fileName = fileName;
        this.requiredColumns = new TreeSet<>(requiredColumns);
        this.columnAliases = columnAliases;
    }

    public String getTableName() {
        return tableName;
    }

    public String getFileName() {
        return fileName;
    }

    public Set<String> getRequiredColumns() {
        return requiredColumns;
    }

    /**
     * Canonical column name to its accepted header synonyms, in resolution order.
     */
    public Map<String, List<String>> getColumnAliases() {
        return columnAliases;
    }

    @SafeVarargs
    private static Map<String, List<String>> aliases(Map.Entry<String, List<String>>... entries) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : entries) {
            map.put(entry.getKey(), entry.getValue());
        }
        return map;
    }
}
