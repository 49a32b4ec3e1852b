package com.flagship.leave_audit.observability;

import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.input.DateParseWarning;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Centralized metrics for audit runs.
 *
 * Metrics exposed:
 * - audit.findings: Counter of findings, tagged by module, rule_code and severity
 * - audit.dates.coerced: Counter of dates coerced to missing under the lenient policy
 * - audit.module.duration: Timer per audit module
 */
@Component
public class AuditMetrics {

    private final MeterRegistry registry;

    public AuditMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordFindings(List<Finding> findings) {
        for (Finding finding : findings) {
            registry.counter("audit.findings",
                    "module", finding.getModule().getId(),
                    "rule_code", finding.getRuleCode().name(),
                    "severity", finding.getSeverity().name()
            ).increment();
        }
    }

    public void recordDateWarnings(List<DateParseWarning> warnings) {
        for (DateParseWarning warning : warnings) {
            registry.counter("audit.dates.coerced",
                    "table", warning.getTable(),
                    "column", warning.getColumn()
            ).increment(warning.getRowCount());
        }
    }

    /**
     * Times one audit module.
     */
    public <T> T timeModule(AuditModule module, Supplier<T> operation) {
        return Timer.builder("audit.module.duration")
                .description("Time taken to load inputs and evaluate one audit module")
                .tag("module", module.getId())
                .register(registry)
                .record(operation);
    }
}
