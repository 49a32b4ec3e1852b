package com.flagship.leave_audit.audit;

import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.input.AuditDataset;
import com.flagship.leave_audit.input.InputLoader;
import com.flagship.leave_audit.ledger.LedgerReconciliationService;
import com.flagship.leave_audit.ledger.ReconciliationRow;
import com.flagship.leave_audit.lsl.ExposureBand;
import com.flagship.leave_audit.lsl.ExposureEstimator;
import com.flagship.leave_audit.lsl.LslState;
import com.flagship.leave_audit.lsl.LslStateBuilder;
import com.flagship.leave_audit.observability.AuditMetrics;
import com.flagship.leave_audit.rules.AuditContext;
import com.flagship.leave_audit.rules.AuditParameters;
import com.flagship.leave_audit.rules.RuleEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the audit modules end to end, from input files to findings.
 *
 * Each module loads its own inputs under its own date policy, so a fatal input error
 * in one module never leaves a partially evaluated findings table behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveAuditService {

    private final InputLoader inputLoader;
    private final LedgerReconciliationService reconciliationService;
    private final LslStateBuilder lslStateBuilder;
    private final ExposureEstimator exposureEstimator;
    private final RuleEngine ruleEngine;
    private final AuditParameters parameters;
    private final AuditMetrics metrics;

    /**
     * Leave leakage: strict date parsing, ledger replay, then the leakage rules.
     */
    public LeakageAuditResult runLeaveLeakage(Path inputDir) {
        return metrics.timeModule(AuditModule.LEAVE_LEAKAGE, () -> {
            AuditDataset data = inputLoader.loadLeakageInputs(inputDir);

            List<ReconciliationRow> reconciliation = reconciliationService.reconcile(
                data.getSnapshot(), data.getLedger(), parameters.getRiskTolerance());

            AuditContext context = AuditContext.builder()
                .employees(data.getEmployees())
                .ledger(data.getLedger())
                .snapshot(data.getSnapshot())
                .reconciliation(reconciliation)
                .parameters(parameters)
                .build();

            List<Finding> findings = ruleEngine.evaluate(AuditModule.LEAVE_LEAKAGE, context);
            metrics.recordFindings(findings);
            return new LeakageAuditResult(findings, reconciliation);
        });
    }

    /**
     * LSL exposure: lenient date parsing, LSL state, LSL rules and the exposure band.
     */
    public LslAuditResult runLslExposure(Path inputDir) {
        return metrics.timeModule(AuditModule.LSL_EXPOSURE, () -> {
            AuditDataset data = inputLoader.loadLslInputs(inputDir);
            metrics.recordDateWarnings(data.getDateWarnings());

            List<LslState> states = lslStateBuilder.build(
                data.getEmployees(), data.getSnapshot(), data.getPayRates(), parameters);

            AuditContext context = AuditContext.builder()
                .employees(data.getEmployees())
                .snapshot(data.getSnapshot())
                .lslStates(states)
                .parameters(parameters)
                .build();

            List<Finding> findings = ruleEngine.evaluate(AuditModule.LSL_EXPOSURE, context);
            metrics.recordFindings(findings);

            ExposureBand exposure = exposureEstimator.estimate(states, parameters);
            return new LslAuditResult(findings, states, exposure, data.getDateWarnings());
        });
    }
}
