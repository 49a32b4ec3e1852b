package com.flagship.leave_audit.rules;

import com.flagship.leave_audit.finding.AuditModule;
import com.flagship.leave_audit.finding.Finding;
import com.flagship.leave_audit.finding.RuleCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the rule catalogue.
 *
 * Exactly one {@link AuditRule} must be registered per {@link RuleCode}. Rules of a
 * module run in catalogue order and their findings are concatenated; since rules are
 * independent, the order only affects presentation.
 */
@Service
@Slf4j
public class RuleEngine {

    private final Map<RuleCode, AuditRule> rules;

    public RuleEngine(List<AuditRule> rules) {
        Map<RuleCode, AuditRule> byCode = new EnumMap<>(RuleCode.class);
        for (AuditRule rule : rules) {
            AuditRule previous = byCode.put(rule.getRuleCode(), rule);
            if (previous != null) {
                throw new IllegalStateException(String.format("Rule %s registered twice: %s and %s",
                    rule.getRuleCode(), previous.getClass().getSimpleName(), rule.getClass().getSimpleName()));
            }
        }
        for (RuleCode code : RuleCode.values()) {
            if (!byCode.containsKey(code)) {
                throw new IllegalStateException("No rule registered for " + code);
            }
        }
        this.rules = Collections.unmodifiableMap(byCode);
    }

    /**
     * Evaluates every rule belonging to a module.
     *
     * @return Findings in rule catalogue order, then in each rule's scan order
     */
    public List<Finding> evaluate(AuditModule module, AuditContext context) {
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<RuleCode, AuditRule> entry : rules.entrySet()) {
            if (entry.getKey().getModule() != module) {
                continue;
            }
            List<Finding> ruleFindings = entry.getValue().evaluate(context);
            log.debug("Rule {} produced {} findings", entry.getKey(), ruleFindings.size());
            findings.addAll(ruleFindings);
        }
        log.info("Module {} produced {} findings", module.getId(), findings.size());
        return List.copyOf(findings);
    }

    /**
     * Evaluates a single rule.
     */
    public List<Finding> evaluate(RuleCode ruleCode, AuditContext context) {
        return rules.get(ruleCode).evaluate(context);
    }
}
