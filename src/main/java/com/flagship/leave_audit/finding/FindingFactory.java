package com.flagship.leave_audit.finding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds findings: serializes the evidence, derives the finding id and attaches the
 * rule's severity and next action.
 *
 * A failure to serialize evidence never fails the run. The finding is still produced,
 * without evidence, and its id degrades to the rule code alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FindingFactory {

    private final ObjectMapper objectMapper;
    private final FindingIdGenerator findingIdGenerator;

    public Finding create(RuleCode ruleCode, Evidence evidence, String message) {
        return create(ruleCode, evidence, message, null);
    }

    /**
     * @param ruleCode Rule that fired
     * @param evidence Evidence whose primary keys name the offending record
     * @param message Human-readable description
     * @param diffUnits Signed difference, for reconciliation findings
     */
    public Finding create(RuleCode ruleCode, Evidence evidence, String message, Double diffUnits) {
        String evidenceJson = serialize(ruleCode, evidence);
        return new Finding(
            evidence.primaryKey("employee_id"),
            evidence.primaryKey("leave_type"),
            evidence.primaryKey("as_of_date"),
            ruleCode,
            ruleCode.getSeverity(),
            message,
            diffUnits,
            evidenceJson,
            findingIdGenerator.fromEvidenceJson(ruleCode, evidenceJson),
            ruleCode.getNextAction()
        );
    }

    private String serialize(RuleCode ruleCode, Evidence evidence) {
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            log.warn("Evidence serialization failed for {} (employee {}); finding kept without evidence: {}",
                    ruleCode, evidence.primaryKey("employee_id"), e.getOriginalMessage());
            return null;
        }
    }
}
