package com.flagship.leave_audit.finding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the stable identity of a finding from its rule code and the primary keys in
 * its evidence.
 *
 * Canonical form: {@code RULE_CODE|key1=value1|key2=value2}, keys sorted by name, null
 * values written as the empty string. The id is the first 12 hex characters of the
 * SHA-1 of that string, so identical inputs always give identical ids across runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FindingIdGenerator {

    static final int ID_LENGTH = 12;

    private final ObjectMapper objectMapper;

    /**
     * Computes the id from serialized evidence.
     *
     * Evidence that is missing or cannot be parsed contributes no primary keys; the id
     * then depends on the rule code alone.
     */
    public String fromEvidenceJson(RuleCode ruleCode, String evidenceJson) {
        return compute(ruleCode.name(), readPrimaryKeys(ruleCode, evidenceJson));
    }

    public static String compute(String ruleCode, Map<String, String> primaryKeys) {
        return sha1Hex(canonicalString(ruleCode, primaryKeys)).substring(0, ID_LENGTH);
    }

    static String canonicalString(String ruleCode, Map<String, String> primaryKeys) {
        StringBuilder canonical = new StringBuilder(ruleCode);
        for (Map.Entry<String, String> key : new TreeMap<>(primaryKeys).entrySet()) {
            canonical.append('|')
                .append(key.getKey())
                .append('=')
                .append(key.getValue() == null ? "" : key.getValue());
        }
        return canonical.toString();
    }

    private Map<String, String> readPrimaryKeys(RuleCode ruleCode, String evidenceJson) {
        Map<String, String> keys = new TreeMap<>();
        if (evidenceJson == null || evidenceJson.isBlank()) {
            return keys;
        }
        try {
            JsonNode primaryKeys = objectMapper.readTree(evidenceJson).path("primary_keys");
            Iterator<Map.Entry<String, JsonNode>> fields = primaryKeys.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                keys.put(field.getKey(), value.isNull() ? null : value.asText());
            }
        } catch (JsonProcessingException e) {
            log.warn("Could not parse evidence for {}; identity falls back to rule code only: {}",
                    ruleCode, e.getOriginalMessage());
            keys.clear();
        }
        return keys;
    }

    private static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
