package com.flagship.leave_audit.finding;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured justification for a finding.
 *
 * {@code primaryKeys} locate the offending record and feed the finding identity;
 * {@code values} are the observations that triggered the rule and
 * {@code thresholds} the parameters they were compared against.
 */
@Value
@Builder
@JsonPropertyOrder({"sources", "primary_keys", "values", "thresholds", "explanation"})
public class Evidence {

    @Singular
    List<String> sources;

    @JsonProperty("primary_keys")
    Map<String, String> primaryKeys;

    @Singular
    Map<String, Object> values;

    @Singular
    Map<String, Object> thresholds;

    String explanation;

    public String primaryKey(String name) {
        return primaryKeys == null ? null : primaryKeys.get(name);
    }

    /**
     * The natural key of a leave record: employee, leave type and the date the finding
     * relates to. Further keys may be appended to the returned map.
     */
    public static Map<String, String> keys(String employeeId, String leaveType, LocalDate date) {
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("employee_id", employeeId);
        keys.put("leave_type", leaveType);
        keys.put("as_of_date", date == null ? null : date.toString());
        return keys;
    }
}
