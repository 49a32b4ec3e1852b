package com.flagship.leave_audit.input;

import lombok.Value;

/**
 * Count of date cells coerced to absent under the lenient policy, per table column.
 */
@Value
public class DateParseWarning {
    String table;
    String column;
    int rowCount;

    @Override
    public String toString() {
        return String.format("Unparseable %s.%s rows: %d", table, column, rowCount);
    }
}
