package com.flagship.leave_audit.input;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps raw CSV headers onto canonical column names, once per file.
 */
public final class ColumnAliasResolver {

    private ColumnAliasResolver() {
    }

    /**
     * Resolves header positions for a table.
     *
     * Canonical columns take the first synonym found in the header. Headers that are
     * not a synonym of any canonical column are kept under their normalized name.
     *
     * @param schema The table being loaded
     * @param rawHeaders The header line as read from the file
     * @return Column name to header index
     */
    public static Map<String, Integer> resolve(TableSchema schema, List<String> rawHeaders) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < rawHeaders.size(); i++) {
            positions.putIfAbsent(normalize(rawHeaders.get(i)), i);
        }

        Map<String, Integer> resolved = new HashMap<>();
        Set<String> consumed = new HashSet<>();
        for (Map.Entry<String, List<String>> entry : schema.getColumnAliases().entrySet()) {
            for (String synonym : entry.getValue()) {
                Integer index = positions.get(synonym);
                if (index != null) {
                    resolved.put(entry.getKey(), index);
                    consumed.add(synonym);
                    break;
                }
            }
        }

        for (Map.Entry<String, Integer> header : positions.entrySet()) {
            String name = header.getKey();
            if (!name.isEmpty() && !consumed.contains(name) && !resolved.containsKey(name)) {
                resolved.put(name, header.getValue());
            }
        }
        return resolved;
    }

    static String normalize(String header) {
        String name = header == null ? "" : header;
        // UTF-8 BOM left on the first header by spreadsheet exports
        if (name.startsWith("\uFEFF")) {
            name = name.substring(1);
        }
        return name.strip().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
