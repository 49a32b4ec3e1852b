package com.flagship.leave_audit.input;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.flagship.leave_audit.input.exception.InputFileException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a CSV file into an {@link InputTable}, resolving header synonyms once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CsvTableReader {

    private final CsvMapper csvMapper;

    /**
     * @param file CSV file with a header line
     * @param schema The table the file holds
     * @throws InputFileException if the file is missing, unreadable or has no header
     */
    public InputTable read(Path file, TableSchema schema) {
        if (!Files.isRegularFile(file)) {
            throw new InputFileException(schema.getTableName(), "Input file not found: " + file);
        }

        List<String[]> lines = readLines(file, schema);
        if (lines.isEmpty()) {
            throw new InputFileException(schema.getTableName(), "Input file has no header line: " + file);
        }

        List<String> headers = Arrays.asList(lines.get(0));
        Map<String, Integer> positions = ColumnAliasResolver.resolve(schema, headers);

        List<InputTable.Row> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String[] line = lines.get(i);
            Map<String, String> cells = new HashMap<>();
            for (Map.Entry<String, Integer> position : positions.entrySet()) {
                int index = position.getValue();
                cells.put(position.getKey(), index < line.length ? line[index] : null);
            }
            rows.add(new InputTable.Row(i, Collections.unmodifiableMap(cells)));
        }

        Set<String> columns = new LinkedHashSet<>(positions.keySet());
        log.debug("Read {} rows from {} (columns={})", rows.size(), file, columns);
        return new InputTable(schema, Collections.unmodifiableSet(columns), Collections.unmodifiableList(rows));
    }

    private List<String[]> readLines(Path file, TableSchema schema) {
        ObjectReader reader = csvMapper.readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvParser.Feature.SKIP_EMPTY_LINES)
            .with(CsvParser.Feature.TRIM_SPACES);

        try (MappingIterator<String[]> iterator = reader.readValues(file.toFile())) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new InputFileException(schema.getTableName(), "Failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
