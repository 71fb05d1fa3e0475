package com.labelrun.ingestion.pipeline.table;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a header-first CSV file into a {@link SourceTable}. Blank lines are skipped; a UTF-8 BOM on the first
 * header cell is dropped.
 */
@Component
public class CsvTableReader {

    private static final char BOM = '\uFEFF';

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public SourceTable read(Path file) {
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(file.toFile())) {
            while (it.hasNextValue()) {
                lines.add(it.nextValue());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        if (lines.isEmpty()) {
            return new SourceTable(List.of(), List.of());
        }
        String[] header = lines.get(0);
        if (header.length > 0 && header[0] != null && !header[0].isEmpty() && header[0].charAt(0) == BOM) {
            header[0] = header[0].substring(1);
        }
        return new SourceTable(Arrays.asList(header), lines.subList(1, lines.size()));
    }

    /** Data rows of a CSV file, header excluded. */
    public int countRows(Path file) {
        return read(file).rowCount();
    }
}
