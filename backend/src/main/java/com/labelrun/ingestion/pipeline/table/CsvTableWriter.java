package com.labelrun.ingestion.pipeline.table;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link SourceTable} as CSV, header first, creating parent directories.
 */
@Component
public class CsvTableWriter {

    private final CsvMapper csvMapper = new CsvMapper();

    public void write(SourceTable table, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (SequenceWriter writer = csvMapper.writerFor(String[].class).writeValues(file.toFile())) {
                writer.write(table.header().toArray(new String[0]));
                for (String[] row : table.rows()) {
                    writer.write(row);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
