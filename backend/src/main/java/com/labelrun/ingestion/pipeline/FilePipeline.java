package com.labelrun.ingestion.pipeline;

import com.labelrun.domain.Label;
import com.labelrun.domain.SourceRecord;
import com.labelrun.ingestion.config.CampaignProperties;
import com.labelrun.ingestion.config.ClassifierProperties;
import com.labelrun.ingestion.pipeline.classification.BatchOrchestrator;
import com.labelrun.ingestion.pipeline.classification.RunStats;
import com.labelrun.ingestion.pipeline.classification.SourceLabeling;
import com.labelrun.ingestion.pipeline.table.CsvTableReader;
import com.labelrun.ingestion.pipeline.table.CsvTableWriter;
import com.labelrun.ingestion.pipeline.table.RowCountMismatchException;
import com.labelrun.ingestion.pipeline.table.SourceTable;
import com.labelrun.ingestion.store.ProgressStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One file end to end: read, label every row, write the annotated copy, then re-read it and check the row count.
 * Rows completed by an earlier run take their label from the progress store, so a resumed file is written with
 * the same labels as an uninterrupted one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FilePipeline {

    private final CsvTableReader tableReader;
    private final CsvTableWriter tableWriter;
    private final BatchOrchestrator batchOrchestrator;
    private final ProgressStore progressStore;
    private final CampaignProperties campaignProperties;
    private final ClassifierProperties classifierProperties;

    /**
     * @throws RowCountMismatchException when the written file does not hold every input row
     */
    public FileResult process(Path input, Path output, String sourceId, RunStats stats) {
        log.info("Processing file: {}", sourceId);
        SourceTable table = tableReader.read(input);
        int totalRows = table.rowCount();
        Label fallback = classifierProperties.getFallbackLabel();
        int labelColumn = table.ensureColumn(campaignProperties.getLabelColumn(), fallback.wireName());

        List<SourceRecord> records = toRecords(sourceId, table);
        SourceLabeling labeling = batchOrchestrator.labelSource(sourceId, records, stats);

        Map<Long, Label> previous = labeling.skipped().isEmpty() ? Map.of() : progressStore.completedLabels(sourceId);
        for (int row = 0; row < totalRows; row++) {
            long recordId = row;
            Label label = labeling.labels().get(recordId);
            if (label == null) {
                label = previous.get(recordId);
            }
            if (label == null) {
                log.warn("No label for {}#{}; writing fallback {}", sourceId, recordId, fallback.wireName());
                label = fallback;
            }
            table.setCell(row, labelColumn, label.wireName());
        }

        tableWriter.write(table, output);
        int written = tableReader.countRows(output);
        if (written != totalRows) {
            log.error("Row count mismatch! Input: {}, Output: {} ({})", totalRows, written, output);
            throw new RowCountMismatchException(output, totalRows, written);
        }
        log.info("Completed file: {} ({} rows, {} labelled this run, {} already complete, {} failed)",
                sourceId, totalRows, labeling.labels().size(), labeling.skipped().size(), labeling.failed().size());
        return new FileResult(sourceId, totalRows, labeling.labels().size(), labeling.skipped().size(), labeling.failed().size());
    }

    private List<SourceRecord> toRecords(String sourceId, SourceTable table) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        campaignProperties.getPromptColumns().forEach((field, header) -> {
            int idx = table.columnIndex(header);
            if (idx < 0) {
                log.warn("Column '{}' missing in {}; prompt field {} will be empty", header, sourceId, field);
            }
            columns.put(field, idx);
        });
        List<SourceRecord> records = new ArrayList<>(table.rowCount());
        for (int row = 0; row < table.rowCount(); row++) {
            Map<String, String> fields = new LinkedHashMap<>();
            for (Map.Entry<String, Integer> c : columns.entrySet()) {
                fields.put(c.getKey(), table.cell(row, c.getValue()));
            }
            records.add(new SourceRecord(sourceId, row, fields));
        }
        return records;
    }
}
