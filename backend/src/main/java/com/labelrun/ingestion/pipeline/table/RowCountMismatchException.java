package com.labelrun.ingestion.pipeline.table;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Output file does not hold the same number of data rows as its input. Fatal for that file.
 */
@Getter
public class RowCountMismatchException extends RuntimeException {

    private final Path output;
    private final int expectedRows;
    private final int actualRows;

    public RowCountMismatchException(Path output, int expectedRows, int actualRows) {
        super("Row count mismatch for " + output + ": input " + expectedRows + ", output " + actualRows);
        this.output = output;
        this.expectedRows = expectedRows;
        this.actualRows = actualRows;
    }
}
