package com.labelrun.ingestion.pipeline.table;

import lombok.Getter;

/**
 * Input row holds more cells than the header names. Fatal for that file; nothing is written for it.
 */
@Getter
public class MalformedTableException extends RuntimeException {

    private final int row;
    private final int cells;
    private final int headerWidth;

    public MalformedTableException(int row, int cells, int headerWidth) {
        super("Row " + row + " has " + cells + " cells but the header has " + headerWidth);
        this.row = row;
        this.cells = cells;
        this.headerWidth = headerWidth;
    }
}
