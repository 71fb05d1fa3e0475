package com.labelrun.ingestion.pipeline.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Header plus data rows of one tabular source. A row's position is its recordId; rows are padded to the header
 * width on read so every cell is addressable. Rows wider than the header are rejected.
 */
public final class SourceTable {

    private final List<String> header;
    private final List<String[]> rows;

    /**
     * @throws MalformedTableException when a row has more cells than the header
     */
    public SourceTable(List<String> header, List<String[]> rows) {
        this.header = new ArrayList<>(header);
        this.rows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (row.length > this.header.size()) {
                throw new MalformedTableException(i, row.length, this.header.size());
            }
            this.rows.add(pad(row, this.header.size()));
        }
    }

    public List<String> header() {
        return List.copyOf(header);
    }

    public int rowCount() {
        return rows.size();
    }

    /** Column index by exact header name, or -1. */
    public int columnIndex(String name) {
        return header.indexOf(name);
    }

    /**
     * Returns the index of the named column, appending it with {@code defaultValue} in every row when absent.
     */
    public int ensureColumn(String name, String defaultValue) {
        int idx = header.indexOf(name);
        if (idx >= 0) {
            return idx;
        }
        header.add(name);
        for (int i = 0; i < rows.size(); i++) {
            String[] padded = pad(rows.get(i), header.size());
            padded[header.size() - 1] = defaultValue;
            rows.set(i, padded);
        }
        return header.size() - 1;
    }

    /** Cell value, or empty string when the column is absent. */
    public String cell(int row, int column) {
        if (column < 0) {
            return "";
        }
        String value = rows.get(row)[column];
        return value != null ? value : "";
    }

    public void setCell(int row, int column, String value) {
        rows.get(row)[column] = value;
    }

    List<String[]> rows() {
        return rows;
    }

    private static String[] pad(String[] row, int width) {
        if (row.length >= width) {
            return row;
        }
        String[] padded = Arrays.copyOf(row, width);
        for (int i = row.length; i < width; i++) {
            padded[i] = "";
        }
        return padded;
    }
}
