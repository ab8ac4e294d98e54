package com.fintech.enrichment.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A whole spreadsheet held in memory: one header row followed by data rows.
 * <p>
 * Rows are addressed with sheet numbering: row 1 is the header and row 2 the first
 * data row. Rows may be ragged; reads past the end of a row return {@code ""}.
 */
public class Table {

    public static final int FIRST_DATA_ROW = 2;

    private final List<String> headers;
    private final List<List<String>> rows;

    public Table(List<String> headers, List<List<String>> rows) {
        this.headers = new ArrayList<>(headers);
        this.rows = new ArrayList<>();
        for (List<String> row : rows) {
            this.rows.add(new ArrayList<>(row));
        }
    }

    public List<String> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    public List<List<String>> getRows() {
        List<List<String>> view = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            view.add(Collections.unmodifiableList(row));
        }
        return Collections.unmodifiableList(view);
    }

    public int getDataRowCount() {
        return rows.size();
    }

    /**
     * Sheet number of the last data row, or 1 when the table has no data rows.
     */
    public int getLastRowNumber() {
        return rows.size() + 1;
    }

    public boolean hasRow(int rowNumber) {
        return rowNumber >= FIRST_DATA_ROW && rowNumber <= getLastRowNumber();
    }

    public int columnIndex(String header) {
        return header == null ? -1 : headers.indexOf(header);
    }

    /**
     * Returns the index of the named column, appending it (with empty cells) when absent.
     */
    public int ensureColumn(String header) {
        int index = columnIndex(header);
        if (index >= 0) {
            return index;
        }
        headers.add(header);
        return headers.size() - 1;
    }

    public String getCell(int rowNumber, int column) {
        List<String> row = rowAt(rowNumber);
        if (column < 0 || column >= row.size()) {
            return "";
        }
        String value = row.get(column);
        return value == null ? "" : value;
    }

    public void setCell(int rowNumber, int column, String value) {
        List<String> row = rowAt(rowNumber);
        while (row.size() <= column) {
            row.add("");
        }
        row.set(column, value == null ? "" : value);
    }

    private List<String> rowAt(int rowNumber) {
        if (!hasRow(rowNumber)) {
            throw new IndexOutOfBoundsException("Row " + rowNumber + " is outside data rows "
                    + FIRST_DATA_ROW + ".." + getLastRowNumber());
        }
        return rows.get(rowNumber - FIRST_DATA_ROW);
    }
}
