package com.fintech.enrichment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fintech.enrichment.model.ProcessingMode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Immutable configuration of one enrichment job.
 * <p>
 * Rows use sheet numbering: row 1 is the header, row 2 the first data row.
 * {@code startRow} and {@code endRow} are inclusive. Being immutable, one instance
 * is shared read-only between the caller and the worker.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobSettings {

    public static final double DEFAULT_BUDGET_PER_ROW = 3.0;

    String inputPath;
    String outputPath;
    ColumnMapping columnMapping;
    int startRow;
    int endRow;
    ProcessingMode mode;
    String modelName;
    double budgetPerRow;
    List<OutputColumn> outputColumns;

    @Builder(toBuilder = true)
    @Jacksonized
    private JobSettings(String inputPath, String outputPath, ColumnMapping columnMapping, int startRow,
                        int endRow, ProcessingMode mode, String modelName, Double budgetPerRow,
                        List<OutputColumn> outputColumns) {
        this.inputPath = inputPath;
        this.outputPath = outputPath;
        this.columnMapping = columnMapping;
        this.startRow = startRow;
        this.endRow = endRow;
        this.mode = mode == null ? ProcessingMode.BASIC : mode;
        this.modelName = modelName;
        this.budgetPerRow = budgetPerRow == null ? DEFAULT_BUDGET_PER_ROW : budgetPerRow;
        this.outputColumns = outputColumns == null || outputColumns.isEmpty()
                ? OutputColumn.defaults()
                : List.copyOf(outputColumns);
    }

    /**
     * Number of rows in the configured window.
     */
    public int configuredRowCount() {
        return Math.max(0, endRow - startRow + 1);
    }
}
