package com.fintech.enrichment.service;

import com.fintech.enrichment.dto.CostEstimate;
import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.model.ProcessingMode;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Estimates what a job will cost before it runs.
 * <p>
 * The per-row figure assumes the cheapest accepted row: one pre-clean call, one search,
 * one extraction and one verification, plus a place lookup in ENHANCED mode. Rows that
 * cascade through more queries cost more.
 */
@RequiredArgsConstructor
public class CostEstimator {

    private static final int MODEL_CALLS_PER_ROW = 3;

    private final CostTable costTable;

    public BigDecimal estimateCostPerRow(ProcessingMode mode, String modelName) {
        BigDecimal perRow = costTable.modelCost(modelName).multiply(BigDecimal.valueOf(MODEL_CALLS_PER_ROW))
                .add(costTable.getSearchCost());
        if (mode == ProcessingMode.ENHANCED) {
            perRow = perRow.add(costTable.getPlaceLookupCost());
        }
        return perRow;
    }

    public BigDecimal estimateCost(int rowCount, ProcessingMode mode, String modelName) {
        if (rowCount <= 0) {
            return BigDecimal.ZERO;
        }
        return estimateCostPerRow(mode, modelName).multiply(BigDecimal.valueOf(rowCount));
    }

    public boolean isWithinBudget(ProcessingMode mode, String modelName, double budgetPerRow) {
        return estimateCostPerRow(mode, modelName).compareTo(BigDecimal.valueOf(budgetPerRow)) <= 0;
    }

    public CostEstimate estimate(JobSettings settings) {
        int rows = settings.configuredRowCount();
        return CostEstimate.builder()
                .rowCount(rows)
                .mode(settings.getMode())
                .modelName(settings.getModelName())
                .costPerRow(estimateCostPerRow(settings.getMode(), settings.getModelName()))
                .totalCost(estimateCost(rows, settings.getMode(), settings.getModelName()))
                .budgetPerRow(settings.getBudgetPerRow())
                .withinBudget(isWithinBudget(settings.getMode(), settings.getModelName(),
                        settings.getBudgetPerRow()))
                .build();
    }
}
