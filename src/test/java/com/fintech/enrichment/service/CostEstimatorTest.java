package com.fintech.enrichment.service;

import com.fintech.enrichment.dto.CostEstimate;
import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.model.ProcessingMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class CostEstimatorTest {

    private final CostTable costTable = CostTable.builder()
            .searchCost(new BigDecimal("0.005"))
            .placeLookupCost(new BigDecimal("0.017"))
            .defaultModelCost(new BigDecimal("0.001"))
            .modelCost("premium", new BigDecimal("0.01"))
            .build();
    private final CostEstimator estimator = new CostEstimator(costTable);

    @Test
    @DisplayName("Should price a basic row as three model calls and one search")
    void shouldEstimateBasicRow() {
        assertThat(estimator.estimateCostPerRow(ProcessingMode.BASIC, null)).isEqualByComparingTo("0.008");
        assertThat(estimator.estimateCostPerRow(ProcessingMode.BASIC, "premium")).isEqualByComparingTo("0.035");
    }

    @Test
    @DisplayName("Should add a place lookup per row in enhanced mode")
    void shouldAddPlaceLookupInEnhancedMode() {
        assertThat(estimator.estimateCostPerRow(ProcessingMode.ENHANCED, null)).isEqualByComparingTo("0.025");
    }

    @Test
    @DisplayName("Should scale with the row count and be zero for no rows")
    void shouldScaleWithRows() {
        assertThat(estimator.estimateCost(100, ProcessingMode.BASIC, null)).isEqualByComparingTo("0.8");
        assertThat(estimator.estimateCost(0, ProcessingMode.BASIC, null)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Should compare the per-row estimate against the budget")
    void shouldCheckBudget() {
        JobSettings settings = JobSettings.builder()
                .startRow(2)
                .endRow(11)
                .modelName("premium")
                .budgetPerRow(0.02)
                .build();

        CostEstimate estimate = estimator.estimate(settings);

        assertThat(estimate.getRowCount()).isEqualTo(10);
        assertThat(estimate.getTotalCost()).isEqualByComparingTo("0.35");
        assertThat(estimate.isWithinBudget()).isFalse();
        assertThat(estimator.isWithinBudget(ProcessingMode.BASIC, null, 0.008)).isTrue();
    }
}
