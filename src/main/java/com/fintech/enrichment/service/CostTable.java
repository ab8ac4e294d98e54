package com.fintech.enrichment.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Unit cost of each billable call, in dollars.
 */
@Value
@Builder(toBuilder = true)
public class CostTable {

    @Builder.Default
    BigDecimal searchCost = new BigDecimal("0.005");

    @Builder.Default
    BigDecimal placeLookupCost = new BigDecimal("0.017");

    /**
     * Cost of one language-model call when the model has no entry of its own.
     */
    @Builder.Default
    BigDecimal defaultModelCost = new BigDecimal("0.001");

    @Singular
    Map<String, BigDecimal> modelCosts;

    public BigDecimal modelCost(String modelName) {
        if (modelName == null) {
            return defaultModelCost;
        }
        return modelCosts.getOrDefault(modelName, defaultModelCost);
    }

    public static CostTable defaults() {
        return CostTable.builder()
                .modelCost("gemini-1.5-flash", new BigDecimal("0.00035"))
                .modelCost("gemini-1.5-pro", new BigDecimal("0.0035"))
                .build();
    }
}
