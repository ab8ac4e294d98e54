package com.fintech.enrichment.dto;

import com.fintech.enrichment.model.ProcessingMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CostEstimate {
    int rowCount;
    ProcessingMode mode;
    String modelName;
    BigDecimal costPerRow;
    BigDecimal totalCost;
    double budgetPerRow;
    boolean withinBudget;
}
