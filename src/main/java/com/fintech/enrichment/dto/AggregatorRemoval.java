package com.fintech.enrichment.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Answer of the pre-clean call: the merchant name with any payment-aggregator
 * prefix removed, and why.
 */
@Value
@Builder
public class AggregatorRemoval {
    String cleanedName;
    String reason;
}
