package com.fintech.enrichment.dto;

import lombok.Builder;
import lombok.Value;

/**
 * One organic web search hit.
 */
@Value
@Builder
public class SearchResult {
    String title;
    String link;
    String snippet;
}
