package com.fintech.enrichment.client;

import com.fintech.enrichment.dto.AggregatorRemoval;
import com.fintech.enrichment.dto.SearchExtraction;
import com.fintech.enrichment.dto.SearchResult;
import com.fintech.enrichment.dto.WebsiteVerification;
import com.fintech.enrichment.exception.CapabilityException;

import java.util.List;

/**
 * Language model capability, in the three call shapes the resolver needs.
 * Every call is billed. Each method throws {@link CapabilityException} when the
 * model call fails or its answer cannot be parsed.
 */
public interface LanguageModelClient {

    /**
     * Strips payment-aggregator prefixes ("SQ *", "PAYPAL *", ...) from a raw name.
     */
    AggregatorRemoval removeAggregator(String rawName);

    /**
     * Reads search results and proposes a name, website and social candidates,
     * and the business' operational status.
     */
    SearchExtraction extract(List<SearchResult> searchResults, String originalName, String query);

    /**
     * Judges whether page content belongs to a genuinely operational business site.
     */
    WebsiteVerification verifyWebsite(String pageText, String merchantName);

    boolean validateCredentials();
}
