package com.fintech.enrichment.client;

import com.fintech.enrichment.dto.SearchResult;
import com.fintech.enrichment.exception.CapabilityException;

import java.util.List;

/**
 * Web search capability.
 * <p>
 * Implementations are idempotent and side-effect free apart from quota accounting.
 */
public interface SearchClient {

    /**
     * Runs one query.
     *
     * @param query free-text query
     * @return ordered hits, empty when nothing matched
     * @throws CapabilityException when the search service fails
     */
    List<SearchResult> search(String query);

    /**
     * Checks that the configured credentials are accepted. Used by preflight.
     */
    boolean validateCredentials();
}
