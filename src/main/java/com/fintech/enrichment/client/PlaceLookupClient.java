package com.fintech.enrichment.client;

import com.fintech.enrichment.dto.PlaceMatch;

import java.util.Optional;

/**
 * Paid business-listing lookup, used in ENHANCED mode only.
 */
public interface PlaceLookupClient {

    Optional<PlaceMatch> findPlace(String query);

    boolean validateCredentials();
}
