package com.fintech.enrichment.client;

/**
 * Fetches the text content of a web page.
 * <p>
 * Timeouts and HTTP errors must be raised as
 * {@link com.fintech.enrichment.exception.RetriableCapabilityException}.
 * Non-text content yields an empty string.
 */
public interface WebsiteFetchClient {

    String fetch(String url);

    boolean validateCredentials();
}
