package com.fintech.enrichment.model;

/**
 * How much paid lookup work the resolver may do per query.
 */
public enum ProcessingMode {
    /**
     * Web search plus language-model extraction and verification.
     */
    BASIC,

    /**
     * Adds a paid place lookup before web search for every query.
     */
    ENHANCED
}
