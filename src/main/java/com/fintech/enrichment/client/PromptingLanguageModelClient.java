package com.fintech.enrichment.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.enrichment.dto.AggregatorRemoval;
import com.fintech.enrichment.dto.SearchExtraction;
import com.fintech.enrichment.dto.SearchResult;
import com.fintech.enrichment.dto.WebsiteVerification;
import com.fintech.enrichment.exception.NonRetriableCapabilityException;
import com.fintech.enrichment.service.AggregatorPrefixes;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link LanguageModelClient} that builds the three prompts, sends them to a
 * {@link TextCompletionModel} and parses the JSON answers at the boundary.
 */
@Slf4j
public class PromptingLanguageModelClient implements LanguageModelClient {

    // Page content beyond this is truncated before verification
    static final int MAX_PAGE_CHARS = 8000;

    private final TextCompletionModel model;
    private final ModelResponseParser parser;
    private final ObjectMapper objectMapper;

    public PromptingLanguageModelClient(TextCompletionModel model, ObjectMapper objectMapper) {
        this.model = model;
        this.objectMapper = objectMapper;
        this.parser = new ModelResponseParser(objectMapper);
    }

    @Override
    public AggregatorRemoval removeAggregator(String rawName) {
        String prompt = String.format(
                "Analyze the raw merchant transaction string: \"%s\"\n" +
                "Payment aggregators such as %s often prefix the real merchant name,\n" +
                "usually followed by '*' (e.g. \"SQ *Blue Bottle\" -> \"Blue Bottle\").\n" +
                "Remove such a prefix if present and nothing else.\n" +
                "Answer with JSON only: {\"cleaned_name\": string, \"reason\": string}\n",
                rawName, String.join(", ", AggregatorPrefixes.KNOWN));
        return parser.parseAggregatorRemoval(model.complete(prompt));
    }

    @Override
    public SearchExtraction extract(List<SearchResult> searchResults, String originalName, String query) {
        String prompt = String.format(
                "Merchant: \"%s\"\n" +
                "Search query: \"%s\"\n" +
                "Search results (JSON): %s\n" +
                "\n" +
                "From these results only, propose:\n" +
                "- cleaned_name: the official business name\n" +
                "- website_candidates: URLs that may be the business' own website, most likely first\n" +
                "- social_candidates: URLs of the business' own social media profiles\n" +
                "- business_status: Operational, Temporarily Closed, Permanently Closed, Historical or Uncertain\n" +
                "- summary: one sentence on what the results show\n" +
                "Do not decide whether a candidate is correct.\n" +
                "Answer with JSON only: {\"cleaned_name\": string, \"website_candidates\": [string],\n" +
                "\"social_candidates\": [string], \"business_status\": string, \"summary\": string}\n",
                originalName, query, toJson(searchResults));
        return parser.parseExtraction(model.complete(prompt));
    }

    @Override
    public WebsiteVerification verifyWebsite(String pageText, String merchantName) {
        String content = pageText.length() > MAX_PAGE_CHARS ? pageText.substring(0, MAX_PAGE_CHARS) : pageText;
        String prompt = String.format(
                "Does the following page content belong to an operational website of \"%s\"?\n" +
                "Reject parked domains, for-sale pages, under-construction pages, error pages\n" +
                "and unfilled templates.\n" +
                "Page content:\n" +
                "%s\n" +
                "Answer with JSON only: {\"is_valid\": boolean, \"reasoning\": string}\n",
                merchantName, content);
        return parser.parseVerification(model.complete(prompt));
    }

    @Override
    public boolean validateCredentials() {
        try {
            return !model.complete("Reply with OK").isBlank();
        } catch (RuntimeException e) {
            log.warn("Language model credential check failed: {}", e.getMessage());
            return false;
        }
    }

    private String toJson(List<SearchResult> results) {
        try {
            return objectMapper.writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new NonRetriableCapabilityException("Cannot serialize search results", "language-model", e);
        }
    }
}
