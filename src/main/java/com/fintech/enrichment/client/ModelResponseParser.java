package com.fintech.enrichment.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.enrichment.dto.AggregatorRemoval;
import com.fintech.enrichment.dto.SearchExtraction;
import com.fintech.enrichment.dto.WebsiteVerification;
import com.fintech.enrichment.exception.MalformedModelResponseException;
import com.fintech.enrichment.model.BusinessStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses language-model answers against a strict JSON schema per call shape.
 * <p>
 * Markdown code fences around the JSON are tolerated. Anything else that does not
 * match the schema (not JSON, missing keys, wrong types) raises
 * {@link MalformedModelResponseException}.
 */
public class ModelResponseParser {

    private final ObjectMapper objectMapper;

    public ModelResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Schema: {@code {"cleaned_name": string, "reason": string?}}
     */
    public AggregatorRemoval parseAggregatorRemoval(String raw) {
        JsonNode root = readObject(raw);
        return AggregatorRemoval.builder()
                .cleanedName(requireText(root, "cleaned_name", raw))
                .reason(optionalText(root, "reason"))
                .build();
    }

    /**
     * Schema: {@code {"cleaned_name": string, "website_candidates": [string],
     * "social_candidates": [string], "business_status": string, "summary": string?}}
     */
    public SearchExtraction parseExtraction(String raw) {
        JsonNode root = readObject(raw);
        return SearchExtraction.builder()
                .cleanedName(requireText(root, "cleaned_name", raw))
                .websiteCandidates(requireStringArray(root, "website_candidates", raw))
                .socialCandidates(requireStringArray(root, "social_candidates", raw))
                .businessStatus(BusinessStatus.fromText(requireText(root, "business_status", raw)))
                .summary(optionalText(root, "summary"))
                .build();
    }

    /**
     * Schema: {@code {"is_valid": boolean, "reasoning": string?}}
     */
    public WebsiteVerification parseVerification(String raw) {
        JsonNode root = readObject(raw);
        JsonNode valid = root.get("is_valid");
        if (valid == null || !valid.isBoolean()) {
            throw new MalformedModelResponseException("Expected boolean 'is_valid'", raw);
        }
        return WebsiteVerification.builder()
                .valid(valid.booleanValue())
                .reasoning(optionalText(root, "reasoning"))
                .build();
    }

    private JsonNode readObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedModelResponseException("Empty model response", raw);
        }
        String json = stripCodeFence(raw.trim());
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new MalformedModelResponseException("Model response is not a JSON object", raw);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedModelResponseException("Model response is not valid JSON", raw, e);
        }
    }

    static String stripCodeFence(String text) {
        String result = text;
        if (result.startsWith("```")) {
            int firstNewline = result.indexOf('\n');
            result = firstNewline < 0 ? result.substring(3) : result.substring(firstNewline + 1);
        }
        if (result.endsWith("```")) {
            result = result.substring(0, result.length() - 3);
        }
        return result.trim();
    }

    private static String requireText(JsonNode root, String field, String raw) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new MalformedModelResponseException("Expected string '" + field + "'", raw);
        }
        return node.asText();
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? "" : node.asText();
    }

    private static List<String> requireStringArray(JsonNode root, String field, String raw) {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new MalformedModelResponseException("Expected array '" + field + "'", raw);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new MalformedModelResponseException("Expected only strings in '" + field + "'", raw);
            }
            if (!element.asText().isBlank()) {
                values.add(element.asText().trim());
            }
        }
        return values;
    }
}
