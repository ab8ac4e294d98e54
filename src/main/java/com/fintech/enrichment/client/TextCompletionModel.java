package com.fintech.enrichment.client;

/**
 * Raw text-in, text-out access to a hosted language model.
 * Vendor SDK adapters implement this; prompting and parsing live in
 * {@link PromptingLanguageModelClient}.
 */
@FunctionalInterface
public interface TextCompletionModel {

    String complete(String prompt);
}
