package com.fintech.enrichment.exception;

/**
 * The language model answered with something that does not match the expected
 * schema. Retried once, then treated like any other row failure.
 */
public class MalformedModelResponseException extends RetriableCapabilityException {

    private final String rawResponse;

    public MalformedModelResponseException(String message, String rawResponse) {
        super(message, "language-model");
        this.rawResponse = rawResponse;
    }

    public MalformedModelResponseException(String message, String rawResponse, Throwable cause) {
        super(message, "language-model", cause);
        this.rawResponse = rawResponse;
    }

    public String getRawResponse() {
        return rawResponse;
    }
}
