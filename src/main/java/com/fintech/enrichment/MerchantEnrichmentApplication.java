package com.fintech.enrichment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Merchant Enrichment Service
 * <p>
 * Turns messy merchant names from a spreadsheet into verified business identities
 * (official name, website or social profile, audit trail) by orchestrating search and
 * language-model calls over a batch that can be paused, stopped and resumed.
 * <p>
 * Key Features:
 * - Resumable single-job execution with periodic checkpoints
 * - Cascading search-and-verify resolution with deterministic accept/reject rules
 * - Resilient capability calls with retry, back-off and circuit breakers
 * - Metrics and structured logging per job
 */
@SpringBootApplication
public class MerchantEnrichmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(MerchantEnrichmentApplication.class, args);
    }
}
