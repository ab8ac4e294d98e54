package com.fintech.enrichment.client;

import com.fintech.enrichment.model.BusinessStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A merchant known to {@link MockCapabilityClient}'s simulated web.
 */
@Value
@Builder
public class MockListing {

    /**
     * Name as it appears in queries, matched case-insensitively.
     */
    String name;
    String officialName;
    String website;
    @Singular
    List<String> socials;
    @Builder.Default
    BusinessStatus status = BusinessStatus.OPERATIONAL;
    boolean parked;
}
