package com.fintech.enrichment.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Business listing returned by a paid place lookup.
 */
@Value
@Builder
public class PlaceMatch {
    String name;
    String website;
    String formattedAddress;

    public boolean hasWebsite() {
        return website != null && !website.isBlank();
    }
}
