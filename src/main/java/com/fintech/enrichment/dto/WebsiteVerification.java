package com.fintech.enrichment.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Verdict on whether fetched page content is a genuinely operational business site
 * (as opposed to parked, for sale, under construction, an error page or a template).
 */
@Value
@Builder
public class WebsiteVerification {
    boolean valid;
    String reasoning;
}
