package com.fintech.enrichment.dto;

import com.fintech.enrichment.model.BusinessStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the extraction call proposes after reading one page of search results.
 * <p>
 * These are proposals only. Accepting or rejecting a candidate is decided by the
 * resolver's rules, never by the model.
 */
@Value
public class SearchExtraction {

    String cleanedName;
    List<String> websiteCandidates;
    List<String> socialCandidates;
    BusinessStatus businessStatus;
    String summary;

    @Builder
    private SearchExtraction(String cleanedName, List<String> websiteCandidates, List<String> socialCandidates,
                             BusinessStatus businessStatus, String summary) {
        this.cleanedName = cleanedName == null ? "" : cleanedName.trim();
        this.websiteCandidates = websiteCandidates == null ? List.of() : List.copyOf(websiteCandidates);
        this.socialCandidates = socialCandidates == null ? List.of() : List.copyOf(socialCandidates);
        this.businessStatus = businessStatus == null ? BusinessStatus.UNCERTAIN : businessStatus;
        this.summary = summary == null ? "" : summary;
    }
}
