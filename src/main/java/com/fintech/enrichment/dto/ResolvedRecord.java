package com.fintech.enrichment.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The verified identity produced for one {@link RawRecord}.
 * <p>
 * Created once by the resolver (or by the orchestrator for a failed row) and never
 * mutated afterwards. The resolver guarantees that a record with a website carries no
 * socials, and that a record with remarks {@value #REMARK_REJECTED} carries no name,
 * website or socials.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResolvedRecord {

    public static final String REMARK_REJECTED = "NA";
    public static final String REMARK_WEBSITE_UNAVAILABLE = "website unavailable";
    public static final String REMARK_FATAL_ERROR = "FATAL_ERROR";

    @JsonProperty("cleaned_name")
    String cleanedName;
    @JsonProperty("website")
    String website;
    @JsonProperty("socials")
    List<String> socials;
    @JsonProperty("evidence")
    String evidence;
    @JsonProperty("evidence_links")
    List<String> evidenceLinks;
    @JsonProperty("accumulated_cost")
    double accumulatedCost;
    @JsonProperty("remarks")
    String remarks;
    @JsonProperty("logo_filename")
    String logoFilename;

    @Builder(toBuilder = true)
    @JsonCreator
    private ResolvedRecord(@JsonProperty("cleaned_name") String cleanedName,
                           @JsonProperty("website") String website,
                           @JsonProperty("socials") List<String> socials,
                           @JsonProperty("evidence") String evidence,
                           @JsonProperty("evidence_links") List<String> evidenceLinks,
                           @JsonProperty("accumulated_cost") double accumulatedCost,
                           @JsonProperty("remarks") String remarks,
                           @JsonProperty("logo_filename") String logoFilename) {
        this.cleanedName = cleanedName == null ? "" : cleanedName;
        this.website = website == null ? "" : website;
        this.socials = socials == null ? List.of() : List.copyOf(socials);
        this.evidence = evidence == null ? "" : evidence;
        this.evidenceLinks = evidenceLinks == null ? List.of() : List.copyOf(evidenceLinks);
        this.accumulatedCost = accumulatedCost;
        this.remarks = remarks == null ? "" : remarks;
        this.logoFilename = logoFilename == null ? "" : logoFilename;
    }

    @JsonIgnore
    public boolean isRejected() {
        return REMARK_REJECTED.equals(remarks);
    }

    @JsonIgnore
    public boolean isFatalError() {
        return remarks.startsWith(REMARK_FATAL_ERROR);
    }

    /**
     * Record standing in for a row whose resolution threw.
     */
    public static ResolvedRecord fatalError(String rawName, Throwable error) {
        return fatalError(rawName, error, 0.0);
    }

    /**
     * Record standing in for a row whose resolution threw after spending {@code spentCost}.
     */
    public static ResolvedRecord fatalError(String rawName, Throwable error, double spentCost) {
        String detail = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return ResolvedRecord.builder()
                .remarks(REMARK_FATAL_ERROR + ": " + detail)
                .evidence("Resolution of '" + rawName + "' aborted by " + error.getClass().getSimpleName()
                        + ": " + detail + ". The row was skipped and the batch continued.")
                .accumulatedCost(spentCost)
                .build();
    }
}
