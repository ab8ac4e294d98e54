package com.fintech.enrichment.service;

import com.fintech.enrichment.client.LanguageModelClient;
import com.fintech.enrichment.client.PlaceLookupClient;
import com.fintech.enrichment.client.SearchClient;
import com.fintech.enrichment.client.WebsiteFetchClient;
import com.fintech.enrichment.dto.AggregatorRemoval;
import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.dto.PlaceMatch;
import com.fintech.enrichment.dto.RawRecord;
import com.fintech.enrichment.dto.ResolvedRecord;
import com.fintech.enrichment.dto.SearchExtraction;
import com.fintech.enrichment.dto.SearchResult;
import com.fintech.enrichment.dto.WebsiteVerification;
import com.fintech.enrichment.exception.CapabilityException;
import com.fintech.enrichment.exception.ResolutionAbortedException;
import com.fintech.enrichment.model.BusinessStatus;
import com.fintech.enrichment.model.ProcessingMode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns one raw merchant record into one verified identity.
 * <p>
 * Pipeline:
 * 1. Pre-clean: one language-model call strips payment-aggregator prefixes
 * 2. Cascade: up to six queries, most specific first. Each query searches, asks the model
 *    to extract candidates, then fetches and verifies website candidates in order
 * 3. Finalize: the accept/reject decision is made here by fixed rules, never by the model
 * <p>
 * The cascade halts on the first verified website, on an observed closure, or when the
 * per-row budget is spent. Every billable call adds its unit cost, whatever the outcome.
 */
@Slf4j
public class IdentityResolver {

    static final int MAX_RESULT_LINKS = 3;

    private static final String SEARCH = "search";
    private static final String LANGUAGE_MODEL = "language-model";
    private static final String WEBSITE_FETCH = "website-fetch";
    private static final String PLACE_LOOKUP = "place-lookup";

    private final SearchClient searchClient;
    private final LanguageModelClient languageModelClient;
    private final WebsiteFetchClient websiteFetchClient;
    private final PlaceLookupClient placeLookupClient;
    private final ResilienceExecutor resilience;
    private final CostTable costTable;
    private final SocialCandidateRanker socialRanker;

    /**
     * @param placeLookupClient may be null, in which case ENHANCED mode behaves like BASIC
     */
    public IdentityResolver(SearchClient searchClient,
                            LanguageModelClient languageModelClient,
                            WebsiteFetchClient websiteFetchClient,
                            PlaceLookupClient placeLookupClient,
                            ResilienceExecutor resilience,
                            CostTable costTable,
                            SocialCandidateRanker socialRanker) {
        this.searchClient = searchClient;
        this.languageModelClient = languageModelClient;
        this.websiteFetchClient = websiteFetchClient;
        this.placeLookupClient = placeLookupClient;
        this.resilience = resilience;
        this.costTable = costTable;
        this.socialRanker = socialRanker;
    }

    /**
     * Resolves one record.
     *
     * @throws ResolutionAbortedException when an error ends the row early,
     *                                    carrying the cost accumulated up to that point
     */
    public ResolvedRecord resolve(RawRecord record, JobSettings settings) {
        Resolution resolution = new Resolution(settings);
        try {
            return resolve(record, resolution);
        } catch (RuntimeException e) {
            throw new ResolutionAbortedException(e, resolution.cost.doubleValue());
        }
    }

    private ResolvedRecord resolve(RawRecord record, Resolution resolution) {
        JobSettings settings = resolution.settings;
        String name = preClean(record.getMerchantNameRaw(), resolution);
        List<String> queries = SearchQueryBuilder.build(name, record);
        BigDecimal budget = BigDecimal.valueOf(settings.getBudgetPerRow());

        int attempted = 0;
        for (String query : queries) {
            if (resolution.cost.compareTo(budget) >= 0) {
                resolution.note("Stopped after " + attempted + " queries: accumulated cost "
                        + resolution.cost.toPlainString() + " reached the per-row budget of "
                        + budget.toPlainString() + ".");
                break;
            }
            attempted++;
            if (tryQuery(query, attempted, name, resolution)) {
                break;
            }
        }
        resolution.queriesAttempted = attempted;

        ResolvedRecord resolved = finalizeRecord(name, resolution);
        log.debug("Resolved '{}' after {} queries: website='{}', remarks='{}', cost={}",
                record.getMerchantNameRaw(), attempted, resolved.getWebsite(), resolved.getRemarks(),
                resolved.getAccumulatedCost());
        return resolved;
    }

    private String preClean(String rawName, Resolution resolution) {
        resolution.addModelCost();
        AggregatorRemoval removal = resilience.call(LANGUAGE_MODEL,
                () -> languageModelClient.removeAggregator(rawName));

        String cleaned = removal.getCleanedName() == null || removal.getCleanedName().isBlank()
                ? rawName.trim()
                : removal.getCleanedName().trim();
        resolution.note("Pre-clean: '" + rawName + "' -> '" + cleaned + "'"
                + (removal.getReason() == null || removal.getReason().isBlank() ? "." : " (" + removal.getReason() + ")."));
        return cleaned;
    }

    /**
     * Runs one query of the cascade.
     *
     * @return true when the cascade must halt (verified website or closure)
     */
    private boolean tryQuery(String query, int index, String name, Resolution resolution) {
        if (resolution.settings.getMode() == ProcessingMode.ENHANCED && placeLookupClient != null
                && tryPlaceLookup(query, index, name, resolution)) {
            return true;
        }

        resolution.cost = resolution.cost.add(costTable.getSearchCost());
        List<SearchResult> results = resilience.call(SEARCH, () -> searchClient.search(query));
        if (results == null || results.isEmpty()) {
            resolution.note("Query " + index + " '" + query + "': no search results.");
            return false;
        }

        resolution.addModelCost();
        SearchExtraction extraction = resilience.call(LANGUAGE_MODEL,
                () -> languageModelClient.extract(results, name, query));
        resolution.socials.addAll(extraction.getSocialCandidates());
        if (resolution.proposedName == null && !extraction.getCleanedName().isBlank()) {
            resolution.proposedName = extraction.getCleanedName().trim();
        }
        resolution.note("Query " + index + " '" + query + "': " + results.size() + " results, "
                + extraction.getWebsiteCandidates().size() + " website candidates, "
                + extraction.getSocialCandidates().size() + " social candidates, status "
                + extraction.getBusinessStatus() + ".");

        if (extraction.getBusinessStatus().isClosed()) {
            resolution.closedStatus = extraction.getBusinessStatus();
            resolution.note("Business reported as " + extraction.getBusinessStatus()
                    + " for query '" + query + "'; no further queries issued.");
            return true;
        }

        String merchantName = extraction.getCleanedName().isBlank() ? name : extraction.getCleanedName().trim();
        for (String candidate : extraction.getWebsiteCandidates()) {
            if (verifyCandidate(candidate, merchantName, resolution)) {
                resolution.accept(candidate, merchantName, resultLinks(candidate, results));
                resolution.note("Accepted website " + candidate + " from query '" + query + "'.");
                return true;
            }
        }
        return false;
    }

    private boolean tryPlaceLookup(String query, int index, String name, Resolution resolution) {
        resolution.cost = resolution.cost.add(costTable.getPlaceLookupCost());
        Optional<PlaceMatch> place = resilience.call(PLACE_LOOKUP, () -> placeLookupClient.findPlace(query));
        if (place.isEmpty() || !place.get().hasWebsite()) {
            resolution.note("Place lookup " + index + " '" + query + "': no listing with a website.");
            return false;
        }
        PlaceMatch match = place.get();
        String placeName = match.getName() == null || match.getName().isBlank() ? name : match.getName().trim();
        if (verifyCandidate(match.getWebsite(), placeName, resolution)) {
            resolution.accept(match.getWebsite(), placeName, List.of(match.getWebsite()));
            resolution.note("Accepted place listing '" + placeName + "' with website " + match.getWebsite()
                    + " from query '" + query + "'.");
            return true;
        }
        return false;
    }

    /**
     * Fetches a website candidate and asks the model whether it is a genuine operating site.
     * A fetch failure rejects only this candidate.
     */
    private boolean verifyCandidate(String url, String merchantName, Resolution resolution) {
        String page;
        try {
            page = resilience.retry(WEBSITE_FETCH, () -> websiteFetchClient.fetch(url));
        } catch (CapabilityException e) {
            log.debug("Fetch of candidate {} failed: {}", url, e.getMessage());
            resolution.note("Website candidate " + url + " rejected: fetch failed (" + e.getMessage() + ").");
            return false;
        }
        if (page == null || page.isBlank()) {
            resolution.note("Website candidate " + url + " rejected: empty page.");
            return false;
        }

        String pageText = page;
        resolution.addModelCost();
        WebsiteVerification verification = resilience.call(LANGUAGE_MODEL,
                () -> languageModelClient.verifyWebsite(pageText, merchantName));
        resolution.note("Website candidate " + url + (verification.isValid() ? " verified: " : " rejected: ")
                + verification.getReasoning());
        return verification.isValid();
    }

    private ResolvedRecord finalizeRecord(String name, Resolution resolution) {
        if (resolution.closedStatus != null) {
            resolution.note("Rejected due to business status " + resolution.closedStatus + ".");
            return resolution.rejected();
        }

        if (resolution.website != null) {
            return ResolvedRecord.builder()
                    .cleanedName(resolution.acceptedName)
                    .website(resolution.website)
                    .socials(List.of())
                    .evidence(resolution.evidence())
                    .evidenceLinks(resolution.evidenceLinks)
                    .accumulatedCost(resolution.cost.doubleValue())
                    .remarks("")
                    .logoFilename(LogoFilenames.derive(resolution.website, resolution.acceptedName, List.of()))
                    .build();
        }

        Optional<String> bestSocial = socialRanker.best(new ArrayList<>(resolution.socials));
        if (bestSocial.isPresent()) {
            String cleanedName = resolution.proposedName != null ? resolution.proposedName : name;
            List<String> socials = List.of(bestSocial.get());
            resolution.note("No verified website found after " + resolution.queriesAttempted
                    + " queries. Falling back to best social media link: " + bestSocial.get() + ".");
            return ResolvedRecord.builder()
                    .cleanedName(cleanedName)
                    .socials(socials)
                    .evidence(resolution.evidence())
                    .evidenceLinks(socials)
                    .accumulatedCost(resolution.cost.doubleValue())
                    .remarks(ResolvedRecord.REMARK_WEBSITE_UNAVAILABLE)
                    .logoFilename(LogoFilenames.derive(null, cleanedName, socials))
                    .build();
        }

        resolution.note("No verified website or social profile found after "
                + resolution.queriesAttempted + " queries.");
        return resolution.rejected();
    }

    private static List<String> resultLinks(String accepted, List<SearchResult> results) {
        List<String> links = new ArrayList<>();
        links.add(accepted);
        results.stream()
                .map(SearchResult::getLink)
                .filter(link -> link != null && !link.isBlank() && !link.equals(accepted))
                .limit(MAX_RESULT_LINKS)
                .forEach(links::add);
        return links;
    }

    /**
     * Mutable working state for one record, confined to the resolving thread.
     */
    private final class Resolution {
        private final JobSettings settings;
        private final List<String> notes = new ArrayList<>();
        private final Set<String> socials = new LinkedHashSet<>();
        private BigDecimal cost = BigDecimal.ZERO;
        private BusinessStatus closedStatus;
        private String proposedName;
        private String website;
        private String acceptedName;
        private List<String> evidenceLinks = List.of();
        private int queriesAttempted;

        private Resolution(JobSettings settings) {
            this.settings = settings;
        }

        private void addModelCost() {
            cost = cost.add(costTable.modelCost(settings.getModelName()));
        }

        private void note(String line) {
            notes.add(line);
        }

        private void accept(String url, String name, List<String> links) {
            website = url;
            acceptedName = name;
            evidenceLinks = links;
        }

        private String evidence() {
            return String.join(" ", notes);
        }

        private ResolvedRecord rejected() {
            return ResolvedRecord.builder()
                    .cleanedName("")
                    .website("")
                    .socials(List.of())
                    .evidence(evidence())
                    .accumulatedCost(cost.doubleValue())
                    .remarks(ResolvedRecord.REMARK_REJECTED)
                    .build();
        }
    }
}
