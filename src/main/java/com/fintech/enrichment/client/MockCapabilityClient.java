package com.fintech.enrichment.client;

import com.fintech.enrichment.dto.AggregatorRemoval;
import com.fintech.enrichment.dto.PlaceMatch;
import com.fintech.enrichment.dto.SearchExtraction;
import com.fintech.enrichment.dto.SearchResult;
import com.fintech.enrichment.dto.WebsiteVerification;
import com.fintech.enrichment.exception.NonRetriableCapabilityException;
import com.fintech.enrichment.exception.RetriableCapabilityException;
import com.fintech.enrichment.model.BusinessStatus;
import com.fintech.enrichment.model.SocialPlatform;
import com.fintech.enrichment.service.AggregatorPrefixes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mock implementation of every capability port.
 * <p>
 * Simulates realistic behaviour without network calls:
 * - A small in-memory "web" of known merchants, searchable by name
 * - Parked pages that fail website verification
 * - Intermittent transient failures and a daily search quota (for testing resilience)
 * <p>
 * In production, this would be replaced with real search, model and HTTP integrations.
 */
@Service
@Slf4j
public class MockCapabilityClient implements SearchClient, LanguageModelClient, WebsiteFetchClient,
        PlaceLookupClient {

    /**
     * Names containing this marker make the extraction call fail with a quota error.
     */
    public static final String FORCE_FAIL_MARKER = "FORCE_FAIL_MERCHANT";

    private static final String PARKED_PAGE = "<html><body>This domain is for sale. Buy now!</body></html>";

    // Simulated web: lower-cased merchant name -> listing
    private final Map<String, MockListing> listings = new ConcurrentHashMap<>();
    private final Map<String, String> pages = new ConcurrentHashMap<>();

    private final Random random = new Random();
    private final AtomicInteger searchCallCount = new AtomicInteger();

    @Value("${enrichment.mock.failure-rate:0.0}")
    private double failureRate = 0.0;

    @Value("${enrichment.mock.search-daily-limit:10000}")
    private int searchDailyLimit = 10000;

    private volatile boolean simulateOutage = false;
    private volatile boolean forceInvalidCredentials = false;

    public MockCapabilityClient() {
        initializeMockData();
    }

    private void initializeMockData() {
        addListing(MockListing.builder()
                .name("Coffee Shop#5")
                .officialName("Coffee Shop #5")
                .website("https://www.coffeeshop5.com")
                .status(BusinessStatus.OPERATIONAL)
                .build());
        addListing(MockListing.builder()
                .name("Blue Door Bakery")
                .officialName("Blue Door Bakery")
                .social("https://www.instagram.com/bluedoorbakery")
                .social("https://www.facebook.com/bluedoorbakery")
                .status(BusinessStatus.OPERATIONAL)
                .build());
        addListing(MockListing.builder()
                .name("Old Mill Diner")
                .officialName("Old Mill Diner")
                .website("https://oldmilldiner.com")
                .status(BusinessStatus.PERMANENTLY_CLOSED)
                .build());
        addListing(MockListing.builder()
                .name("Parked Widgets")
                .officialName("Parked Widgets LLC")
                .website("https://parkedwidgets.com")
                .parked(true)
                .status(BusinessStatus.OPERATIONAL)
                .build());

        log.info("Mock capability client initialized with {} listings", listings.size());
    }

    // SearchClient

    @Override
    public List<SearchResult> search(String query) {
        guard("search");
        if (searchCallCount.incrementAndGet() > searchDailyLimit) {
            throw new NonRetriableCapabilityException(
                    "Search daily quota of " + searchDailyLimit + " queries exceeded", "search");
        }
        log.debug("Mock search for query: {}", query);

        Optional<MockListing> listing = findListing(query);
        if (listing.isEmpty()) {
            return List.of();
        }
        MockListing match = listing.get();
        List<SearchResult> results = new ArrayList<>();
        if (match.getWebsite() != null) {
            results.add(SearchResult.builder()
                    .title("Official Site for " + match.getOfficialName())
                    .link(match.getWebsite())
                    .snippet("The official website of " + match.getOfficialName() + ".")
                    .build());
        }
        for (String social : match.getSocials()) {
            results.add(SearchResult.builder()
                    .title(match.getOfficialName() + " | Social")
                    .link(social)
                    .snippet("Follow " + match.getOfficialName() + " for updates.")
                    .build());
        }
        return results;
    }

    // LanguageModelClient

    @Override
    public AggregatorRemoval removeAggregator(String rawName) {
        guard("language-model");
        String aggregator = AggregatorPrefixes.detect(rawName);
        if (aggregator == null) {
            return AggregatorRemoval.builder()
                    .cleanedName(rawName == null ? "" : rawName.trim())
                    .reason("No aggregator found.")
                    .build();
        }
        return AggregatorRemoval.builder()
                .cleanedName(AggregatorPrefixes.strip(rawName))
                .reason("Removed '" + aggregator + " *' prefix.")
                .build();
    }

    @Override
    public SearchExtraction extract(List<SearchResult> searchResults, String originalName, String query) {
        guard("language-model");
        if (originalName != null && originalName.contains(FORCE_FAIL_MARKER)) {
            throw new NonRetriableCapabilityException("Forced non-retriable error for " + originalName,
                    "language-model");
        }

        List<String> websites = new ArrayList<>();
        List<String> socials = new ArrayList<>();
        for (SearchResult result : searchResults) {
            if (SocialPlatform.of(result.getLink()).isPresent()) {
                socials.add(result.getLink());
            } else {
                websites.add(result.getLink());
            }
        }
        Optional<MockListing> listing = findListing(query);
        return SearchExtraction.builder()
                .cleanedName(listing.map(MockListing::getOfficialName).orElse(originalName))
                .websiteCandidates(websites)
                .socialCandidates(socials)
                .businessStatus(listing.map(MockListing::getStatus).orElse(BusinessStatus.UNCERTAIN))
                .summary("Analysed " + searchResults.size() + " results for '" + query + "'.")
                .build();
    }

    @Override
    public WebsiteVerification verifyWebsite(String pageText, String merchantName) {
        guard("language-model");
        String lower = pageText == null ? "" : pageText.toLowerCase(Locale.ROOT);
        boolean parked = lower.contains("for sale") || lower.contains("under construction")
                || lower.contains("parked");
        return WebsiteVerification.builder()
                .valid(!parked)
                .reasoning(parked
                        ? "The page is a parked or for-sale placeholder."
                        : "The website appears to be a legitimate and operational business page.")
                .build();
    }

    // WebsiteFetchClient

    @Override
    public String fetch(String url) {
        guard("website-fetch");
        String page = pages.get(normalizeUrl(url));
        if (page == null) {
            throw new RetriableCapabilityException("Website fetch failed: no route to " + url, "website-fetch");
        }
        return page;
    }

    // PlaceLookupClient

    @Override
    public Optional<PlaceMatch> findPlace(String query) {
        guard("place-lookup");
        return findListing(query).map(listing -> PlaceMatch.builder()
                .name(listing.getOfficialName())
                .website(listing.getWebsite())
                .formattedAddress("")
                .build());
    }

    @Override
    public boolean validateCredentials() {
        return !forceInvalidCredentials;
    }

    private void guard(String capability) {
        if (simulateOutage) {
            throw new RetriableCapabilityException(capability + " is currently unavailable", capability);
        }
        if (failureRate > 0 && random.nextDouble() < failureRate) {
            throw new RetriableCapabilityException("Simulated rate limit from " + capability, capability);
        }
    }

    private Optional<MockListing> findListing(String query) {
        if (query == null) {
            return Optional.empty();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        return listings.entrySet().stream()
                .filter(entry -> lower.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static String normalizeUrl(String url) {
        String trimmed = url == null ? "" : url.trim().toLowerCase(Locale.ROOT);
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    // Methods for testing/simulation control

    /**
     * Add a merchant to the simulated web.
     */
    public void addListing(MockListing listing) {
        listings.put(listing.getName().toLowerCase(Locale.ROOT), listing);
        if (listing.getWebsite() != null) {
            pages.put(normalizeUrl(listing.getWebsite()), listing.isParked()
                    ? PARKED_PAGE
                    : "<html><body><h1>" + listing.getOfficialName() + "</h1><p>Opening hours, menu and contact.</p></body></html>");
        }
    }

    public void clearMockData() {
        listings.clear();
        pages.clear();
        searchCallCount.set(0);
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Capability outage simulation set to: {}", outage);
    }

    public void setForceInvalidCredentials(boolean forceInvalidCredentials) {
        this.forceInvalidCredentials = forceInvalidCredentials;
    }

    public void setFailureRate(double failureRate) {
        this.failureRate = failureRate;
    }

    public int getSearchCallCount() {
        return searchCallCount.get();
    }
}
