package com.fintech.enrichment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.enrichment.client.LanguageModelClient;
import com.fintech.enrichment.client.PlaceLookupClient;
import com.fintech.enrichment.client.SearchClient;
import com.fintech.enrichment.client.WebsiteFetchClient;
import com.fintech.enrichment.job.CheckpointStore;
import com.fintech.enrichment.job.EnrichmentMetrics;
import com.fintech.enrichment.job.PreflightChecker;
import com.fintech.enrichment.model.SocialPlatform;
import com.fintech.enrichment.service.CostEstimator;
import com.fintech.enrichment.service.CostTable;
import com.fintech.enrichment.service.IdentityResolver;
import com.fintech.enrichment.service.ResilienceExecutor;
import com.fintech.enrichment.service.SocialCandidateRanker;
import com.fintech.enrichment.table.CsvTableStore;
import com.fintech.enrichment.table.FileFormatTableStore;
import com.fintech.enrichment.table.TableStore;
import com.fintech.enrichment.table.XlsxTableStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds the collaborators shared by every enrichment job.
 */
@Configuration
public class EnrichmentConfig {

    @Bean
    public CostTable costTable(@Value("${enrichment.costs.search:0.005}") BigDecimal searchCost,
                               @Value("${enrichment.costs.place-lookup:0.017}") BigDecimal placeLookupCost,
                               @Value("${enrichment.costs.default-model:0.001}") BigDecimal defaultModelCost) {
        return CostTable.defaults().toBuilder()
                .searchCost(searchCost)
                .placeLookupCost(placeLookupCost)
                .defaultModelCost(defaultModelCost)
                .build();
    }

    @Bean
    public CostEstimator costEstimator(CostTable costTable) {
        return new CostEstimator(costTable);
    }

    @Bean
    public SocialCandidateRanker socialCandidateRanker(
            @Value("${enrichment.social-priority:facebook,linkedin,instagram,twitter}") List<String> priority) {
        List<SocialPlatform> platforms = priority.stream()
                .map(name -> SocialPlatform.valueOf(name.trim().toUpperCase(Locale.ROOT)))
                .collect(Collectors.toList());
        return new SocialCandidateRanker(platforms);
    }

    @Bean
    public TableStore tableStore() {
        return new FileFormatTableStore(new CsvTableStore(), new XlsxTableStore());
    }

    @Bean
    public CheckpointStore checkpointStore(ObjectMapper objectMapper) {
        return new CheckpointStore(objectMapper);
    }

    @Bean
    public EnrichmentMetrics enrichmentMetrics(MeterRegistry meterRegistry) {
        return new EnrichmentMetrics(meterRegistry);
    }

    @Bean
    public IdentityResolver identityResolver(SearchClient searchClient,
                                             LanguageModelClient languageModelClient,
                                             WebsiteFetchClient websiteFetchClient,
                                             PlaceLookupClient placeLookupClient,
                                             ResilienceExecutor resilienceExecutor,
                                             CostTable costTable,
                                             SocialCandidateRanker socialCandidateRanker) {
        return new IdentityResolver(searchClient, languageModelClient, websiteFetchClient, placeLookupClient,
                resilienceExecutor, costTable, socialCandidateRanker);
    }

    @Bean
    public PreflightChecker preflightChecker(TableStore tableStore,
                                             SearchClient searchClient,
                                             LanguageModelClient languageModelClient,
                                             WebsiteFetchClient websiteFetchClient,
                                             PlaceLookupClient placeLookupClient,
                                             CostEstimator costEstimator) {
        return new PreflightChecker(tableStore, searchClient, languageModelClient, websiteFetchClient,
                placeLookupClient, costEstimator);
    }
}
