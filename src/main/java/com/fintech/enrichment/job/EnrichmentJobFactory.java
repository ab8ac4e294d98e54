package com.fintech.enrichment.job;

import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.service.IdentityResolver;
import com.fintech.enrichment.table.TableStore;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Assembles jobs from the application's shared collaborators.
 */
@Component
@RequiredArgsConstructor
public class EnrichmentJobFactory {

    private final IdentityResolver identityResolver;
    private final TableStore tableStore;
    private final CheckpointStore checkpointStore;
    private final PreflightChecker preflightChecker;
    private final EnrichmentMetrics metrics;

    @Value("${enrichment.checkpoint-interval:50}")
    private int checkpointInterval = EnrichmentJob.DEFAULT_CHECKPOINT_INTERVAL;

    public EnrichmentJob create(JobSettings settings, JobStatusListener statusListener,
                                JobCompletionListener completionListener) {
        return EnrichmentJob.builder()
                .settings(settings)
                .resolver(identityResolver)
                .tableStore(tableStore)
                .checkpointStore(checkpointStore)
                .preflightChecker(preflightChecker)
                .metrics(metrics)
                .statusListener(statusListener)
                .completionListener(completionListener)
                .checkpointInterval(checkpointInterval)
                .build();
    }
}
