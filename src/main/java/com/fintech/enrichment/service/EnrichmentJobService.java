package com.fintech.enrichment.service;

import com.fintech.enrichment.dto.CostEstimate;
import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.dto.JobStatusView;
import com.fintech.enrichment.exception.JobAlreadyRunningException;
import com.fintech.enrichment.exception.NoActiveJobException;
import com.fintech.enrichment.job.EnrichmentJob;
import com.fintech.enrichment.job.EnrichmentJobFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Owns the single enrichment job of this process.
 * <p>
 * Only one job runs at a time. A finished or stopped job stays current so its status
 * remains visible until the next start replaces it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnrichmentJobService {

    private final EnrichmentJobFactory jobFactory;
    private final CostEstimator costEstimator;

    private volatile EnrichmentJob currentJob;

    /**
     * Starts a job for the given settings, resuming from its checkpoint when one exists.
     *
     * @throws JobAlreadyRunningException if a job is still running
     * @throws com.fintech.enrichment.exception.PreflightException if preflight fails
     */
    public synchronized JobStatusView start(JobSettings settings) {
        EnrichmentJob running = currentJob;
        if (running != null && running.isRunning()) {
            throw new JobAlreadyRunningException(running.getJobId());
        }

        EnrichmentJob job = jobFactory.create(settings,
                (processed, total, message) -> log.debug("Progress {}/{}: {}", processed, total, message),
                message -> log.info("Enrichment job completed with: {}", message));
        job.start();
        currentJob = job;
        return job.getStatus();
    }

    public JobStatusView pause() {
        EnrichmentJob job = requireCurrentJob();
        job.pause();
        return job.getStatus();
    }

    public JobStatusView resume() {
        EnrichmentJob job = requireCurrentJob();
        job.resume();
        return job.getStatus();
    }

    public JobStatusView stop() {
        EnrichmentJob job = requireCurrentJob();
        job.stop();
        return job.getStatus();
    }

    public Optional<JobStatusView> status() {
        return Optional.ofNullable(currentJob).map(EnrichmentJob::getStatus);
    }

    public CostEstimate estimate(JobSettings settings) {
        return costEstimator.estimate(settings);
    }

    private EnrichmentJob requireCurrentJob() {
        EnrichmentJob job = currentJob;
        if (job == null) {
            throw new NoActiveJobException();
        }
        return job;
    }
}
