package com.fintech.enrichment.job;

import com.fintech.enrichment.dto.ResolvedRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;

/**
 * Micrometer meters shared by every job of the process.
 */
@Getter
public class EnrichmentMetrics {

    private final Counter rowsProcessed;
    private final Counter rowsFailed;
    private final Counter rowsAccepted;
    private final Counter rowsRejected;
    private final Counter checkpointsWritten;
    private final Timer rowTimer;

    public EnrichmentMetrics(MeterRegistry meterRegistry) {
        rowsProcessed = Counter.builder("enrichment.rows.processed")
                .description("Rows resolved, failed rows included")
                .register(meterRegistry);

        rowsFailed = Counter.builder("enrichment.rows.failed")
                .description("Rows whose resolution raised and were marked FATAL_ERROR")
                .register(meterRegistry);

        rowsAccepted = Counter.builder("enrichment.rows.accepted")
                .description("Rows resolved to a website or social profile")
                .register(meterRegistry);

        rowsRejected = Counter.builder("enrichment.rows.rejected")
                .description("Rows rejected with NA")
                .register(meterRegistry);

        checkpointsWritten = Counter.builder("enrichment.checkpoints.written")
                .description("Checkpoints persisted")
                .register(meterRegistry);

        rowTimer = Timer.builder("enrichment.row.duration")
                .description("Time taken to resolve one row")
                .register(meterRegistry);
    }

    void recordOutcome(ResolvedRecord record) {
        rowsProcessed.increment();
        if (record.isFatalError()) {
            rowsFailed.increment();
        } else if (record.isRejected()) {
            rowsRejected.increment();
        } else {
            rowsAccepted.increment();
        }
    }
}
