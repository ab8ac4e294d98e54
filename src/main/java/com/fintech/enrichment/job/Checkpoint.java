package com.fintech.enrichment.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.dto.ResolvedRecord;
import lombok.Value;

import java.util.List;

/**
 * Durable snapshot of a job: the last completed row, the settings it ran with and
 * every record resolved so far, in row order.
 */
@Value
public class Checkpoint {

    @JsonProperty("last_processed_row")
    int lastProcessedRow;

    @JsonProperty("job_settings")
    JobSettings jobSettings;

    @JsonProperty("processed_records")
    List<ResolvedRecord> processedRecords;

    @JsonCreator
    public Checkpoint(@JsonProperty("last_processed_row") int lastProcessedRow,
                      @JsonProperty("job_settings") JobSettings jobSettings,
                      @JsonProperty("processed_records") List<ResolvedRecord> processedRecords) {
        this.lastProcessedRow = lastProcessedRow;
        this.jobSettings = jobSettings;
        this.processedRecords = processedRecords == null ? List.of() : List.copyOf(processedRecords);
    }
}
