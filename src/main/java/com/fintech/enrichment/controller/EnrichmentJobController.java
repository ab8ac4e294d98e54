package com.fintech.enrichment.controller;

import com.fintech.enrichment.dto.CostEstimate;
import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.dto.JobStatusView;
import com.fintech.enrichment.service.EnrichmentJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API driving the single enrichment job.
 * <p>
 * Provides endpoints for:
 * - Starting (or resuming from a checkpoint) a job
 * - Pausing, resuming and stopping it
 * - Viewing progress and estimating cost before a run
 */
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Enrichment Jobs", description = "Merchant enrichment job control API")
public class EnrichmentJobController {

    private final EnrichmentJobService jobService;

    @Operation(
            summary = "Start an enrichment job",
            description = "Runs preflight checks and starts a background job. If a checkpoint exists for the input file the job resumes after the last checkpointed row."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Job started",
                    content = @Content(schema = @Schema(implementation = JobStatusView.class))),
            @ApiResponse(responseCode = "400", description = "Preflight checks failed"),
            @ApiResponse(responseCode = "409", description = "A job is already running")
    })
    @PostMapping
    public ResponseEntity<JobStatusView> start(@RequestBody JobSettings settings) {
        log.info("Job start requested via API for {}", settings.getInputPath());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(jobService.start(settings));
    }

    @Operation(summary = "Pause the job", description = "The job pauses before its next row.")
    @ApiResponse(responseCode = "200", description = "Pause requested")
    @PostMapping("/pause")
    public ResponseEntity<JobStatusView> pause() {
        return ResponseEntity.ok(jobService.pause());
    }

    @Operation(summary = "Resume a paused job")
    @ApiResponse(responseCode = "200", description = "Job resumed")
    @PostMapping("/resume")
    public ResponseEntity<JobStatusView> resume() {
        return ResponseEntity.ok(jobService.resume());
    }

    @Operation(
            summary = "Stop the job",
            description = "The job stops at the next row boundary, writes partial results and keeps its checkpoint so it can be resumed."
    )
    @ApiResponse(responseCode = "200", description = "Stop requested")
    @PostMapping("/stop")
    public ResponseEntity<JobStatusView> stop() {
        log.info("Job stop requested via API");
        return ResponseEntity.ok(jobService.stop());
    }

    @Operation(summary = "Get job status", description = "Returns progress of the current or last job.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status retrieved",
                    content = @Content(schema = @Schema(implementation = JobStatusView.class))),
            @ApiResponse(responseCode = "404", description = "No job has been started")
    })
    @GetMapping("/status")
    public ResponseEntity<JobStatusView> status() {
        return jobService.status()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(
            summary = "Estimate job cost",
            description = "Estimates the cost of the configured row window and checks it against the per-row budget."
    )
    @ApiResponse(responseCode = "200", description = "Estimate computed",
            content = @Content(schema = @Schema(implementation = CostEstimate.class)))
    @PostMapping("/estimate")
    public ResponseEntity<CostEstimate> estimate(@RequestBody JobSettings settings) {
        return ResponseEntity.ok(jobService.estimate(settings));
    }
}
