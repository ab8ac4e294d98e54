package com.fintech.enrichment.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.enrichment.dto.ColumnMapping;
import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.dto.RawRecord;
import com.fintech.enrichment.dto.ResolvedRecord;
import com.fintech.enrichment.exception.NonRetriableCapabilityException;
import com.fintech.enrichment.exception.PreflightException;
import com.fintech.enrichment.exception.ResolutionAbortedException;
import com.fintech.enrichment.service.IdentityResolver;
import com.fintech.enrichment.table.CsvTableStore;
import com.fintech.enrichment.table.Table;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class EnrichmentJobTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Mock
    private IdentityResolver resolver;

    @Mock
    private PreflightChecker preflightChecker;

    @TempDir
    Path tempDir;

    private final CsvTableStore tableStore = new CsvTableStore();
    private final CheckpointStore checkpointStore = new CheckpointStore(new ObjectMapper());
    private EnrichmentMetrics metrics;
    private List<String> completions;
    private List<String> resolvedNames;

    @BeforeEach
    void setUp() {
        metrics = new EnrichmentMetrics(new SimpleMeterRegistry());
        completions = new CopyOnWriteArrayList<>();
        resolvedNames = Collections.synchronizedList(new ArrayList<>());
        lenient().doAnswer(resolving()).when(resolver).resolve(any(RawRecord.class), any(JobSettings.class));
    }

    @Nested
    @DisplayName("Complete runs")
    class CompleteRuns {

        @Test
        @DisplayName("Should resolve every row, write the output and remove the checkpoint")
        void shouldCompleteAndCleanUp() throws Exception {
            // Given
            Path input = writeInput("merchants.csv", 5);
            JobSettings settings = settings(input, 2, 6);
            List<Integer> reportedTotals = new CopyOnWriteArrayList<>();
            EnrichmentJob job = newJob(settings, (processed, total, message) -> reportedTotals.add(total));

            // When
            assertThat(job.start()).isTrue();
            assertThat(job.awaitTermination(TIMEOUT)).isTrue();

            // Then
            assertThat(completions).containsExactly(EnrichmentJob.COMPLETED);
            assertThat(job.isRunning()).isFalse();
            assertThat(job.getRecords()).hasSize(5);
            assertThat(reportedTotals).hasSize(5).containsOnly(5);
            assertThat(checkpointStore.exists(input.toString())).isFalse();

            Table output = tableStore.read(outputOf(input));
            int name = output.columnIndex("Cleaned Merchant Name");
            assertThat(output.getCell(2, name)).isEqualTo("Merchant 2 Ltd");
            assertThat(output.getCell(6, name)).isEqualTo("Merchant 6 Ltd");
            assertThat(job.getStatus().getCompletionMessage()).isEqualTo(EnrichmentJob.COMPLETED);
            assertThat(metrics.getRowsProcessed().count()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Should isolate a failing row as FATAL_ERROR and finish the batch")
        void shouldIsolateFailingRow() throws Exception {
            // Given
            Path input = writeInput("merchants.csv", 5);
            doAnswer(invocation -> {
                RawRecord record = invocation.getArgument(0);
                if (record.getMerchantNameRaw().equals("Merchant 4")) {
                    throw new IllegalStateException("model returned garbage");
                }
                return resolvedFor(record);
            }).when(resolver).resolve(any(RawRecord.class), any(JobSettings.class));
            EnrichmentJob job = newJob(settings(input, 2, 6), null);

            // When
            job.start();
            job.awaitTermination(TIMEOUT);

            // Then
            assertThat(completions).containsExactly(EnrichmentJob.COMPLETED);
            List<ResolvedRecord> records = job.getRecords();
            assertThat(records).hasSize(5);
            assertThat(records.get(2).getRemarks()).startsWith("FATAL_ERROR").contains("model returned garbage");
            assertThat(records.get(3).getCleanedName()).isEqualTo("Merchant 5 Ltd");
            assertThat(metrics.getRowsFailed().count()).isEqualTo(1.0);

            Table output = tableStore.read(outputOf(input));
            assertThat(output.getCell(4, output.columnIndex("Remarks"))).startsWith("FATAL_ERROR");
        }

        @Test
        @DisplayName("Should keep the cost a failed row spent before aborting")
        void shouldKeepPartialCostOfFailedRow() throws Exception {
            // Given
            Path input = writeInput("merchants.csv", 2);
            doAnswer(invocation -> {
                RawRecord record = invocation.getArgument(0);
                if (record.getMerchantNameRaw().equals("Merchant 3")) {
                    throw new ResolutionAbortedException(
                            new NonRetriableCapabilityException("quota exhausted", "language-model"), 0.007);
                }
                return resolvedFor(record);
            }).when(resolver).resolve(any(RawRecord.class), any(JobSettings.class));
            EnrichmentJob job = newJob(settings(input, 2, 3), null);

            // When
            job.start();
            job.awaitTermination(TIMEOUT);

            // Then
            ResolvedRecord failed = job.getRecords().get(1);
            assertThat(failed.isFatalError()).isTrue();
            assertThat(failed.getRemarks()).isEqualTo("FATAL_ERROR: quota exhausted");
            assertThat(failed.getAccumulatedCost()).isEqualTo(0.007);
            assertThat(failed.getEvidence()).contains("NonRetriableCapabilityException");

            Table output = tableStore.read(outputOf(input));
            assertThat(output.getCell(3, output.columnIndex("Cost per Row"))).isEqualTo("0.007");
        }

        @Test
        @DisplayName("Should leave rows outside the configured window untouched")
        void shouldContainOutputToWindow() throws Exception {
            // Given
            Path input = writeInput("merchants.csv", 10);
            EnrichmentJob job = newJob(settings(input, 4, 6), null);

            // When
            job.start();
            job.awaitTermination(TIMEOUT);

            // Then
            Table output = tableStore.read(outputOf(input));
            int merchant = output.columnIndex("Merchant");
            int name = output.columnIndex("Cleaned Merchant Name");
            for (int row = 2; row <= 11; row++) {
                assertThat(output.getCell(row, merchant)).isEqualTo("Merchant " + row);
                if (row >= 4 && row <= 6) {
                    assertThat(output.getCell(row, name)).isEqualTo("Merchant " + row + " Ltd");
                } else {
                    assertThat(output.getCell(row, name)).isEmpty();
                }
            }
            assertThat(resolvedNames).containsExactly("Merchant 4", "Merchant 5", "Merchant 6");
        }
    }

    @Nested
    @DisplayName("Row boundaries")
    class RowBoundaries {

        @Test
        @DisplayName("Should process only the first data row when start and end are row 2")
        void shouldProcessFirstRowOnly() throws Exception {
            Path input = writeInput("merchants.csv", 3);
            EnrichmentJob job = newJob(settings(input, 2, 2), null);

            job.start();
            job.awaitTermination(TIMEOUT);

            assertThat(resolvedNames).containsExactly("Merchant 2");
            Table output = tableStore.read(outputOf(input));
            assertThat(output.getCell(2, output.columnIndex("Website"))).isEqualTo("https://merchant-2.example.com");
            assertThat(output.getCell(3, output.columnIndex("Website"))).isEmpty();
        }

        @Test
        @DisplayName("Should process only the last row when the window starts there")
        void shouldProcessLastRowOnly() throws Exception {
            Path input = writeInput("merchants.csv", 3);
            EnrichmentJob job = newJob(settings(input, 4, 4), null);

            job.start();
            job.awaitTermination(TIMEOUT);

            assertThat(resolvedNames).containsExactly("Merchant 4");
            Table output = tableStore.read(outputOf(input));
            assertThat(output.getCell(4, output.columnIndex("Cleaned Merchant Name"))).isEqualTo("Merchant 4 Ltd");
        }

        @Test
        @DisplayName("Should clamp an end row past the last data row")
        void shouldClampEndRow() throws Exception {
            Path input = writeInput("merchants.csv", 3);
            EnrichmentJob job = newJob(settings(input, 3, 100), null);

            job.start();
            job.awaitTermination(TIMEOUT);

            assertThat(completions).containsExactly(EnrichmentJob.COMPLETED);
            assertThat(resolvedNames).containsExactly("Merchant 3", "Merchant 4");
        }
    }

    @Nested
    @DisplayName("Stop and resume")
    class StopAndResume {

        @Test
        @DisplayName("Should produce the same output after a stop and resume as an uninterrupted run")
        void shouldResumeIdempotently() throws Exception {
            // Given an uninterrupted reference run
            Path referenceInput = writeInput("reference/merchants.csv", 50);
            EnrichmentJob reference = newJob(settings(referenceInput, 2, 51), null);
            reference.start();
            reference.awaitTermination(TIMEOUT);
            List<String> expected = Files.readAllLines(outputOf(referenceInput));

            // And a run stopped after row 25
            Path input = writeInput("resumed/merchants.csv", 50);
            AtomicReference<EnrichmentJob> jobRef = new AtomicReference<>();
            AtomicBoolean stopRequested = new AtomicBoolean(false);
            EnrichmentJob job = newJob(settings(input, 2, 51), (processed, total, message) -> {
                if (processed == 24 && stopRequested.compareAndSet(false, true)) {
                    jobRef.get().stop();
                }
            });
            jobRef.set(job);
            completions.clear();
            job.start();
            job.awaitTermination(TIMEOUT);

            assertThat(completions).containsExactly(EnrichmentJob.STOPPED);
            Checkpoint checkpoint = checkpointStore.load(input.toString()).orElseThrow();
            assertThat(checkpoint.getLastProcessedRow()).isEqualTo(25);
            assertThat(checkpoint.getProcessedRecords()).hasSize(24);
            Table partial = tableStore.read(outputOf(input));
            assertThat(partial.getCell(25, partial.columnIndex("Cleaned Merchant Name"))).isEqualTo("Merchant 25 Ltd");
            assertThat(partial.getCell(26, partial.columnIndex("Cleaned Merchant Name"))).isEmpty();

            // When
            resolvedNames.clear();
            completions.clear();
            assertThat(job.start()).isTrue();
            job.awaitTermination(TIMEOUT);

            // Then
            assertThat(completions).containsExactly(EnrichmentJob.COMPLETED);
            assertThat(resolvedNames).hasSize(26).startsWith("Merchant 26").endsWith("Merchant 51");
            assertThat(job.getRecords()).hasSize(50);
            assertThat(Files.readAllLines(outputOf(input))).isEqualTo(expected);
            assertThat(checkpointStore.exists(input.toString())).isFalse();
        }

        @Test
        @DisplayName("Should hold at the row boundary while paused")
        void shouldPauseAndResume() throws Exception {
            // Given
            Path input = writeInput("merchants.csv", 4);
            AtomicReference<EnrichmentJob> jobRef = new AtomicReference<>();
            CountDownLatch paused = new CountDownLatch(1);
            EnrichmentJob job = newJob(settings(input, 2, 5), (processed, total, message) -> {
                if (processed == 1) {
                    jobRef.get().pause();
                    paused.countDown();
                }
            });
            jobRef.set(job);

            // When
            job.start();
            assertThat(paused.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(200);

            // Then
            assertThat(job.getStatus().isPaused()).isTrue();
            assertThat(job.getStatus().getProcessedCount()).isEqualTo(1);
            assertThat(job.isRunning()).isTrue();

            job.resume();
            job.awaitTermination(TIMEOUT);
            assertThat(job.getRecords()).hasSize(4);
            assertThat(completions).containsExactly(EnrichmentJob.COMPLETED);
        }

        @Test
        @DisplayName("Should stop a paused job and keep its checkpoint")
        void shouldStopWhilePaused() throws Exception {
            Path input = writeInput("merchants.csv", 4);
            AtomicReference<EnrichmentJob> jobRef = new AtomicReference<>();
            CountDownLatch paused = new CountDownLatch(1);
            EnrichmentJob job = newJob(settings(input, 2, 5), (processed, total, message) -> {
                if (processed == 2) {
                    jobRef.get().pause();
                    paused.countDown();
                }
            });
            jobRef.set(job);

            job.start();
            assertThat(paused.await(5, TimeUnit.SECONDS)).isTrue();
            job.stop();
            job.awaitTermination(TIMEOUT);

            assertThat(completions).containsExactly(EnrichmentJob.STOPPED);
            assertThat(checkpointStore.load(input.toString()).orElseThrow().getLastProcessedRow()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should not start a worker when preflight fails")
        void shouldRejectOnPreflightFailure() throws Exception {
            // Given
            Path input = writeInput("merchants.csv", 3);
            JobSettings settings = settings(input, 2, 4);
            doThrow(new PreflightException(List.of("Search credentials are invalid")))
                    .when(preflightChecker).check(settings);
            EnrichmentJob job = newJob(settings, null);

            // When / Then
            assertThatThrownBy(job::start)
                    .isInstanceOf(PreflightException.class)
                    .hasMessageContaining("Search credentials are invalid");
            assertThat(job.isRunning()).isFalse();
            assertThat(job.awaitTermination(TIMEOUT)).isTrue();
            verifyNoInteractions(resolver);
            assertThat(completions).isEmpty();
            assertThat(Files.exists(outputOf(input))).isFalse();
        }

        @Test
        @DisplayName("Should report failure and keep a checkpoint when the output cannot be written")
        void shouldFailOnOutputWriteError() throws Exception {
            // Given
            Path input = writeInput("merchants.csv", 3);
            JobSettings settings = settings(input, 2, 4).toBuilder()
                    .outputPath(tempDir.resolve("missing").resolve("out.csv").toString())
                    .build();
            EnrichmentJob job = newJob(settings, null);

            // When
            job.start();
            job.awaitTermination(TIMEOUT);

            // Then
            assertThat(completions).hasSize(1);
            assertThat(completions.get(0)).startsWith(EnrichmentJob.FAILED_PREFIX);
            assertThat(checkpointStore.load(input.toString()).orElseThrow().getLastProcessedRow()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should ignore a start while the job is running")
        void shouldIgnoreSecondStart() throws Exception {
            // Given
            Path input = writeInput("merchants.csv", 2);
            CountDownLatch release = new CountDownLatch(1);
            Answer<ResolvedRecord> delegate = resolving();
            doAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return delegate.answer(invocation);
            }).when(resolver).resolve(any(RawRecord.class), any(JobSettings.class));
            EnrichmentJob job = newJob(settings(input, 2, 3), null);

            // When
            boolean first = job.start();
            boolean second = job.start();
            release.countDown();
            job.awaitTermination(TIMEOUT);

            // Then
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(resolvedNames).containsExactly("Merchant 2", "Merchant 3");
            assertThat(completions).containsExactly(EnrichmentJob.COMPLETED);
        }
    }

    private EnrichmentJob newJob(JobSettings settings, JobStatusListener statusListener) {
        return EnrichmentJob.builder()
                .jobId("test-job")
                .settings(settings)
                .resolver(resolver)
                .tableStore(tableStore)
                .checkpointStore(checkpointStore)
                .preflightChecker(preflightChecker)
                .metrics(metrics)
                .statusListener(statusListener)
                .completionListener(completions::add)
                .checkpointInterval(10)
                .build();
    }

    private Answer<ResolvedRecord> resolving() {
        return invocation -> resolvedFor(invocation.getArgument(0));
    }

    private ResolvedRecord resolvedFor(RawRecord record) {
        String name = record.getMerchantNameRaw();
        resolvedNames.add(name);
        String slug = name.toLowerCase(Locale.ROOT).replace(' ', '-');
        return ResolvedRecord.builder()
                .cleanedName(name + " Ltd")
                .website("https://" + slug + ".example.com")
                .evidence("Accepted website for " + name + " in " + record.getCity() + ".")
                .evidenceLinks(List.of("https://" + slug + ".example.com"))
                .accumulatedCost(0.008)
                .logoFilename(slug + ".png")
                .build();
    }

    private JobSettings settings(Path input, int startRow, int endRow) {
        return JobSettings.builder()
                .inputPath(input.toString())
                .outputPath(outputOf(input).toString())
                .columnMapping(ColumnMapping.builder().merchantName("Merchant").city("City").build())
                .startRow(startRow)
                .endRow(endRow)
                .modelName("gemini-1.5-flash")
                .build();
    }

    private Path outputOf(Path input) {
        return input.resolveSibling("enriched.csv");
    }

    /**
     * Writes a table whose data row {@code r} holds merchant "Merchant r".
     */
    private Path writeInput(String name, int dataRows) throws IOException {
        Path input = tempDir.resolve(name);
        Files.createDirectories(input.getParent());
        StringBuilder csv = new StringBuilder("Merchant,City,Account Id\n");
        for (int row = Table.FIRST_DATA_ROW; row < Table.FIRST_DATA_ROW + dataRows; row++) {
            csv.append("Merchant ").append(row).append(",Austin,ACC-").append(row).append('\n');
        }
        Files.writeString(input, csv.toString());
        return input;
    }
}
