package com.fintech.enrichment.job;

import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.dto.JobStatusView;
import com.fintech.enrichment.dto.RawRecord;
import com.fintech.enrichment.dto.ResolvedRecord;
import com.fintech.enrichment.exception.CheckpointException;
import com.fintech.enrichment.exception.PreflightException;
import com.fintech.enrichment.exception.ResolutionAbortedException;
import com.fintech.enrichment.service.IdentityResolver;
import com.fintech.enrichment.table.Table;
import com.fintech.enrichment.table.TableStore;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one enrichment job on a single background worker.
 * <p>
 * Key Design Decisions:
 * 1. Resumability: progress is checkpointed every {@code checkpointInterval} rows and on stop;
 *    a later start on the same input continues after the last checkpointed row
 * 2. Fault isolation: a row whose resolution throws becomes a FATAL_ERROR record and the
 *    batch continues
 * 3. Cooperative control: pause and stop take effect at row boundaries, never mid-call
 * 4. Composable output: only the slice of rows this job produced is overwritten
 * <p>
 * The caller and the worker share only the immutable settings, the pause control and the
 * listeners. Listeners run on the worker thread.
 */
@Slf4j
public class EnrichmentJob {

    public static final String COMPLETED = "Completed Successfully";
    public static final String STOPPED = "Stopped";
    public static final String FAILED_PREFIX = "Failed: ";
    public static final String MDC_JOB_ID = "jobId";
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 50;

    private final String jobId;
    private final JobSettings settings;
    private final IdentityResolver resolver;
    private final TableStore tableStore;
    private final CheckpointStore checkpointStore;
    private final OutputReconciler outputReconciler;
    private final PreflightChecker preflightChecker;
    private final EnrichmentMetrics metrics;
    private final JobStatusListener statusListener;
    private final JobCompletionListener completionListener;
    private final int checkpointInterval;

    // Prevents concurrent runs of the same job
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    private volatile PauseControl pauseControl = new PauseControl();
    private volatile JobState state = new JobState();
    private volatile JobSettings activeSettings;
    private volatile ExecutorService executor;
    private volatile int totalCount;
    private volatile String lastMessage = "Not started";
    private volatile String completionMessage;

    @Builder
    private EnrichmentJob(String jobId,
                          JobSettings settings,
                          IdentityResolver resolver,
                          TableStore tableStore,
                          CheckpointStore checkpointStore,
                          PreflightChecker preflightChecker,
                          EnrichmentMetrics metrics,
                          JobStatusListener statusListener,
                          JobCompletionListener completionListener,
                          Integer checkpointInterval) {
        this.jobId = jobId == null ? UUID.randomUUID().toString() : jobId;
        this.settings = settings;
        this.resolver = resolver;
        this.tableStore = tableStore;
        this.checkpointStore = checkpointStore;
        this.outputReconciler = new OutputReconciler(tableStore);
        this.preflightChecker = preflightChecker;
        this.metrics = metrics;
        this.statusListener = statusListener == null ? JobStatusListener.NONE : statusListener;
        this.completionListener = completionListener == null ? JobCompletionListener.NONE : completionListener;
        this.checkpointInterval = checkpointInterval == null || checkpointInterval < 1
                ? DEFAULT_CHECKPOINT_INTERVAL
                : checkpointInterval;
        this.totalCount = settings.configuredRowCount();
    }

    /**
     * Runs preflight checks and spawns the worker.
     *
     * @return false if the job was already running, in which case nothing happens
     * @throws PreflightException if a check fails; no worker is started
     */
    public boolean start() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Job {} is already running, ignoring start", jobId);
            return false;
        }

        try {
            preflightChecker.check(settings);
        } catch (PreflightException e) {
            isRunning.set(false);
            throw e;
        }

        pauseControl = new PauseControl();
        state = new JobState();
        activeSettings = null;
        completionMessage = null;
        lastMessage = "Starting";

        ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "enrichment-" + jobId);
            thread.setDaemon(true);
            return thread;
        });
        executor = worker;
        worker.execute(this::run);
        worker.shutdown();
        log.info("Started job {} for {} rows {}..{}", jobId, settings.getInputPath(),
                settings.getStartRow(), settings.getEndRow());
        return true;
    }

    public void pause() {
        pauseControl.pause();
        lastMessage = "Paused";
        log.info("Job {} paused", jobId);
    }

    public void resume() {
        pauseControl.resume();
        lastMessage = "Resumed";
        log.info("Job {} resumed", jobId);
    }

    /**
     * Requests a stop at the next row boundary. Partial results are still written.
     */
    public void stop() {
        pauseControl.stop();
        log.info("Job {} stop requested", jobId);
    }

    /**
     * Waits for the worker of the current run to finish.
     *
     * @return true if no worker is active when this returns
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService worker = executor;
        return worker == null || worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return isRunning.get();
    }

    public String getJobId() {
        return jobId;
    }

    public JobSettings getSettings() {
        return activeSettings != null ? activeSettings : settings;
    }

    public List<ResolvedRecord> getRecords() {
        return state.getRecords();
    }

    public JobStatusView getStatus() {
        JobState current = state;
        return JobStatusView.builder()
                .jobId(jobId)
                .inputPath(getSettings().getInputPath())
                .running(isRunning.get())
                .paused(pauseControl.isPaused())
                .processedCount(current.getProcessedCount())
                .totalCount(totalCount)
                .lastProcessedRow(current.getLastProcessedRow())
                .message(lastMessage)
                .completionMessage(completionMessage)
                .build();
    }

    private void run() {
        MDC.put(MDC_JOB_ID, jobId);
        try {
            String completion;
            try {
                completion = process();
            } catch (Exception e) {
                log.error("Job {} failed", jobId, e);
                persistAfterFailure();
                completion = FAILED_PREFIX + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }

            completionMessage = completion;
            lastMessage = completion;
            isRunning.set(false);
            log.info("Job {} finished: {}", jobId, completion);
            notifyCompletion(completion);
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    private String process() {
        JobSettings runSettings = settings;
        int resumeCursor = settings.getStartRow();

        Optional<Checkpoint> checkpoint = checkpointStore.load(settings.getInputPath());
        if (checkpoint.isPresent()) {
            runSettings = checkpoint.get().getJobSettings();
            state.restore(checkpoint.get());
            resumeCursor = checkpoint.get().getLastProcessedRow() + 1;
            log.info("Resuming job {} from row {} with {} restored records",
                    jobId, resumeCursor, state.getRestoredCount());
        }
        activeSettings = runSettings;
        totalCount = runSettings.configuredRowCount();

        Table table = tableStore.read(Paths.get(runSettings.getInputPath()));
        RecordMapper mapper = new RecordMapper(table, runSettings.getColumnMapping());

        int configuredStart = runSettings.getStartRow();
        int effectiveStart = Math.max(configuredStart, resumeCursor);
        int effectiveEnd = Math.min(runSettings.getEndRow(), table.getLastRowNumber());
        log.debug("Configured window {}..{}, effective window {}..{}",
                configuredStart, runSettings.getEndRow(), effectiveStart, effectiveEnd);

        PauseControl control = pauseControl;
        boolean stopped = false;
        int processedThisRun = 0;
        for (int rowNumber = effectiveStart; rowNumber <= effectiveEnd; rowNumber++) {
            if (!control.awaitRowBoundary()) {
                stopped = true;
                break;
            }

            ResolvedRecord record = resolveRow(mapper, rowNumber, runSettings);
            metrics.recordOutcome(record);
            int processed = state.append(rowNumber, record);
            processedThisRun++;

            lastMessage = "Processed row " + rowNumber;
            statusListener.onStatus(processed, totalCount, lastMessage);

            if (processedThisRun % checkpointInterval == 0) {
                saveCheckpoint(runSettings);
            }
        }
        // A stop requested while the last row was in flight still counts as a stop
        stopped = stopped || control.isStopped();

        if (stopped) {
            if (state.getLastProcessedRow() > 0) {
                saveCheckpoint(runSettings);
            }
            writeOutput(runSettings, resumeCursor);
            return STOPPED;
        }

        writeOutput(runSettings, resumeCursor);
        checkpointStore.delete(runSettings.getInputPath());
        return COMPLETED;
    }

    private ResolvedRecord resolveRow(RecordMapper mapper, int rowNumber, JobSettings runSettings) {
        String rawName = "";
        try {
            RawRecord record = mapper.map(rowNumber);
            rawName = record.getMerchantNameRaw();
            return metrics.getRowTimer().record(() -> resolver.resolve(record, runSettings));
        } catch (ResolutionAbortedException e) {
            log.warn("Row {} ('{}') failed after spending {}, marking as FATAL_ERROR: {}",
                    rowNumber, rawName, e.getPartialCost(), e.getMessage());
            return ResolvedRecord.fatalError(rawName, e.getCause(), e.getPartialCost());
        } catch (Exception e) {
            log.warn("Row {} ('{}') failed, marking as FATAL_ERROR: {}", rowNumber, rawName, e.getMessage());
            return ResolvedRecord.fatalError(rawName, e);
        }
    }

    private void writeOutput(JobSettings runSettings, int resumeCursor) {
        List<ResolvedRecord> records = state.getRecords();
        if (records.isEmpty()) {
            log.info("No records to write for job {}", jobId);
            return;
        }
        // Records restored from the checkpoint start before the resume cursor
        int actualStart = Math.max(runSettings.getStartRow(), resumeCursor - state.getRestoredCount());
        outputReconciler.reconcile(runSettings, records, actualStart);
    }

    private void saveCheckpoint(JobSettings runSettings) {
        checkpointStore.save(state.toCheckpoint(runSettings));
        metrics.getCheckpointsWritten().increment();
    }

    private void persistAfterFailure() {
        JobSettings runSettings = activeSettings;
        if (runSettings == null || state.getLastProcessedRow() == 0) {
            return;
        }
        try {
            saveCheckpoint(runSettings);
        } catch (CheckpointException e) {
            log.error("Could not persist checkpoint after failure of job {}", jobId, e);
        }
    }

    private void notifyCompletion(String message) {
        try {
            completionListener.onCompletion(message);
        } catch (RuntimeException e) {
            log.error("Completion listener of job {} failed", jobId, e);
        }
    }
}
