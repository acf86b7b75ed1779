package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs batches of invoice files through the upload pipeline.
 *
 * <p>Files of a batch are dispatched in windows of at most {@code concurrency} jobs. A window is
 * drained completely before the next one starts, so no more than {@code concurrency} files of a
 * batch are ever in flight. One failing file never affects its siblings and every batch ends
 * with a {@link BatchUploadReport}.
 */
public class BatchUploadOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchUploadOrchestrator.class);

    private final UploadCollaborators collaborators;
    private final UploadPipelineProperties properties;
    private final UploadFileValidator validator;
    private final Executor workerExecutor;
    private final Executor dispatchExecutor;
    private final UploadProgressListener defaultListener;
    private final Clock clock;

    public BatchUploadOrchestrator(UploadCollaborators collaborators, UploadPipelineProperties properties,
        Executor workerExecutor, Executor dispatchExecutor, UploadProgressListener defaultListener) {
        this(collaborators, properties, workerExecutor, dispatchExecutor, defaultListener, Clock.systemUTC());
    }

    public BatchUploadOrchestrator(UploadCollaborators collaborators, UploadPipelineProperties properties,
        Executor workerExecutor, Executor dispatchExecutor, UploadProgressListener defaultListener, Clock clock) {
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.validator = new UploadFileValidator(properties);
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.defaultListener = defaultListener != null ? defaultListener : UploadProgressListener.NONE;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BatchUploadHandle submit(List<Path> files, InvoiceOwner owner) {
        return submit(files, owner, null);
    }

    /**
     * Validate the selection and start the batch in the background.
     *
     * @throws BatchValidationException if the selection is empty or exceeds the file limit
     */
    public BatchUploadHandle submit(List<Path> files, InvoiceOwner owner, UploadProgressListener listener) {
        List<Path> batch = validator.validateBatch(files);
        List<UploadProgressListener> listeners = new ArrayList<>();
        listeners.add(defaultListener);
        if (listener != null && listener != defaultListener) {
            listeners.add(listener);
        }

        BatchRun run = new BatchRun(UUID.randomUUID().toString(), owner, batch, listeners, clock);
        dispatchExecutor.execute(() -> dispatch(run));
        return new BatchUploadHandle(run);
    }

    public BatchUploadReport run(List<Path> files, InvoiceOwner owner) {
        return run(files, owner, null);
    }

    /**
     * Blocking variant of {@link #submit(List, InvoiceOwner, UploadProgressListener)}.
     */
    public BatchUploadReport run(List<Path> files, InvoiceOwner owner, UploadProgressListener listener) {
        return submit(files, owner, listener).completion().join();
    }

    public BatchUploadHandle retry(BatchUploadReport previous, Collection<String> filePaths, InvoiceOwner owner) {
        return retry(previous, filePaths, owner, null);
    }

    /**
     * Start a new batch for the retryable failures of {@code previous}. An empty or {@code null}
     * selection retries every retryable failure; selected files that did not fail in a retryable
     * way are ignored.
     *
     * @throws BatchValidationException if nothing in the selection can be retried
     */
    public BatchUploadHandle retry(BatchUploadReport previous, Collection<String> filePaths, InvoiceOwner owner,
        UploadProgressListener listener) {
        Objects.requireNonNull(previous, "previous");
        Set<String> selection = filePaths != null ? new HashSet<>(filePaths) : Set.of();

        List<Path> retryable = previous.retryableResults().stream()
            .filter(result -> selection.isEmpty() || selection.contains(result.filePath()))
            .map(result -> Path.of(result.filePath()))
            .toList();
        if (retryable.isEmpty()) {
            throw new BatchValidationException("No retryable files selected in batch " + previous.batchId());
        }

        LOGGER.info("Retrying {} file(s) from batch {}", retryable.size(), previous.batchId());
        return submit(retryable, owner, listener);
    }

    private void dispatch(BatchRun run) {
        try (UploadJobMdc.Context ignored = UploadJobMdc.open(run.batchId())) {
            UploadJobMdc.attachOwner(run.owner());
            int windowSize = Math.max(1, properties.getConcurrency());
            LOGGER.info("Starting batch {} with {} file(s), concurrency {}", run.batchId(), run.totalCount(),
                windowSize);

            while (!run.isCancelled()) {
                List<Path> window = run.nextWindow(windowSize);
                if (window.isEmpty()) {
                    break;
                }

                List<CompletableFuture<UploadResult>> futures = new ArrayList<>(window.size());
                for (Path file : window) {
                    futures.add(schedule(run, new UploadJob(collaborators, validator, run, file)));
                }
                CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
                for (CompletableFuture<UploadResult> future : futures) {
                    UploadResult result = future.join();
                    if (result != null) {
                        run.record(result);
                    }
                }

                if (run.hasQueuedFiles() && !run.isCancelled()) {
                    pauseBetweenWindows(run);
                }
            }

            BatchUploadReport report = run.complete();
            BatchSummary summary = report.summary();
            LOGGER.info("Batch {} finished: {} succeeded, {} duplicate(s), {} failed, {} cancelled",
                run.batchId(), summary.successCount(), summary.duplicateCount(), summary.failureCount(),
                summary.cancelledCount());
        } catch (RuntimeException ex) {
            LOGGER.error("Dispatch of batch {} failed", run.batchId(), ex);
            run.completeExceptionally(ex);
        }
    }

    private CompletableFuture<UploadResult> schedule(BatchRun run, UploadJob job) {
        CompletableFuture<UploadResult> future;
        try {
            future = CompletableFuture.supplyAsync(job::run, workerExecutor);
        } catch (RejectedExecutionException ex) {
            future = CompletableFuture.failedFuture(ex);
        }
        return future.exceptionally(ex -> unexpectedFailure(run, job, ex));
    }

    private UploadResult unexpectedFailure(BatchRun run, UploadJob job, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        UploadProgress last = job.currentProgress();
        LOGGER.error("Upload job for {} in batch {} failed unexpectedly in stage {}", last.fileName(),
            run.batchId(), last.stage(), cause);
        UploadOutcome.Failed outcome =
            new UploadOutcome.Failed(UploadFailureKind.forStage(last.stage()), UploadErrorCategory.UNKNOWN);
        return new UploadResult(last.fileName(), last.filePath(), null, outcome);
    }

    private void pauseBetweenWindows(BatchRun run) {
        Duration pause = properties.getWindowPause();
        if (pause == null || pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Dispatcher of batch {} interrupted; cancelling remaining files", run.batchId());
            run.cancel();
        }
    }
}
