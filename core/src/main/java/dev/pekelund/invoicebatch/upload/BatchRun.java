package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable state of one running batch. Written by the dispatcher and by worker threads.
 */
final class BatchRun implements JobEnvironment {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRun.class);

    private final String batchId;
    private final InvoiceOwner owner;
    private final List<Path> files;
    private final List<UploadProgressListener> listeners;
    private final Clock clock;
    private final Instant startedAt;

    private final Queue<Path> queue;
    private final Map<String, UploadProgress> progress = new ConcurrentHashMap<>();
    private final Map<String, String> fingerprintClaims = new ConcurrentHashMap<>();
    private final Map<String, UploadResult> results = new ConcurrentHashMap<>();
    private final Set<String> completedFiles = ConcurrentHashMap.newKeySet();
    private final AtomicInteger completedCount = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<BatchUploadReport> completion = new CompletableFuture<>();

    BatchRun(String batchId, InvoiceOwner owner, List<Path> files, List<UploadProgressListener> listeners,
        Clock clock) {
        this.batchId = batchId;
        this.owner = owner;
        this.files = List.copyOf(files);
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
        this.startedAt = clock.instant();
        this.queue = new ConcurrentLinkedQueue<>(this.files);
    }

    @Override
    public String batchId() {
        return batchId;
    }

    @Override
    public InvoiceOwner owner() {
        return owner;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    @Override
    public String claimFingerprint(String fingerprint, String filePath) {
        String existing = fingerprintClaims.putIfAbsent(fingerprint, filePath);
        if (existing == null || existing.equals(filePath)) {
            return null;
        }
        return existing;
    }

    @Override
    public void publish(UploadProgress snapshot) {
        progress.put(snapshot.filePath(), snapshot);
        notifyListeners(listener -> listener.onFileProgress(snapshot));
        if (snapshot.isTerminal() && completedFiles.add(snapshot.filePath())) {
            BatchProgress batchProgress = new BatchProgress(batchId, completedCount.incrementAndGet(), files.size());
            notifyListeners(listener -> listener.onBatchProgress(batchProgress));
        }
    }

    List<Path> nextWindow(int size) {
        List<Path> window = new ArrayList<>(size);
        while (window.size() < size) {
            Path next = queue.poll();
            if (next == null) {
                break;
            }
            window.add(next);
        }
        return window;
    }

    boolean hasQueuedFiles() {
        return !queue.isEmpty();
    }

    /**
     * Store the terminal result of a job. Results of jobs that died without publishing a
     * terminal stage get a terminal snapshot here so every attempted file is counted.
     */
    void record(UploadResult result) {
        results.put(result.filePath(), result);
        if (!completedFiles.contains(result.filePath())) {
            String error = result.outcome() instanceof UploadOutcome.Failed failed ? failed.message() : null;
            publish(new UploadProgress(result.fileName(), result.filePath(), result.stage(), 1.0, null, error));
        }
    }

    BatchUploadReport complete() {
        List<UploadResult> ordered = new ArrayList<>();
        List<String> cancelledFiles = new ArrayList<>();
        for (Path file : files) {
            UploadResult result = results.get(file.toString());
            if (result != null) {
                ordered.add(result);
            } else {
                cancelledFiles.add(file.toString());
            }
        }
        BatchUploadReport report = BatchUploadReport.of(batchId, ordered, cancelledFiles, startedAt, clock.instant());
        notifyListeners(listener -> listener.onBatchCompleted(report));
        completion.complete(report);
        return report;
    }

    void completeExceptionally(Throwable error) {
        completion.completeExceptionally(error);
    }

    CompletableFuture<BatchUploadReport> completion() {
        return completion;
    }

    Map<String, UploadProgress> progressSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(progress));
    }

    int completedCount() {
        return completedCount.get();
    }

    int totalCount() {
        return files.size();
    }

    List<String> pendingFiles() {
        return queue.stream().map(Path::toString).toList();
    }

    private void notifyListeners(Consumer<UploadProgressListener> notification) {
        for (UploadProgressListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException ex) {
                LOGGER.warn("Upload progress listener {} failed for batch {}", listener.getClass().getName(), batchId, ex);
            }
        }
    }
}
