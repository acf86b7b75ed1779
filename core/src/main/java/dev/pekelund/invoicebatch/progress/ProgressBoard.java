package dev.pekelund.invoicebatch.progress;

import dev.pekelund.invoicebatch.optimistic.RollbackNotification;
import dev.pekelund.invoicebatch.upload.BatchProgress;
import dev.pekelund.invoicebatch.upload.BatchUploadReport;
import dev.pekelund.invoicebatch.upload.UploadProgress;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory projection of the latest upload and rollback events, for views that poll instead of
 * subscribing.
 */
public class ProgressBoard implements ProgressReporter {

    static final int DEFAULT_ROLLBACK_HISTORY = 50;

    private final Map<String, UploadProgress> files = new ConcurrentHashMap<>();
    private final Map<String, BatchProgress> batches = new ConcurrentHashMap<>();
    private final Map<String, BatchUploadReport> reports = new ConcurrentHashMap<>();
    private final Deque<RollbackNotification> rollbacks = new ArrayDeque<>();
    private final int rollbackHistory;
    private final AtomicReference<BatchUploadReport> lastReport = new AtomicReference<>();

    public ProgressBoard() {
        this(DEFAULT_ROLLBACK_HISTORY);
    }

    public ProgressBoard(int rollbackHistory) {
        this.rollbackHistory = Math.max(1, rollbackHistory);
    }

    @Override
    public void onFileProgress(UploadProgress progress) {
        files.put(progress.filePath(), progress);
    }

    @Override
    public void onBatchProgress(BatchProgress progress) {
        batches.merge(progress.batchId(), progress,
            (previous, next) -> next.completedCount() >= previous.completedCount() ? next : previous);
    }

    @Override
    public void onBatchCompleted(BatchUploadReport report) {
        reports.put(report.batchId(), report);
        lastReport.set(report);
    }

    @Override
    public void onRollback(RollbackNotification notification) {
        synchronized (rollbacks) {
            rollbacks.addFirst(notification);
            while (rollbacks.size() > rollbackHistory) {
                rollbacks.removeLast();
            }
        }
    }

    public Optional<UploadProgress> fileProgress(String filePath) {
        return Optional.ofNullable(files.get(filePath));
    }

    public Map<String, UploadProgress> fileProgress() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public Optional<BatchProgress> batchProgress(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    public Optional<BatchUploadReport> report(String batchId) {
        return Optional.ofNullable(reports.get(batchId));
    }

    public Optional<BatchUploadReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    /**
     * Most recent rollbacks first.
     */
    public List<RollbackNotification> recentRollbacks() {
        synchronized (rollbacks) {
            return List.copyOf(rollbacks);
        }
    }

    public Optional<RollbackNotification> lastRollback(String entityId) {
        synchronized (rollbacks) {
            return rollbacks.stream().filter(notification -> notification.entityId().equals(entityId)).findFirst();
        }
    }

    /**
     * Forget everything recorded for a finished batch once its view has been dismissed.
     */
    public void dismiss(BatchUploadReport report) {
        report.results().forEach(result -> files.remove(result.filePath()));
        report.cancelledFiles().forEach(files::remove);
        batches.remove(report.batchId());
        reports.remove(report.batchId());
        lastReport.compareAndSet(report, null);
    }
}
