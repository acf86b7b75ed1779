package dev.pekelund.invoicebatch.upload;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of a submitted batch.
 */
public final class BatchUploadHandle {

    private final BatchRun run;

    BatchUploadHandle(BatchRun run) {
        this.run = run;
    }

    public String batchId() {
        return run.batchId();
    }

    /**
     * Request cooperative cancellation. Files not yet started are never attempted; files in
     * flight stop at their next stage boundary. Completed files are kept.
     *
     * @return {@code true} if this call cancelled the batch
     */
    public boolean cancel() {
        return run.cancel();
    }

    public boolean isCancelled() {
        return run.isCancelled();
    }

    /**
     * Completes with the report once every scheduled file is terminal.
     */
    public CompletableFuture<BatchUploadReport> completion() {
        return run.completion().copy();
    }

    /**
     * Latest progress per file path. Only files that have been scheduled appear.
     */
    public Map<String, UploadProgress> progress() {
        return run.progressSnapshot();
    }

    public int completedCount() {
        return run.completedCount();
    }

    public int totalCount() {
        return run.totalCount();
    }

    /**
     * Files of this batch that have not been scheduled yet.
     */
    public List<String> pendingFiles() {
        return run.pendingFiles();
    }
}
