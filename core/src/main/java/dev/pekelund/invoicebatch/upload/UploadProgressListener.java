package dev.pekelund.invoicebatch.upload;

/**
 * Receives progress of running batches. Callbacks arrive on worker threads; implementations
 * must be thread-safe and should return quickly.
 */
public interface UploadProgressListener {

    UploadProgressListener NONE = new UploadProgressListener() {
    };

    default void onFileProgress(UploadProgress progress) {
    }

    default void onBatchProgress(BatchProgress progress) {
    }

    default void onBatchCompleted(BatchUploadReport report) {
    }
}
