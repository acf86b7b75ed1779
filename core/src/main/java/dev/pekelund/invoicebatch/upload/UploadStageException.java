package dev.pekelund.invoicebatch.upload;

/**
 * Raised by pipeline collaborators when a stage cannot complete. Adapters that know why a
 * remote call failed attach a category hint, which takes precedence over message heuristics.
 */
public class UploadStageException extends RuntimeException {

    private final UploadErrorCategory category;

    public UploadStageException(String message) {
        this(message, (UploadErrorCategory) null);
    }

    public UploadStageException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public UploadStageException(String message, UploadErrorCategory category) {
        super(message);
        this.category = category;
    }

    public UploadStageException(String message, UploadErrorCategory category, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public UploadErrorCategory getCategory() {
        return category;
    }
}
