package dev.pekelund.invoicebatch.upload;

/**
 * User-facing classification of a failed upload. The display message is what the UI shows;
 * the retry flag decides whether the file is offered a retry action.
 */
public enum UploadErrorCategory {

    NETWORK("Network connection problem. Check your connection and try again.", true),
    FILE_TOO_LARGE("The file is too large to upload.", false),
    UNSUPPORTED_FORMAT("The file format is not supported or the file is damaged.", false),
    SERVER_ERROR("The server is temporarily unavailable. Please try again later.", true),
    PERMISSION_DENIED("You do not have permission to upload this invoice.", false),
    DUPLICATE("This invoice has already been uploaded.", false),
    EXTRACTION_FAILURE("The invoice could not be read. Check that the file is a legible invoice.", false),
    CANCELLED("The upload was cancelled before it finished.", true),
    UNKNOWN("Upload failed. Please try again.", true);

    private final String displayMessage;
    private final boolean retryable;

    UploadErrorCategory(String displayMessage, boolean retryable) {
        this.displayMessage = displayMessage;
        this.retryable = retryable;
    }

    public String displayMessage() {
        return displayMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
