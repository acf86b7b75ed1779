package dev.pekelund.invoicebatch.upload;

/**
 * Ordered lifecycle of a single file in a batch upload. {@link #SUCCESS}, {@link #DUPLICATE}
 * and {@link #ERROR} are terminal.
 */
public enum UploadStage {

    PREPARING("Preparing"),
    HASHING("Calculating fingerprint"),
    UPLOADING("Uploading"),
    PROCESSING("Extracting invoice data"),
    SUCCESS("Uploaded"),
    DUPLICATE("Already uploaded"),
    ERROR("Failed");

    private final String displayName;

    UploadStage(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == DUPLICATE || this == ERROR;
    }

    /**
     * Whether a job currently in this stage may move directly to {@code next}. Stages are never
     * skipped and terminal stages accept no transition.
     */
    public boolean canTransitionTo(UploadStage next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PREPARING -> next == HASHING;
            case HASHING -> next == DUPLICATE || next == UPLOADING || next == ERROR;
            case UPLOADING -> next == PROCESSING || next == ERROR;
            case PROCESSING -> next == SUCCESS || next == ERROR;
            case SUCCESS, DUPLICATE, ERROR -> false;
        };
    }
}
