package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal record for one file of a batch.
 *
 * @param fingerprint SHA-256 of the file content, {@code null} when hashing failed
 */
public record UploadResult(String fileName, String filePath, String fingerprint, UploadOutcome outcome) {

    public UploadResult {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(outcome, "outcome");
    }

    public UploadStage stage() {
        return outcome.stage();
    }

    public boolean isSuccess() {
        return outcome instanceof UploadOutcome.Success;
    }

    public boolean isDuplicate() {
        return outcome instanceof UploadOutcome.Duplicate || outcome instanceof UploadOutcome.CrossUserDuplicate;
    }

    public boolean isFailure() {
        return outcome instanceof UploadOutcome.Failed;
    }

    public Optional<InvoiceRef> invoice() {
        if (outcome instanceof UploadOutcome.Success success) {
            return Optional.of(success.invoice());
        }
        return Optional.empty();
    }

    public Optional<CrossUserDuplicateInfo> crossUserDuplicateInfo() {
        if (outcome instanceof UploadOutcome.CrossUserDuplicate duplicate) {
            return Optional.of(duplicate.info());
        }
        return Optional.empty();
    }

    public Optional<UploadErrorCategory> errorCategory() {
        if (outcome instanceof UploadOutcome.Failed failed) {
            return Optional.of(failed.category());
        }
        return Optional.empty();
    }

    /**
     * Only failures in a retryable category are offered a retry; duplicates never are.
     */
    public boolean isRetryable() {
        return outcome instanceof UploadOutcome.Failed failed && failed.category().isRetryable();
    }
}
