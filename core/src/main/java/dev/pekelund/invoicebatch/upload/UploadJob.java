package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.ExtractedInvoice;
import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import dev.pekelund.invoicebatch.invoice.NewInvoice;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one file through hashing, duplicate check, upload, extraction and persistence. A job
 * runs once; retrying a file means running a new job for it.
 */
public class UploadJob {

    private static final Logger LOGGER = LoggerFactory.getLogger(UploadJob.class);

    private final UploadCollaborators collaborators;
    private final UploadFileValidator validator;
    private final JobEnvironment environment;
    private final Path file;
    private final String fileName;
    private final String filePath;

    private volatile UploadProgress current;

    UploadJob(UploadCollaborators collaborators, UploadFileValidator validator, JobEnvironment environment,
        Path file) {
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.file = Objects.requireNonNull(file, "file");
        Path name = file.getFileName();
        this.fileName = name != null ? name.toString() : file.toString();
        this.filePath = file.toString();
        this.current = UploadProgress.preparing(fileName, filePath);
    }

    public UploadProgress currentProgress() {
        return current;
    }

    /**
     * Run the job to a terminal stage.
     *
     * @return the terminal result, or {@code null} if the batch was cancelled before this job
     *     started, in which case nothing is published and the file is never touched
     */
    public UploadResult run() {
        try (UploadJobMdc.Context ignored = UploadJobMdc.open(environment.batchId())) {
            if (environment.isCancelled()) {
                LOGGER.debug("Batch cancelled before {} started", fileName);
                return null;
            }
            UploadJobMdc.attachFile(filePath);
            UploadJobMdc.attachOwner(environment.owner());
            UploadJobMdc.setStage(current.stage());
            environment.publish(current);
            return execute();
        }
    }

    private UploadResult execute() {
        InvoiceOwner owner = environment.owner();

        transition(UploadStage.HASHING, null, null);
        byte[] content;
        String fingerprint;
        try {
            long size = Files.size(file);
            validator.validateFile(fileName, size);
            content = Files.readAllBytes(file);
            advance(0.5, null);
            fingerprint = collaborators.contentHasher().hash(content);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Could not read or validate {}: {}", fileName, ex.getMessage());
            return fail(UploadFailureKind.HASH_FAILURE, ex, null);
        }
        advance(0.7, "Checking for duplicates");

        DuplicateVerdict verdict = collaborators.duplicateClassifier().classify(fingerprint, owner);
        if (verdict instanceof DuplicateVerdict.SameUserDuplicate duplicate) {
            LOGGER.info("{} has already been uploaded as {}", fileName, duplicate.existingObjectName());
            return finishDuplicate(fingerprint,
                new UploadOutcome.Duplicate(duplicate.existingObjectName(), duplicate.existingInvoiceId()),
                UploadErrorCategory.DUPLICATE.displayMessage());
        }
        if (verdict instanceof DuplicateVerdict.CrossUserDuplicate crossUser) {
            LOGGER.info("{} has already been uploaded by another account", fileName);
            return finishDuplicate(fingerprint, new UploadOutcome.CrossUserDuplicate(crossUser.info()),
                "This invoice has already been uploaded by another user");
        }

        String earlierClaim = environment.claimFingerprint(fingerprint, filePath);
        if (earlierClaim != null) {
            LOGGER.info("{} has the same content as {} in this batch", fileName, earlierClaim);
            return finishDuplicate(fingerprint, new UploadOutcome.Duplicate(null, null),
                "The same file was selected twice in this batch");
        }
        advance(1.0, null);

        if (environment.isCancelled()) {
            return cancelled(fingerprint);
        }
        transition(UploadStage.UPLOADING, null, null);
        StoredObject stored;
        try {
            stored = collaborators.fileStore().store(
                new StoreRequest(fileName, UploadFileValidator.contentTypeOf(fileName), content, fingerprint, owner),
                this::onTransferred);
        } catch (RuntimeException ex) {
            LOGGER.warn("Upload of {} failed: {}", fileName, ex.getMessage(), ex);
            return fail(UploadFailureKind.UPLOAD_TRANSPORT_FAILURE, ex, fingerprint);
        }
        advance(1.0, null);

        if (environment.isCancelled()) {
            discard(stored);
            return cancelled(fingerprint);
        }
        transition(UploadStage.PROCESSING, null, null);
        ExtractedInvoice extracted;
        try {
            extracted = collaborators.extractionService().extract(stored, owner);
        } catch (RuntimeException ex) {
            LOGGER.warn("Extraction of {} failed: {}", fileName, ex.getMessage(), ex);
            discard(stored);
            return fail(UploadFailureKind.EXTRACTION_FAILURE, ex, fingerprint);
        }
        advance(0.6, "Saving invoice");

        InvoiceRef invoice;
        try {
            invoice = collaborators.invoiceRepository().create(new NewInvoice(owner, extracted, fingerprint, stored.path()));
        } catch (RuntimeException ex) {
            LOGGER.warn("Saving invoice for {} failed: {}", fileName, ex.getMessage(), ex);
            discard(stored);
            return fail(UploadFailureKind.PERSIST_FAILURE, ex, fingerprint);
        }
        if (invoice == null) {
            LOGGER.warn("Invoice repository returned no reference for {}", fileName);
            discard(stored);
            return fail(UploadFailureKind.PERSIST_FAILURE, UploadErrorCategory.SERVER_ERROR, fingerprint);
        }

        try {
            collaborators.fileStore().linkInvoice(stored, invoice);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to link stored object {} to invoice {}", stored.objectName(), invoice.id(), ex);
        }

        transition(UploadStage.SUCCESS, "Invoice uploaded", null);
        LOGGER.info("Uploaded {} as invoice {}", fileName, invoice.id());
        return result(fingerprint, new UploadOutcome.Success(invoice));
    }

    private void discard(StoredObject stored) {
        try {
            collaborators.fileStore().discard(stored);
        } catch (RuntimeException ex) {
            LOGGER.warn("Could not discard stored object {} for {}; a retry may report it as a duplicate",
                stored.objectName(), fileName, ex);
        }
    }

    private void onTransferred(long transferredBytes, long totalBytes) {
        if (totalBytes > 0) {
            advance((double) transferredBytes / totalBytes, null);
        }
    }

    private UploadResult finishDuplicate(String fingerprint, UploadOutcome outcome, String message) {
        transition(UploadStage.DUPLICATE, message, null);
        return result(fingerprint, outcome);
    }

    private UploadResult cancelled(String fingerprint) {
        LOGGER.info("Batch cancelled; stopping {} in stage {}", fileName, current.stage());
        return fail(UploadFailureKind.CANCELLED_FAILURE, UploadErrorCategory.CANCELLED, fingerprint);
    }

    private UploadResult fail(UploadFailureKind kind, Throwable cause, String fingerprint) {
        UploadFailureKind resolvedKind = kind;
        if (kind != UploadFailureKind.HASH_FAILURE && UploadErrorClassifier.isTimeout(cause)) {
            resolvedKind = UploadFailureKind.TIMEOUT_FAILURE;
        }
        return fail(resolvedKind, UploadErrorClassifier.categorize(resolvedKind, cause), fingerprint);
    }

    private UploadResult fail(UploadFailureKind kind, UploadErrorCategory category, String fingerprint) {
        UploadOutcome.Failed outcome = new UploadOutcome.Failed(kind, category);
        transition(UploadStage.ERROR, null, outcome.message());
        return result(fingerprint, outcome);
    }

    private UploadResult result(String fingerprint, UploadOutcome outcome) {
        return new UploadResult(fileName, filePath, fingerprint, outcome);
    }

    private void transition(UploadStage next, String message, String error) {
        UploadStage stage = current.stage();
        if (!stage.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal upload stage transition " + stage + " -> " + next + " for " + fileName);
        }
        current = current.enter(next, message, error);
        UploadJobMdc.setStage(next);
        environment.publish(current);
    }

    private void advance(double progress, String message) {
        UploadProgress snapshot = current;
        if (snapshot.isTerminal() || progress < snapshot.progress()) {
            return;
        }
        current = snapshot.withProgress(progress, message);
        environment.publish(current);
    }
}
