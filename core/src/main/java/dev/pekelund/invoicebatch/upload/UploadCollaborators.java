package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceRepository;
import java.util.Objects;

/**
 * External services an upload job talks to.
 */
public record UploadCollaborators(
    ContentHasher contentHasher,
    DuplicateClassifier duplicateClassifier,
    InvoiceFileStore fileStore,
    InvoiceExtractionService extractionService,
    InvoiceRepository invoiceRepository
) {

    public UploadCollaborators {
        Objects.requireNonNull(contentHasher, "contentHasher");
        Objects.requireNonNull(duplicateClassifier, "duplicateClassifier");
        Objects.requireNonNull(fileStore, "fileStore");
        Objects.requireNonNull(extractionService, "extractionService");
        Objects.requireNonNull(invoiceRepository, "invoiceRepository");
    }
}
