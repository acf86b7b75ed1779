package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import java.util.Objects;

/**
 * Terminal classification of a single file.
 */
public sealed interface UploadOutcome {

    UploadStage stage();

    record Success(InvoiceRef invoice) implements UploadOutcome {

        public Success {
            Objects.requireNonNull(invoice, "invoice");
        }

        @Override
        public UploadStage stage() {
            return UploadStage.SUCCESS;
        }
    }

    /**
     * The content is already stored for the uploading account. Both fields are {@code null} when
     * the earlier copy was selected in the same batch and has not been persisted yet.
     */
    record Duplicate(String existingObjectName, String existingInvoiceId) implements UploadOutcome {

        @Override
        public UploadStage stage() {
            return UploadStage.DUPLICATE;
        }
    }

    record CrossUserDuplicate(CrossUserDuplicateInfo info) implements UploadOutcome {

        public CrossUserDuplicate {
            Objects.requireNonNull(info, "info");
        }

        @Override
        public UploadStage stage() {
            return UploadStage.DUPLICATE;
        }
    }

    record Failed(UploadFailureKind kind, UploadErrorCategory category, String message) implements UploadOutcome {

        public Failed {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(category, "category");
            message = message != null ? message : category.displayMessage();
        }

        public Failed(UploadFailureKind kind, UploadErrorCategory category) {
            this(kind, category, category.displayMessage());
        }

        @Override
        public UploadStage stage() {
            return UploadStage.ERROR;
        }
    }
}
