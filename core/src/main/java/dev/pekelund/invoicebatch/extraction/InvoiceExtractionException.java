package dev.pekelund.invoicebatch.extraction;

import dev.pekelund.invoicebatch.upload.UploadErrorCategory;
import dev.pekelund.invoicebatch.upload.UploadStageException;

public class InvoiceExtractionException extends UploadStageException {

    public InvoiceExtractionException(String message) {
        super(message, UploadErrorCategory.EXTRACTION_FAILURE);
    }

    public InvoiceExtractionException(String message, Throwable cause) {
        super(message, UploadErrorCategory.EXTRACTION_FAILURE, cause);
    }

    public InvoiceExtractionException(String message, UploadErrorCategory category, Throwable cause) {
        super(message, category, cause);
    }
}
