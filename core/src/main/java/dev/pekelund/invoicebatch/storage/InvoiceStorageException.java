package dev.pekelund.invoicebatch.storage;

import dev.pekelund.invoicebatch.upload.UploadErrorCategory;
import dev.pekelund.invoicebatch.upload.UploadStageException;

public class InvoiceStorageException extends UploadStageException {

    public InvoiceStorageException(String message) {
        super(message);
    }

    public InvoiceStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvoiceStorageException(String message, UploadErrorCategory category, Throwable cause) {
        super(message, category, cause);
    }
}
