package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceRef;

/**
 * Remote object storage for invoice files.
 */
public interface InvoiceFileStore {

    /**
     * Upload the file and record its fingerprint so later lookups find it. Failures are reported
     * as {@link UploadStageException}, optionally carrying a category hint.
     */
    StoredObject store(StoreRequest request, TransferListener listener);

    /**
     * Associate a stored file with the invoice created from it.
     */
    default void linkInvoice(StoredObject storedObject, InvoiceRef invoice) {
    }

    /**
     * Remove a stored file that never became an invoice, together with its fingerprint record,
     * so a later upload of the same content is not reported as a duplicate.
     */
    default void discard(StoredObject storedObject) {
    }
}
