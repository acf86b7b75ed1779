package dev.pekelund.invoicebatch.storage;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.upload.DuplicateLookupService;
import dev.pekelund.invoicebatch.upload.DuplicateVerdict;
import dev.pekelund.invoicebatch.upload.InvoiceFileStore;
import dev.pekelund.invoicebatch.upload.StoreRequest;
import dev.pekelund.invoicebatch.upload.StoredObject;
import dev.pekelund.invoicebatch.upload.TransferListener;

/**
 * Used when {@code gcs.enabled} is off. Nothing is ever stored, so nothing is ever a duplicate.
 */
public class DisabledInvoiceStorageService implements InvoiceFileStore, DuplicateLookupService {

    @Override
    public StoredObject store(StoreRequest request, TransferListener listener) {
        throw new InvoiceStorageException("Google Cloud Storage integration is disabled");
    }

    @Override
    public DuplicateVerdict lookup(String fingerprint, InvoiceOwner owner) {
        return DuplicateVerdict.none();
    }
}
