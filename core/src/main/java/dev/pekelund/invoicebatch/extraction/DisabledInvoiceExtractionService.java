package dev.pekelund.invoicebatch.extraction;

import dev.pekelund.invoicebatch.invoice.ExtractedInvoice;
import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.upload.InvoiceExtractionService;
import dev.pekelund.invoicebatch.upload.StoredObject;

/**
 * Used when no extraction service is configured. Every file fails in the processing stage.
 */
public class DisabledInvoiceExtractionService implements InvoiceExtractionService {

    @Override
    public ExtractedInvoice extract(StoredObject storedObject, InvoiceOwner owner) {
        throw new InvoiceExtractionException("Invoice extraction is disabled; set invoice.extraction.base-url");
    }
}
