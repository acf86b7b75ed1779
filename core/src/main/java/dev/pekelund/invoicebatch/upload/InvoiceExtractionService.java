package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.ExtractedInvoice;
import dev.pekelund.invoicebatch.invoice.InvoiceOwner;

/**
 * OCR and classification of an uploaded invoice file.
 */
@FunctionalInterface
public interface InvoiceExtractionService {

    ExtractedInvoice extract(StoredObject storedObject, InvoiceOwner owner);
}
