package dev.pekelund.invoicebatch.invoice;

import java.util.Objects;

/**
 * Request to persist a freshly extracted invoice.
 *
 * @param owner              account the invoice belongs to
 * @param extracted          fields produced by OCR extraction
 * @param contentFingerprint SHA-256 of the source file, {@code null} for manually created invoices
 * @param storedObjectPath   location of the source file, {@code null} for manually created invoices
 */
public record NewInvoice(
    InvoiceOwner owner,
    ExtractedInvoice extracted,
    String contentFingerprint,
    String storedObjectPath
) {

    public NewInvoice {
        Objects.requireNonNull(extracted, "extracted");
    }
}
