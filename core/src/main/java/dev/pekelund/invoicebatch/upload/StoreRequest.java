package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import java.util.Objects;

/**
 * Content and identity of one file handed to the {@link InvoiceFileStore}.
 */
public record StoreRequest(String fileName, String contentType, byte[] content, String fingerprint,
    InvoiceOwner owner) {

    public StoreRequest {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(fingerprint, "fingerprint");
    }

    public long size() {
        return content.length;
    }
}
