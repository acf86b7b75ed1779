package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;

/**
 * Remote index of already stored content fingerprints.
 */
public interface DuplicateLookupService {

    /**
     * Look up earlier uploads of the same content. Matches owned by {@code owner} take precedence
     * over matches owned by other accounts.
     */
    DuplicateVerdict lookup(String fingerprint, InvoiceOwner owner);
}
