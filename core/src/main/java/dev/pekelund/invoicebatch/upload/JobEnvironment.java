package dev.pekelund.invoicebatch.upload;

import dev.pekelund.invoicebatch.invoice.InvoiceOwner;

/**
 * Batch-scoped state shared by the jobs of one batch.
 */
interface JobEnvironment {

    String batchId();

    InvoiceOwner owner();

    boolean isCancelled();

    /**
     * Claim a fingerprint for {@code filePath}.
     *
     * @return the path of the file that claimed the fingerprint earlier in this batch, or
     *         {@code null} if the claim succeeded
     */
    String claimFingerprint(String fingerprint, String filePath);

    void publish(UploadProgress progress);
}
