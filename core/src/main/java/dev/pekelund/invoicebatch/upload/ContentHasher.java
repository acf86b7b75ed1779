package dev.pekelund.invoicebatch.upload;

/**
 * Computes the content fingerprint used for duplicate detection.
 */
@FunctionalInterface
public interface ContentHasher {

    /**
     * @return lowercase hex digest of {@code content}; identical bytes always give the same value
     */
    String hash(byte[] content);
}
