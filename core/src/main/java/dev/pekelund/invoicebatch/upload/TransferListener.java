package dev.pekelund.invoicebatch.upload;

/**
 * Byte-level progress callback for a single upload.
 */
@FunctionalInterface
public interface TransferListener {

    TransferListener NONE = (transferred, total) -> { };

    void onTransferred(long transferredBytes, long totalBytes);
}
