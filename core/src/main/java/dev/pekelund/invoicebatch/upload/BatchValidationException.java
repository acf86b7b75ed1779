package dev.pekelund.invoicebatch.upload;

/**
 * Thrown when a batch is rejected before any file is scheduled.
 */
public class BatchValidationException extends RuntimeException {

    public BatchValidationException(String message) {
        super(message);
    }
}
