package dev.pekelund.invoicebatch.invoice;

public class InvoiceRepositoryException extends RuntimeException {

    public InvoiceRepositoryException(String message) {
        super(message);
    }

    public InvoiceRepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
