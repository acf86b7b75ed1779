package dev.pekelund.invoicebatch.invoice;

/**
 * Reimbursement state of a single invoice.
 */
public enum InvoiceStatus {

    /**
     * The invoice has been recorded but not yet paid back to its owner.
     */
    UNREIMBURSED,

    /**
     * The invoice has been reimbursed.
     */
    REIMBURSED;

    public static InvoiceStatus fromValue(String value) {
        if (value == null) {
            return UNREIMBURSED;
        }
        for (InvoiceStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return UNREIMBURSED;
    }
}
