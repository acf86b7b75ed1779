package dev.pekelund.invoicebatch.invoice;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured fields returned by the OCR extraction service for one invoice file.
 */
public record ExtractedInvoice(Map<String, Object> fields) {

    public static final String FIELD_INVOICE_NUMBER = "invoiceNumber";
    public static final String FIELD_SELLER_NAME = "sellerName";
    public static final String FIELD_TOTAL_AMOUNT = "totalAmount";

    public ExtractedInvoice {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public String invoiceNumber() {
        return text(FIELD_INVOICE_NUMBER);
    }

    public String sellerName() {
        return text(FIELD_SELLER_NAME);
    }

    public BigDecimal totalAmount() {
        Object value = fields.get(FIELD_TOTAL_AMOUNT);
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String string && !string.isBlank()) {
            try {
                return new BigDecimal(string.trim().replace(",", "."));
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private String text(String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
