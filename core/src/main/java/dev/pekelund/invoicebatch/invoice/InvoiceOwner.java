package dev.pekelund.invoicebatch.invoice;

import java.util.HashMap;
import java.util.Map;

/**
 * Account that owns an uploaded invoice. Blank values are normalised to {@code null} so that
 * owners read back from storage metadata compare the same as owners built from a session.
 */
public record InvoiceOwner(String id, String displayName, String email) {

    public static final String METADATA_OWNER_ID = "invoice.owner.id";
    public static final String METADATA_OWNER_DISPLAY_NAME = "invoice.owner.displayName";
    public static final String METADATA_OWNER_EMAIL = "invoice.owner.email";

    public InvoiceOwner {
        id = normalize(id);
        displayName = normalize(displayName);
        email = normalize(email);
    }

    public boolean hasValues() {
        return id != null || displayName != null || email != null;
    }

    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new HashMap<>();
        if (id != null) {
            metadata.put(METADATA_OWNER_ID, id);
        }
        if (displayName != null) {
            metadata.put(METADATA_OWNER_DISPLAY_NAME, displayName);
        }
        if (email != null) {
            metadata.put(METADATA_OWNER_EMAIL, email);
        }
        return metadata;
    }

    public Map<String, String> toAttributes() {
        Map<String, String> attributes = new HashMap<>();
        if (id != null) {
            attributes.put("id", id);
        }
        if (displayName != null) {
            attributes.put("displayName", displayName);
        }
        if (email != null) {
            attributes.put("email", email);
        }
        return attributes;
    }

    public static InvoiceOwner fromMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }

        InvoiceOwner owner = new InvoiceOwner(
            metadata.get(METADATA_OWNER_ID),
            metadata.get(METADATA_OWNER_DISPLAY_NAME),
            metadata.get(METADATA_OWNER_EMAIL));
        return owner.hasValues() ? owner : null;
    }

    public static InvoiceOwner fromAttributes(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return null;
        }

        InvoiceOwner owner = new InvoiceOwner(
            stringValue(attributes.get("id")),
            stringValue(attributes.get("displayName")),
            stringValue(attributes.get("email")));
        return owner.hasValues() ? owner : null;
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
