package dev.pekelund.invoicebatch.upload;

import java.util.Objects;

/**
 * Location of an uploaded invoice file.
 */
public record StoredObject(String bucket, String objectName, String fingerprint) {

    public StoredObject {
        Objects.requireNonNull(objectName, "objectName");
    }

    public String path() {
        return bucket != null ? bucket + "/" + objectName : objectName;
    }
}
