package dev.pekelund.invoicebatch.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bucket settings for invoice uploads. {@code gcs.enabled} switches the bucket adapter on and is
 * read by the configuration conditions, not bound here.
 */
@ConfigurationProperties(prefix = "gcs")
public class GcsProperties {

    public static final String DEFAULT_HASH_INDEX_PREFIX = ".invoice-hashes/";

    /**
     * Optional path or resource string that resolves to the service account credentials file.
     * When omitted, application default credentials will be used.
     */
    private String credentials;

    /**
     * Optional Google Cloud project identifier used when building the storage client.
     */
    private String projectId;

    /**
     * Name of the bucket that stores uploaded invoice files and the content-hash index.
     */
    private String bucket;

    /**
     * Object name prefix under which the content-hash index entries are written.
     */
    private String hashIndexPrefix = DEFAULT_HASH_INDEX_PREFIX;

    /**
     * Longest original file name kept in an object name; longer names are shortened around the
     * extension.
     */
    private int maxObjectNameLength = 60;

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getHashIndexPrefix() {
        return hashIndexPrefix;
    }

    public void setHashIndexPrefix(String hashIndexPrefix) {
        this.hashIndexPrefix = hashIndexPrefix;
    }

    public int getMaxObjectNameLength() {
        return maxObjectNameLength;
    }

    public void setMaxObjectNameLength(int maxObjectNameLength) {
        this.maxObjectNameLength = maxObjectNameLength;
    }
}
