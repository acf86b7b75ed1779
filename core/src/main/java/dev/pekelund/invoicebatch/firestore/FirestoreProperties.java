package dev.pekelund.invoicebatch.firestore;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "firestore")
public class FirestoreProperties {

    /**
     * Flag indicating whether Firestore integration is enabled.
     */
    private boolean enabled;

    /**
     * Path or resource descriptor to the service account credentials file.
     */
    private String credentials;

    /**
     * Optional Google Cloud project identifier.
     */
    private String projectId;

    /**
     * Optional Firestore database id; the default database is used when omitted.
     */
    private String databaseId;

    /**
     * Optional host:port of the Firestore emulator.
     */
    private String emulatorHost;

    /**
     * Firestore collection used to persist invoices.
     */
    private String invoicesCollection = "invoices";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

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

    public String getDatabaseId() {
        return databaseId;
    }

    public void setDatabaseId(String databaseId) {
        this.databaseId = databaseId;
    }

    public String getEmulatorHost() {
        return emulatorHost;
    }

    public void setEmulatorHost(String emulatorHost) {
        this.emulatorHost = emulatorHost;
    }

    public String getInvoicesCollection() {
        return invoicesCollection;
    }

    public void setInvoicesCollection(String invoicesCollection) {
        this.invoicesCollection = invoicesCollection;
    }
}
