package dev.pekelund.invoicebatch.extraction;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "invoice.extraction")
public class ExtractionProperties {

    /**
     * Flag indicating whether uploaded invoices are sent to the extraction service.
     */
    private boolean enabled = true;

    /**
     * Base URL of the OCR extraction service.
     */
    private String baseUrl;

    /**
     * Path of the extraction endpoint on the service.
     */
    private String extractPath = "/v1/invoices/extract";

    /**
     * Whether to attach an ID token to each request for service-to-service authentication.
     */
    private boolean useIdToken;

    /**
     * Optional audience to include when minting the ID token. Defaults to the base URL.
     */
    private String audience;

    /**
     * HTTP connect timeout used when calling the extraction service.
     */
    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * HTTP read timeout used when calling the extraction service.
     */
    private Duration readTimeout = Duration.ofSeconds(60);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getExtractPath() {
        return extractPath;
    }

    public void setExtractPath(String extractPath) {
        this.extractPath = extractPath;
    }

    public boolean isUseIdToken() {
        return useIdToken;
    }

    public void setUseIdToken(boolean useIdToken) {
        this.useIdToken = useIdToken;
    }

    public String getAudience() {
        return audience;
    }

    public void setAudience(String audience) {
        this.audience = audience;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public boolean isConfigured() {
        return enabled && StringUtils.hasText(baseUrl);
    }
}
