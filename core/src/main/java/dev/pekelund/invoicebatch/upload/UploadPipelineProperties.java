package dev.pekelund.invoicebatch.upload;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "invoice.upload")
public class UploadPipelineProperties {

    /**
     * Maximum number of files of one batch that are in flight at the same time.
     */
    private int concurrency = 3;

    /**
     * Pause between two dispatch windows of a batch.
     */
    private Duration windowPause = Duration.ofMillis(500);

    /**
     * Maximum number of files accepted in a single batch.
     */
    private int maxFileCount = 20;

    /**
     * Files larger than this are rejected before they are uploaded.
     */
    private DataSize maxFileSize = DataSize.ofMegabytes(10);

    /**
     * Lowercase file extensions accepted for upload.
     */
    private List<String> supportedExtensions = new ArrayList<>(List.of("pdf", "jpg", "jpeg", "png"));

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public Duration getWindowPause() {
        return windowPause;
    }

    public void setWindowPause(Duration windowPause) {
        this.windowPause = windowPause;
    }

    public int getMaxFileCount() {
        return maxFileCount;
    }

    public void setMaxFileCount(int maxFileCount) {
        this.maxFileCount = maxFileCount;
    }

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public List<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    public void setSupportedExtensions(List<String> supportedExtensions) {
        this.supportedExtensions = supportedExtensions;
    }
}
