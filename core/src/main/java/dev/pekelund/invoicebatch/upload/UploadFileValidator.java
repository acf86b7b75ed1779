package dev.pekelund.invoicebatch.upload;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Batch and file level checks applied before anything is uploaded.
 */
public class UploadFileValidator {

    private final UploadPipelineProperties properties;

    public UploadFileValidator(UploadPipelineProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Normalise the selection to absolute paths, collapsing repeats while keeping the order.
     *
     * @throws BatchValidationException if the selection is empty or too large
     */
    public List<Path> validateBatch(List<Path> files) {
        if (files == null || files.isEmpty()) {
            throw new BatchValidationException("Select at least one file to upload");
        }

        Set<Path> unique = new LinkedHashSet<>();
        for (Path file : files) {
            if (file != null) {
                unique.add(file.toAbsolutePath().normalize());
            }
        }
        if (unique.isEmpty()) {
            throw new BatchValidationException("Select at least one file to upload");
        }
        if (unique.size() > properties.getMaxFileCount()) {
            throw new BatchValidationException("A batch may contain at most %d files, got %d"
                .formatted(properties.getMaxFileCount(), unique.size()));
        }
        return new ArrayList<>(unique);
    }

    /**
     * @throws UploadStageException carrying the category that explains the rejection
     */
    public void validateFile(String fileName, long size) {
        String extension = extensionOf(fileName);
        if (extension == null || !supportedExtensions().contains(extension)) {
            throw new UploadStageException("Unsupported file type: " + fileName, UploadErrorCategory.UNSUPPORTED_FORMAT);
        }
        if (size <= 0) {
            throw new UploadStageException("File is empty: " + fileName, UploadErrorCategory.UNSUPPORTED_FORMAT);
        }
        long maxBytes = properties.getMaxFileSize().toBytes();
        if (size > maxBytes) {
            throw new UploadStageException("File %s is %d bytes, limit is %d".formatted(fileName, size, maxBytes),
                UploadErrorCategory.FILE_TOO_LARGE);
        }
    }

    static String extensionOf(String fileName) {
        String extension = StringUtils.getFilenameExtension(fileName);
        return StringUtils.hasText(extension) ? extension.toLowerCase(Locale.ROOT) : null;
    }

    static String contentTypeOf(String fileName) {
        String extension = extensionOf(fileName);
        if (extension == null) {
            return "application/octet-stream";
        }
        return switch (extension) {
            case "pdf" -> "application/pdf";
            case "jpg", "jpeg" -> "image/jpeg";
            case "png" -> "image/png";
            default -> "application/octet-stream";
        };
    }

    private Set<String> supportedExtensions() {
        Set<String> extensions = new LinkedHashSet<>();
        for (String extension : properties.getSupportedExtensions()) {
            if (StringUtils.hasText(extension)) {
                extensions.add(extension.trim().toLowerCase(Locale.ROOT));
            }
        }
        return extensions;
    }
}
