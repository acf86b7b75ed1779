package dev.pekelund.invoicebatch.upload;

import java.util.Objects;

/**
 * Snapshot of one file's position in the upload pipeline. A new snapshot is published on
 * every stage change and every progress update; {@code filePath} is the stable identity key.
 *
 * @param progress fraction complete within the current stage, informational only
 */
public record UploadProgress(
    String fileName,
    String filePath,
    UploadStage stage,
    double progress,
    String message,
    String error
) {

    public UploadProgress {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(stage, "stage");
        progress = clamp(progress);
    }

    public static UploadProgress preparing(String fileName, String filePath) {
        return new UploadProgress(fileName, filePath, UploadStage.PREPARING, 0.0,
            UploadStage.PREPARING.displayName(), null);
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    public String statusText() {
        if (error != null) {
            return error;
        }
        return message != null ? message : stage.displayName();
    }

    UploadProgress withProgress(double value, String newMessage) {
        return new UploadProgress(fileName, filePath, stage, value, newMessage != null ? newMessage : message, error);
    }

    UploadProgress enter(UploadStage next, String newMessage, String newError) {
        double initial = next.isTerminal() ? 1.0 : 0.0;
        return new UploadProgress(fileName, filePath, next, initial,
            newMessage != null ? newMessage : next.displayName(), newError);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
