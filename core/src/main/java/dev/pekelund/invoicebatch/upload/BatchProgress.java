package dev.pekelund.invoicebatch.upload;

/**
 * Aggregate progress of a batch, published whenever a file reaches a terminal stage.
 */
public record BatchProgress(String batchId, int completedCount, int totalCount) {

    public double fraction() {
        return totalCount == 0 ? 1.0 : (double) completedCount / totalCount;
    }

    public boolean isComplete() {
        return completedCount >= totalCount;
    }
}
