package dev.pekelund.invoicebatch.upload;

import java.util.Collection;

/**
 * Counts derived from the results of a batch. Files that were never scheduled because the batch
 * was cancelled are counted separately so that success, duplicate and failure always add up to
 * the attempted files.
 */
public record BatchSummary(
    int totalCount,
    int successCount,
    int duplicateCount,
    int failureCount,
    int cancelledCount,
    boolean hasCrossUserDuplicate
) {

    public static BatchSummary of(Collection<UploadResult> results, int cancelledCount) {
        int success = 0;
        int duplicate = 0;
        int failure = 0;
        boolean crossUser = false;
        for (UploadResult result : results) {
            if (result.isSuccess()) {
                success++;
            } else if (result.isDuplicate()) {
                duplicate++;
                crossUser |= result.crossUserDuplicateInfo().isPresent();
            } else {
                failure++;
            }
        }
        return new BatchSummary(results.size() + cancelledCount, success, duplicate, failure, cancelledCount, crossUser);
    }

    public int attemptedCount() {
        return successCount + duplicateCount + failureCount;
    }

    public boolean isAllSuccessful() {
        return totalCount > 0 && successCount == totalCount;
    }
}
