package dev.pekelund.invoicebatch.upload;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Final outcome of a batch. Results follow submission order; {@code cancelledFiles} lists the
 * paths that were never started.
 */
public record BatchUploadReport(
    String batchId,
    BatchSummary summary,
    List<UploadResult> results,
    List<String> cancelledFiles,
    Instant startedAt,
    Instant completedAt
) {

    public BatchUploadReport {
        results = List.copyOf(results);
        cancelledFiles = cancelledFiles != null ? List.copyOf(cancelledFiles) : List.of();
    }

    public static BatchUploadReport of(String batchId, List<UploadResult> results, List<String> cancelledFiles,
        Instant startedAt, Instant completedAt) {
        int cancelled = cancelledFiles != null ? cancelledFiles.size() : 0;
        return new BatchUploadReport(batchId, BatchSummary.of(results, cancelled), results, cancelledFiles,
            startedAt, completedAt);
    }

    public Optional<UploadResult> resultFor(String filePath) {
        return results.stream().filter(result -> result.filePath().equals(filePath)).findFirst();
    }

    public List<UploadResult> retryableResults() {
        return results.stream().filter(UploadResult::isRetryable).toList();
    }

    /**
     * Replace the results of retried files by path, keeping this report's order and identity.
     * Files that were cancelled here but attempted in the retry move into the results.
     */
    public BatchUploadReport mergeRetry(BatchUploadReport retry) {
        Map<String, UploadResult> merged = new LinkedHashMap<>();
        for (UploadResult result : results) {
            merged.put(result.filePath(), result);
        }
        for (UploadResult result : retry.results()) {
            merged.put(result.filePath(), result);
        }
        List<String> stillCancelled = new ArrayList<>();
        for (String path : cancelledFiles) {
            if (!merged.containsKey(path)) {
                stillCancelled.add(path);
            }
        }
        return of(batchId, new ArrayList<>(merged.values()), stillCancelled, startedAt, retry.completedAt());
    }
}
