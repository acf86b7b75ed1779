package dev.pekelund.invoicebatch.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pekelund.invoicebatch.invoice.ExtractedInvoice;
import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import dev.pekelund.invoicebatch.invoice.InvoiceRepository;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchUploadOrchestratorTest {

    private static final InvoiceOwner OWNER = new InvoiceOwner("user-1", "Anna Andersson", "anna@example.com");

    @TempDir
    Path tempDir;

    private ExecutorService workers;
    private ExecutorService dispatcher;
    private ContentHasher contentHasher;
    private DuplicateLookupService lookupService;
    private InvoiceFileStore fileStore;
    private InvoiceExtractionService extractionService;
    private InvoiceRepository repository;
    private UploadPipelineProperties properties;
    private final AtomicInteger invoiceIds = new AtomicInteger();

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(6);
        dispatcher = Executors.newCachedThreadPool();
        contentHasher = spy(new Sha256ContentHasher());
        lookupService = mock(DuplicateLookupService.class);
        fileStore = mock(InvoiceFileStore.class);
        extractionService = mock(InvoiceExtractionService.class);
        repository = mock(InvoiceRepository.class);
        properties = new UploadPipelineProperties();
        properties.setWindowPause(Duration.ZERO);

        when(lookupService.lookup(anyString(), any())).thenReturn(DuplicateVerdict.none());
        when(fileStore.store(any(StoreRequest.class), any(TransferListener.class)))
            .thenAnswer(invocation -> stored(invocation.getArgument(0)));
        when(extractionService.extract(any(), any()))
            .thenReturn(new ExtractedInvoice(Map.of(ExtractedInvoice.FIELD_SELLER_NAME, "ACME AB")));
        when(repository.create(any())).thenAnswer(invocation -> new InvoiceRef("invoice-" + invoiceIds.incrementAndGet()));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        dispatcher.shutdownNow();
    }

    @Test
    void crossUserDuplicateIsReportedNextToSuccessfulUploads() throws Exception {
        Path a = write("a.pdf", "invoice a");
        Path b = write("b.pdf", "invoice b");
        Path c = write("c.pdf", "invoice c");
        CrossUserDuplicateInfo info = new CrossUserDuplicateInfo("INV-2", "bertil@example.com",
            Instant.parse("2024-05-01T10:00:00Z"), 1.0, List.of());
        when(lookupService.lookup(eq(hash("invoice b")), any())).thenReturn(new DuplicateVerdict.CrossUserDuplicate(info));

        BatchUploadHandle handle = orchestrator().submit(List.of(a, b, c), OWNER);
        BatchUploadReport report = handle.completion().get(10, TimeUnit.SECONDS);

        assertThat(report.results()).extracting(UploadResult::filePath)
            .containsExactly(a.toString(), b.toString(), c.toString());
        assertThat(report.results()).extracting(UploadResult::stage)
            .containsExactly(UploadStage.SUCCESS, UploadStage.DUPLICATE, UploadStage.SUCCESS);
        assertThat(report.summary().successCount()).isEqualTo(2);
        assertThat(report.summary().duplicateCount()).isEqualTo(1);
        assertThat(report.summary().failureCount()).isZero();
        assertThat(report.summary().hasCrossUserDuplicate()).isTrue();
        assertThat(report.resultFor(b.toString()).flatMap(UploadResult::crossUserDuplicateInfo)).contains(info);
        assertThat(handle.progress().values()).allMatch(UploadProgress::isTerminal);
        assertThat(handle.completedCount()).isEqualTo(3);
        verify(fileStore, times(2)).store(any(), any());
    }

    @Test
    void neverRunsMoreJobsThanTheConfiguredConcurrency() throws Exception {
        properties.setConcurrency(3);
        List<Path> files = writeFiles(5);
        when(fileStore.store(any(StoreRequest.class), any(TransferListener.class))).thenAnswer(invocation -> {
            Thread.sleep(30);
            return stored(invocation.getArgument(0));
        });
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        UploadProgressListener listener = new UploadProgressListener() {
            @Override
            public void onFileProgress(UploadProgress progress) {
                if (progress.stage() == UploadStage.PREPARING) {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                } else if (progress.isTerminal()) {
                    inFlight.decrementAndGet();
                }
            }
        };

        BatchUploadReport report = orchestrator().submit(files, OWNER, listener).completion().get(10, TimeUnit.SECONDS);

        assertThat(report.summary().successCount()).isEqualTo(5);
        assertThat(maxInFlight.get()).isBetween(1, 3);
    }

    @Test
    void cancellationStopsInFlightJobsAndSkipsUnscheduledFiles() throws Exception {
        properties.setConcurrency(2);
        List<Path> files = writeFiles(5);
        CountDownLatch uploadsStarted = new CountDownLatch(2);
        CountDownLatch releaseUploads = new CountDownLatch(1);
        when(fileStore.store(any(StoreRequest.class), any(TransferListener.class))).thenAnswer(invocation -> {
            uploadsStarted.countDown();
            releaseUploads.await(10, TimeUnit.SECONDS);
            return stored(invocation.getArgument(0));
        });

        BatchUploadHandle handle = orchestrator().submit(files, OWNER);
        assertThat(uploadsStarted.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(handle.cancel()).isTrue();
        assertThat(handle.cancel()).isFalse();
        releaseUploads.countDown();
        BatchUploadReport report = handle.completion().get(10, TimeUnit.SECONDS);

        assertThat(report.results()).hasSize(2);
        assertThat(report.results()).allSatisfy(result -> {
            assertThat(result.stage()).isEqualTo(UploadStage.ERROR);
            assertThat(result.errorCategory()).contains(UploadErrorCategory.CANCELLED);
        });
        assertThat(report.cancelledFiles()).containsExactly(
            files.get(2).toString(), files.get(3).toString(), files.get(4).toString());
        assertThat(report.summary().cancelledCount()).isEqualTo(3);
        assertThat(report.summary().totalCount()).isEqualTo(5);
        assertThat(report.summary().attemptedCount()).isEqualTo(2);
        verify(fileStore, times(2)).store(any(), any());
        verify(repository, times(0)).create(any());
    }

    @Test
    void cancellingABatchQueuedBehindAnotherNeverStartsItsFiles() throws Exception {
        properties.setConcurrency(2);
        ThreadPoolExecutor sharedPool = (ThreadPoolExecutor) Executors.newFixedThreadPool(2);
        try {
            BatchUploadOrchestrator orchestrator = orchestrator(sharedPool);
            List<Path> busy = List.of(write("busy-1.pdf", "busy 1"), write("busy-2.pdf", "busy 2"));
            List<Path> queued = List.of(write("queued-1.pdf", "queued 1"), write("queued-2.pdf", "queued 2"));
            CountDownLatch uploadsStarted = new CountDownLatch(2);
            CountDownLatch releaseUploads = new CountDownLatch(1);
            when(fileStore.store(any(StoreRequest.class), any(TransferListener.class))).thenAnswer(invocation -> {
                uploadsStarted.countDown();
                releaseUploads.await(10, TimeUnit.SECONDS);
                return stored(invocation.getArgument(0));
            });

            BatchUploadHandle busyBatch = orchestrator.submit(busy, OWNER);
            assertThat(uploadsStarted.await(10, TimeUnit.SECONDS)).isTrue();
            BatchUploadHandle queuedBatch = orchestrator.submit(queued, OWNER);
            awaitQueuedTasks(sharedPool, 2);

            assertThat(queuedBatch.cancel()).isTrue();
            releaseUploads.countDown();
            BatchUploadReport queuedReport = queuedBatch.completion().get(10, TimeUnit.SECONDS);
            BatchUploadReport busyReport = busyBatch.completion().get(10, TimeUnit.SECONDS);

            assertThat(queuedReport.results()).isEmpty();
            assertThat(queuedReport.cancelledFiles()).containsExactly(queued.get(0).toString(), queued.get(1).toString());
            assertThat(queuedReport.summary().cancelledCount()).isEqualTo(2);
            assertThat(queuedReport.summary().failureCount()).isZero();
            assertThat(queuedBatch.progress()).isEmpty();
            verify(lookupService, never()).lookup(eq(hash("queued 1")), any());
            verify(lookupService, never()).lookup(eq(hash("queued 2")), any());
            assertThat(busyReport.summary().successCount()).isEqualTo(2);
        } finally {
            sharedPool.shutdownNow();
        }
    }

    @Test
    void identicalFilesInOneBatchCreateASingleInvoice() throws Exception {
        Path original = write("original.pdf", "same invoice");
        Path copy = write("copy.pdf", "same invoice");

        BatchUploadReport report = orchestrator().run(List.of(original, copy), OWNER);

        assertThat(report.summary().successCount()).isEqualTo(1);
        assertThat(report.summary().duplicateCount()).isEqualTo(1);
        verify(fileStore, times(1)).store(any(), any());
        verify(repository, times(1)).create(any());
    }

    @Test
    void repeatedPathsAreUploadedOnce() throws Exception {
        Path file = write("invoice.pdf", "invoice");

        BatchUploadHandle handle = orchestrator().submit(List.of(file, file), OWNER);
        BatchUploadReport report = handle.completion().get(10, TimeUnit.SECONDS);

        assertThat(handle.totalCount()).isEqualTo(1);
        assertThat(report.results()).hasSize(1);
        assertThat(report.summary().isAllSuccessful()).isTrue();
    }

    @Test
    void oneFailingFileDoesNotAffectItsSiblings() throws Exception {
        Path good = write("good.pdf", "good invoice");
        Path bad = write("bad.pdf", "bad invoice");
        when(extractionService.extract(any(), any())).thenAnswer(invocation -> {
            StoredObject stored = invocation.getArgument(0);
            if (stored.objectName().contains("bad")) {
                throw new UploadStageException("Unreadable invoice", UploadErrorCategory.EXTRACTION_FAILURE);
            }
            return new ExtractedInvoice(Map.of());
        });

        BatchUploadReport report = orchestrator().run(List.of(good, bad), OWNER);

        assertThat(report.resultFor(good.toString()).orElseThrow().isSuccess()).isTrue();
        assertThat(report.resultFor(bad.toString()).orElseThrow().stage()).isEqualTo(UploadStage.ERROR);
        assertThat(report.retryableResults()).isEmpty();
    }

    @Test
    void retryRecomputesFingerprintAndMergesIntoOriginalReport() throws Exception {
        Path file = write("invoice.pdf", "flaky invoice");
        when(fileStore.store(any(StoreRequest.class), any(TransferListener.class)))
            .thenThrow(new UploadStageException("Connection reset by peer", UploadErrorCategory.NETWORK))
            .thenAnswer(invocation -> stored(invocation.getArgument(0)));
        BatchUploadOrchestrator orchestrator = orchestrator();

        BatchUploadReport first = orchestrator.run(List.of(file), OWNER);
        assertThat(first.retryableResults()).hasSize(1);

        List<UploadStage> retryStages = new CopyOnWriteArrayList<>();
        UploadProgressListener listener = new UploadProgressListener() {
            @Override
            public void onFileProgress(UploadProgress progress) {
                retryStages.add(progress.stage());
            }
        };
        BatchUploadReport retried = orchestrator.retry(first, null, OWNER, listener)
            .completion().get(10, TimeUnit.SECONDS);
        BatchUploadReport merged = first.mergeRetry(retried);

        assertThat(retryStages.get(0)).isEqualTo(UploadStage.PREPARING);
        assertThat(retryStages).contains(UploadStage.HASHING);
        verify(contentHasher, times(2)).hash(any());
        assertThat(merged.batchId()).isEqualTo(first.batchId());
        assertThat(merged.summary().isAllSuccessful()).isTrue();
    }

    @Test
    void retryWithoutRetryableFilesIsRejected() throws Exception {
        Path file = write("invoice.pdf", "invoice");
        BatchUploadOrchestrator orchestrator = orchestrator();
        BatchUploadReport report = orchestrator.run(List.of(file), OWNER);

        assertThatThrownBy(() -> orchestrator.retry(report, List.of(file.toString()), OWNER))
            .isInstanceOf(BatchValidationException.class);
    }

    @Test
    void rejectsEmptyAndOversizedSelections() {
        BatchUploadOrchestrator orchestrator = orchestrator();
        List<Path> tooMany = new ArrayList<>();
        for (int i = 0; i <= properties.getMaxFileCount(); i++) {
            tooMany.add(tempDir.resolve("invoice-" + i + ".pdf"));
        }

        assertThatThrownBy(() -> orchestrator.submit(List.of(), OWNER)).isInstanceOf(BatchValidationException.class);
        assertThatThrownBy(() -> orchestrator.submit(tooMany, OWNER)).isInstanceOf(BatchValidationException.class);
    }

    @Test
    void failingListenerDoesNotBreakTheBatch() throws Exception {
        List<Path> files = writeFiles(3);
        UploadProgressListener failing = new UploadProgressListener() {
            @Override
            public void onFileProgress(UploadProgress progress) {
                throw new IllegalStateException("listener failure");
            }

            @Override
            public void onBatchProgress(BatchProgress progress) {
                throw new IllegalStateException("listener failure");
            }
        };

        BatchUploadReport report = orchestrator().submit(files, OWNER, failing).completion().get(10, TimeUnit.SECONDS);

        assertThat(report.summary().successCount()).isEqualTo(3);
    }

    @Test
    void batchProgressCountsEveryFileOnce() throws Exception {
        List<Path> files = writeFiles(4);
        Set<Integer> completedCounts = ConcurrentHashMap.newKeySet();
        Set<Integer> totalCounts = ConcurrentHashMap.newKeySet();
        List<BatchUploadReport> completed = new CopyOnWriteArrayList<>();
        UploadProgressListener listener = new UploadProgressListener() {
            @Override
            public void onBatchProgress(BatchProgress progress) {
                totalCounts.add(progress.totalCount());
                completedCounts.add(progress.completedCount());
            }

            @Override
            public void onBatchCompleted(BatchUploadReport report) {
                completed.add(report);
            }
        };

        BatchUploadReport report = orchestrator().submit(files, OWNER, listener).completion().get(10, TimeUnit.SECONDS);

        assertThat(completedCounts).containsExactlyInAnyOrder(1, 2, 3, 4);
        assertThat(totalCounts).containsExactly(4);
        assertThat(completed).containsExactly(report);
    }

    private BatchUploadOrchestrator orchestrator() {
        return orchestrator(workers);
    }

    private BatchUploadOrchestrator orchestrator(ExecutorService workerPool) {
        UploadCollaborators collaborators = new UploadCollaborators(contentHasher,
            new DuplicateClassifier(lookupService), fileStore, extractionService, repository);
        return new BatchUploadOrchestrator(collaborators, properties, workerPool, dispatcher,
            UploadProgressListener.NONE);
    }

    private static void awaitQueuedTasks(ThreadPoolExecutor pool, int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (pool.getQueue().size() < count && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(pool.getQueue()).hasSize(count);
    }

    private static StoredObject stored(StoreRequest request) {
        return new StoredObject("bucket", "user-1/" + request.fileName(), request.fingerprint());
    }

    private List<Path> writeFiles(int count) throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            files.add(write("invoice-" + i + ".pdf", "invoice content " + i));
        }
        return files;
    }

    private Path write(String name, String content) throws IOException {
        return Files.write(tempDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    private static String hash(String content) {
        return new Sha256ContentHasher().hash(content.getBytes(StandardCharsets.UTF_8));
    }
}
