package dev.pekelund.invoicebatch.config;

import dev.pekelund.invoicebatch.extraction.DisabledInvoiceExtractionService;
import dev.pekelund.invoicebatch.extraction.ExtractionConfig;
import dev.pekelund.invoicebatch.firestore.FirestoreConfig;
import dev.pekelund.invoicebatch.invoice.InvoiceRepository;
import dev.pekelund.invoicebatch.optimistic.InvoiceMutationService;
import dev.pekelund.invoicebatch.optimistic.OptimisticMutationCoordinator;
import dev.pekelund.invoicebatch.optimistic.OptimisticProperties;
import dev.pekelund.invoicebatch.progress.CompositeProgressReporter;
import dev.pekelund.invoicebatch.progress.LoggingProgressReporter;
import dev.pekelund.invoicebatch.progress.ProgressReporter;
import dev.pekelund.invoicebatch.storage.GcsConfig;
import dev.pekelund.invoicebatch.upload.BatchUploadOrchestrator;
import dev.pekelund.invoicebatch.upload.ContentHasher;
import dev.pekelund.invoicebatch.upload.DuplicateClassifier;
import dev.pekelund.invoicebatch.upload.DuplicateLookupService;
import dev.pekelund.invoicebatch.upload.DuplicateVerdict;
import dev.pekelund.invoicebatch.upload.InvoiceExtractionService;
import dev.pekelund.invoicebatch.upload.InvoiceFileStore;
import dev.pekelund.invoicebatch.upload.Sha256ContentHasher;
import dev.pekelund.invoicebatch.upload.UploadCollaborators;
import dev.pekelund.invoicebatch.upload.UploadPipelineProperties;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the upload pipeline and the optimistic mutation coordinator to the configured adapters.
 */
@Configuration
@EnableConfigurationProperties({UploadPipelineProperties.class, OptimisticProperties.class})
@Import({GcsConfig.class, FirestoreConfig.class, ExtractionConfig.class})
public class UploadPipelineConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(UploadPipelineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock invoiceClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ProgressReporter.class)
    public LoggingProgressReporter loggingProgressReporter() {
        return new LoggingProgressReporter();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService invoiceUploadExecutor(UploadPipelineProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getConcurrency()),
            daemonThreadFactory("invoice-upload-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService invoiceBatchExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("invoice-batch-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService invoiceOptimisticExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("invoice-optimistic-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService invoiceOptimisticScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreadFactory("invoice-optimistic-sweep"));
    }

    @Bean
    @ConditionalOnMissingBean(ContentHasher.class)
    public Sha256ContentHasher contentHasher() {
        return new Sha256ContentHasher();
    }

    @Bean
    public DuplicateClassifier duplicateClassifier(ObjectProvider<DuplicateLookupService> lookupService) {
        DuplicateLookupService lookup = lookupService.getIfAvailable();
        if (lookup == null) {
            LOGGER.warn("No duplicate lookup service configured; uploads run without duplicate protection");
            lookup = (fingerprint, owner) -> DuplicateVerdict.none();
        }
        return new DuplicateClassifier(lookup);
    }

    @Bean
    public UploadCollaborators uploadCollaborators(ContentHasher contentHasher, DuplicateClassifier duplicateClassifier,
        InvoiceFileStore fileStore, ObjectProvider<InvoiceExtractionService> extractionService,
        InvoiceRepository invoiceRepository) {
        InvoiceExtractionService extraction = extractionService.getIfAvailable();
        if (extraction == null) {
            LOGGER.warn("No invoice extraction service configured; uploaded files will fail in processing");
            extraction = new DisabledInvoiceExtractionService();
        }
        return new UploadCollaborators(contentHasher, duplicateClassifier, fileStore, extraction, invoiceRepository);
    }

    @Bean
    public BatchUploadOrchestrator batchUploadOrchestrator(UploadCollaborators collaborators,
        UploadPipelineProperties properties,
        @Qualifier("invoiceUploadExecutor") ExecutorService uploadExecutor,
        @Qualifier("invoiceBatchExecutor") ExecutorService batchExecutor,
        ObjectProvider<ProgressReporter> reporters, Clock clock) {
        return new BatchUploadOrchestrator(collaborators, properties, uploadExecutor, batchExecutor,
            progressReporter(reporters), clock);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public OptimisticMutationCoordinator optimisticMutationCoordinator(OptimisticProperties properties,
        @Qualifier("invoiceOptimisticExecutor") ExecutorService executor,
        @Qualifier("invoiceOptimisticScheduler") ScheduledExecutorService scheduler,
        ObjectProvider<ProgressReporter> reporters, Clock clock) {
        return new OptimisticMutationCoordinator(properties, executor, scheduler, clock, progressReporter(reporters));
    }

    @Bean
    public InvoiceMutationService invoiceMutationService(OptimisticMutationCoordinator coordinator,
        InvoiceRepository invoiceRepository, Clock clock) {
        return new InvoiceMutationService(coordinator, invoiceRepository, clock);
    }

    private static ProgressReporter progressReporter(ObjectProvider<ProgressReporter> reporters) {
        List<ProgressReporter> available = reporters.orderedStream().toList();
        if (available.size() == 1) {
            return available.get(0);
        }
        return new CompositeProgressReporter(available);
    }

    private static CustomizableThreadFactory daemonThreadFactory(String prefix) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(prefix);
        threadFactory.setDaemon(true);
        return threadFactory;
    }
}
