package dev.pekelund.invoicebatch.firestore;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.pekelund.invoicebatch.invoice.InvoiceRepository;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Wires the Firestore-backed {@link InvoiceRepository} when {@code firestore.enabled=true}.
 */
@Configuration
@EnableConfigurationProperties(FirestoreProperties.class)
@ConditionalOnProperty(value = "firestore.enabled", havingValue = "true")
public class FirestoreConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreConfig.class);

    private final FirestoreProperties properties;
    private final ResourceLoader resourceLoader;

    public FirestoreConfig(FirestoreProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @Bean
    @ConditionalOnMissingBean
    public Firestore firestore() throws IOException {
        FirestoreOptions.Builder builder = FirestoreOptions.newBuilder();
        if (StringUtils.hasText(properties.getProjectId())) {
            builder.setProjectId(properties.getProjectId());
        }
        if (StringUtils.hasText(properties.getDatabaseId())) {
            builder.setDatabaseId(properties.getDatabaseId());
        }

        if (StringUtils.hasText(properties.getEmulatorHost())) {
            Assert.isTrue(StringUtils.hasText(properties.getProjectId()),
                "firestore.project-id must be set when firestore.emulator-host is used");
            LOGGER.info("Using Firestore emulator at {} for invoices", properties.getEmulatorHost());
            return builder.setHost(properties.getEmulatorHost())
                .setCredentials(NoCredentials.getInstance())
                .build()
                .getService();
        }

        return builder.setCredentials(resolveCredentials()).build().getService();
    }

    @Bean
    @ConditionalOnMissingBean(InvoiceRepository.class)
    public FirestoreInvoiceRepository firestoreInvoiceRepository(Firestore firestore) {
        Assert.hasText(properties.getInvoicesCollection(), "firestore.invoices-collection must not be empty");
        LOGGER.info("Invoices are stored in Firestore collection '{}'", properties.getInvoicesCollection());
        return new FirestoreInvoiceRepository(firestore, properties.getInvoicesCollection());
    }

    private GoogleCredentials resolveCredentials() throws IOException {
        if (!StringUtils.hasText(properties.getCredentials())) {
            return GoogleCredentials.getApplicationDefault();
        }

        Resource resource = resourceLoader.getResource(properties.getCredentials());
        if (!resource.exists()) {
            LOGGER.warn("Firestore credentials resource {} not found; falling back to application default credentials",
                properties.getCredentials());
            return GoogleCredentials.getApplicationDefault();
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return GoogleCredentials.fromStream(inputStream);
        }
    }
}
