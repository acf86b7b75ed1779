package dev.pekelund.invoicebatch.extraction;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.IdTokenCredentials;
import com.google.auth.oauth2.IdTokenProvider;
import dev.pekelund.invoicebatch.invoice.ExtractedInvoice;
import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.upload.InvoiceExtractionService;
import dev.pekelund.invoicebatch.upload.StoredObject;
import dev.pekelund.invoicebatch.upload.UploadErrorCategory;
import dev.pekelund.invoicebatch.upload.UploadErrorClassifier;
import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Calls the OCR extraction service for a stored invoice file and returns the structured fields.
 */
public class RestInvoiceExtractionClient implements InvoiceExtractionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RestInvoiceExtractionClient.class);
    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
        new ParameterizedTypeReference<>() {
        };

    private final RestClient restClient;
    private final ExtractionProperties properties;
    private final AtomicReference<IdTokenCredentials> cachedCredentials = new AtomicReference<>();

    public RestInvoiceExtractionClient(RestClient restClient, ExtractionProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public ExtractedInvoice extract(StoredObject storedObject, InvoiceOwner owner) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getExtractPath())
            .build()
            .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (properties.isUseIdToken()) {
            headers.setBearerAuth(fetchIdToken());
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("bucket", storedObject.bucket());
        payload.put("objectName", storedObject.objectName());
        payload.put("contentSha256", storedObject.fingerprint());
        if (owner != null && owner.hasValues()) {
            payload.put("owner", owner.toAttributes());
        }

        Map<String, Object> response;
        try {
            response = restClient
                .post()
                .uri(uri)
                .headers(httpHeaders -> httpHeaders.addAll(headers))
                .body(payload)
                .retrieve()
                .body(RESPONSE_TYPE);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            UploadErrorCategory category = UploadErrorClassifier.categorizeStatus(status);
            throw new InvoiceExtractionException("Extraction service responded with status " + status
                + " for " + storedObject.objectName(), category != null ? category : UploadErrorCategory.EXTRACTION_FAILURE, ex);
        } catch (ResourceAccessException ex) {
            throw new InvoiceExtractionException("Extraction service unreachable for " + storedObject.objectName(),
                UploadErrorCategory.NETWORK, ex);
        } catch (RestClientException ex) {
            throw new InvoiceExtractionException("Unreadable extraction response for " + storedObject.objectName(), ex);
        }

        if (response == null || response.isEmpty()) {
            throw new InvoiceExtractionException("Extraction service returned an empty response for "
                + storedObject.objectName());
        }
        if (!(response.get("fields") instanceof Map<?, ?> fields)) {
            throw new InvoiceExtractionException("Extraction response for " + storedObject.objectName()
                + " contains no fields");
        }

        Map<String, Object> extracted = new LinkedHashMap<>();
        fields.forEach((key, value) -> extracted.put(String.valueOf(key), value));
        LOGGER.info("Extracted {} field(s) from {}", extracted.size(), storedObject.objectName());
        return new ExtractedInvoice(extracted);
    }

    private String fetchIdToken() {
        try {
            IdTokenCredentials credentials = cachedCredentials.updateAndGet(existing -> {
                if (existing != null) {
                    return existing;
                }
                return buildCredentials();
            });
            credentials.refreshIfExpired();
            AccessToken token = credentials.getAccessToken();
            if (token == null || !StringUtils.hasText(token.getTokenValue())) {
                throw new InvoiceExtractionException("Failed to obtain ID token for extraction request",
                    UploadErrorCategory.PERMISSION_DENIED, null);
            }
            return token.getTokenValue();
        } catch (IOException ex) {
            throw new InvoiceExtractionException("Unable to obtain ID token for extraction request",
                UploadErrorCategory.PERMISSION_DENIED, ex);
        }
    }

    private IdTokenCredentials buildCredentials() {
        try {
            GoogleCredentials googleCredentials = GoogleCredentials.getApplicationDefault();
            if (!(googleCredentials instanceof IdTokenProvider idTokenProvider)) {
                throw new InvoiceExtractionException(
                    "Default Google credentials do not support ID tokens. Set invoice.extraction.use-id-token=false to disable authentication.",
                    UploadErrorCategory.PERMISSION_DENIED, null);
            }
            String audience = properties.getAudience();
            if (!StringUtils.hasText(audience)) {
                audience = properties.getBaseUrl();
            }
            return IdTokenCredentials.newBuilder()
                .setIdTokenProvider(idTokenProvider)
                .setTargetAudience(audience)
                .build();
        } catch (IOException ex) {
            throw new InvoiceExtractionException("Unable to initialize Google credentials for extraction requests",
                UploadErrorCategory.PERMISSION_DENIED, ex);
        }
    }
}
