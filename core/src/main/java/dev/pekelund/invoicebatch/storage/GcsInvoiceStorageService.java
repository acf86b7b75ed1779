package dev.pekelund.invoicebatch.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.invoice.InvoiceOwnerMatcher;
import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import dev.pekelund.invoicebatch.upload.CrossUserDuplicateInfo;
import dev.pekelund.invoicebatch.upload.DuplicateLookupService;
import dev.pekelund.invoicebatch.upload.DuplicateVerdict;
import dev.pekelund.invoicebatch.upload.InvoiceFileStore;
import dev.pekelund.invoicebatch.upload.Sha256ContentHasher;
import dev.pekelund.invoicebatch.upload.StoreRequest;
import dev.pekelund.invoicebatch.upload.StoredObject;
import dev.pekelund.invoicebatch.upload.TransferListener;
import dev.pekelund.invoicebatch.upload.UploadErrorCategory;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

/**
 * Stores invoice files in a bucket and keeps a content-hash index next to them.
 *
 * <p>For every stored file an empty index object is written at
 * {@code <hash index prefix><first 4 hex>/<sha256>/<object name>}, by default under
 * {@value GcsProperties#DEFAULT_HASH_INDEX_PREFIX}. Its metadata carries the owner and
 * upload details, so a duplicate lookup only lists a single hash prefix instead of the bucket.
 */
public class GcsInvoiceStorageService implements InvoiceFileStore, DuplicateLookupService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsInvoiceStorageService.class);
    private static final DateTimeFormatter OBJECT_PREFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS", Locale.US).withZone(ZoneOffset.UTC);
    private static final int HASH_PREFIX_LENGTH = 4;

    static final String CONTENT_HASH_METADATA_KEY = "content-sha256";
    static final String INVOICE_OBJECT_NAME_KEY = "invoice-object-name";
    static final String UPLOADED_AT_KEY = "uploaded-at";
    static final String ORIGINAL_FILENAME_KEY = "original-filename";
    static final String INVOICE_ID_KEY = "invoice-id";
    static final String INVOICE_NUMBER_KEY = "invoice-number";

    static final List<String> CROSS_USER_RECOMMENDATIONS = List.of(
        "Check with the other account holder whether this invoice was already submitted",
        "Make sure you selected the correct file",
        "Contact support if you believe this invoice belongs to you");

    private final Storage storage;
    private final GcsProperties properties;
    private final Clock clock;
    private final String hashIndexPrefix;

    public GcsInvoiceStorageService(Storage storage, GcsProperties properties) {
        this(storage, properties, Clock.systemUTC());
    }

    public GcsInvoiceStorageService(Storage storage, GcsProperties properties, Clock clock) {
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;
        Assert.isTrue(StringUtils.hasText(properties.getBucket()),
            "gcs.bucket must be configured when Google Cloud Storage is enabled");
        Assert.isTrue(StringUtils.hasText(properties.getHashIndexPrefix()), "gcs.hash-index-prefix must not be empty");
        String prefix = properties.getHashIndexPrefix().trim();
        this.hashIndexPrefix = prefix.endsWith("/") ? prefix : prefix + "/";
    }

    @Override
    public StoredObject store(StoreRequest request, TransferListener listener) {
        String fingerprint = request.fingerprint();
        if (!Sha256ContentHasher.isValidFingerprint(fingerprint)) {
            throw new InvoiceStorageException("Cannot store " + request.fileName() + ": invalid content hash");
        }

        TransferListener progress = listener != null ? listener : TransferListener.NONE;
        InvoiceOwner owner = request.owner();
        String objectName = buildObjectName(request.fileName());
        Instant uploadedAt = clock.instant();

        Map<String, String> metadata = new HashMap<>(owner != null && owner.hasValues() ? owner.toMetadata() : Map.of());
        metadata.put(CONTENT_HASH_METADATA_KEY, fingerprint);
        if (StringUtils.hasText(request.fileName())) {
            metadata.put(ORIGINAL_FILENAME_KEY, request.fileName());
        }

        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(properties.getBucket(), objectName))
            .setContentType(request.contentType())
            .setMetadata(metadata)
            .build();

        progress.onTransferred(0, request.size());
        try {
            storage.create(blobInfo, request.content());
        } catch (StorageException ex) {
            String displayName = StringUtils.hasText(request.fileName()) ? request.fileName() : objectName;
            throw new InvoiceStorageException("Failed to upload file '%s'".formatted(displayName),
                categoryFor(ex), ex);
        }
        progress.onTransferred(request.size(), request.size());

        try {
            createHashIndexEntry(fingerprint, objectName, owner, request.fileName(), uploadedAt);
        } catch (InvoiceStorageException indexEx) {
            try {
                storage.delete(BlobId.of(properties.getBucket(), objectName));
                LOGGER.warn("Rolled back invoice upload for {} due to index creation failure", objectName);
            } catch (StorageException deleteEx) {
                LOGGER.error("Failed to roll back invoice {} after index creation failure", objectName, deleteEx);
            }
            throw indexEx;
        }

        LOGGER.info("Stored invoice file {} in bucket {}", objectName, properties.getBucket());
        return new StoredObject(properties.getBucket(), objectName, fingerprint);
    }

    @Override
    public DuplicateVerdict lookup(String fingerprint, InvoiceOwner owner) {
        if (!Sha256ContentHasher.isValidFingerprint(fingerprint)) {
            throw new InvoiceStorageException("Invalid hash format for duplicate check: " + fingerprint);
        }

        try {
            String prefix = hashDirectory(fingerprint);
            Iterable<Blob> indexBlobs = storage.list(properties.getBucket(), Storage.BlobListOption.prefix(prefix))
                .iterateAll();

            CrossUserDuplicateInfo crossUser = null;
            for (Blob indexBlob : indexBlobs) {
                if (indexBlob.isDirectory()) {
                    continue;
                }
                Map<String, String> metadata = indexBlob.getMetadata();
                if (metadata == null || !fingerprint.equals(metadata.get(CONTENT_HASH_METADATA_KEY))) {
                    continue;
                }

                InvoiceOwner storedOwner = InvoiceOwner.fromMetadata(metadata);
                if (owner == null || InvoiceOwnerMatcher.isSameOwner(storedOwner, owner)) {
                    return new DuplicateVerdict.SameUserDuplicate(metadata.get(INVOICE_OBJECT_NAME_KEY),
                        metadata.get(INVOICE_ID_KEY));
                }
                if (crossUser == null) {
                    crossUser = crossUserInfo(metadata, storedOwner);
                }
            }
            return crossUser != null ? new DuplicateVerdict.CrossUserDuplicate(crossUser) : DuplicateVerdict.none();
        } catch (StorageException ex) {
            throw new InvoiceStorageException("Unable to check for duplicate invoices", categoryFor(ex), ex);
        }
    }

    @Override
    public void linkInvoice(StoredObject storedObject, InvoiceRef invoice) {
        BlobId indexId = BlobId.of(properties.getBucket(),
            indexPath(storedObject.fingerprint(), storedObject.objectName()));
        try {
            Blob indexBlob = storage.get(indexId);
            if (indexBlob == null) {
                LOGGER.warn("Hash index entry {} not found; invoice {} not linked", indexId.getName(), invoice.id());
                return;
            }

            Map<String, String> metadata = new HashMap<>(indexBlob.getMetadata() != null ? indexBlob.getMetadata() : Map.of());
            metadata.put(INVOICE_ID_KEY, invoice.id());
            if (StringUtils.hasText(invoice.invoiceNumber())) {
                metadata.put(INVOICE_NUMBER_KEY, invoice.invoiceNumber());
            }
            storage.update(BlobInfo.newBuilder(indexId).setMetadata(metadata).build());
        } catch (StorageException ex) {
            throw new InvoiceStorageException("Failed to link invoice " + invoice.id() + " to " + storedObject.objectName(),
                categoryFor(ex), ex);
        }
    }

    @Override
    public void discard(StoredObject storedObject) {
        BlobId indexId = BlobId.of(properties.getBucket(),
            indexPath(storedObject.fingerprint(), storedObject.objectName()));
        try {
            storage.delete(indexId);
        } catch (StorageException ex) {
            throw new InvoiceStorageException("Failed to delete hash index entry for " + storedObject.objectName(),
                categoryFor(ex), ex);
        }

        try {
            storage.delete(BlobId.of(properties.getBucket(), storedObject.objectName()));
            LOGGER.info("Discarded invoice file {} that was never saved as an invoice", storedObject.objectName());
        } catch (StorageException ex) {
            LOGGER.warn("Failed to delete orphaned invoice file {}: {}", storedObject.objectName(), ex.getMessage());
        }
    }

    static UploadErrorCategory categoryFor(StorageException ex) {
        int code = ex.getCode();
        if (code == 401 || code == 403) {
            return UploadErrorCategory.PERMISSION_DENIED;
        }
        if (code == 413) {
            return UploadErrorCategory.FILE_TOO_LARGE;
        }
        if (code >= 500 && code < 600) {
            return UploadErrorCategory.SERVER_ERROR;
        }
        return null;
    }

    private CrossUserDuplicateInfo crossUserInfo(Map<String, String> metadata, InvoiceOwner storedOwner) {
        return new CrossUserDuplicateInfo(
            metadata.get(INVOICE_NUMBER_KEY),
            storedOwner != null ? storedOwner.email() : null,
            parseInstant(metadata.get(UPLOADED_AT_KEY)),
            1.0,
            CROSS_USER_RECOMMENDATIONS);
    }

    private void createHashIndexEntry(String contentHash, String objectName, InvoiceOwner owner,
        String originalFilename, Instant uploadedAt) {
        try {
            Map<String, String> indexMetadata = new HashMap<>();
            indexMetadata.put(CONTENT_HASH_METADATA_KEY, contentHash);
            indexMetadata.put(INVOICE_OBJECT_NAME_KEY, objectName);
            indexMetadata.put(UPLOADED_AT_KEY, uploadedAt.toString());
            if (StringUtils.hasText(originalFilename)) {
                indexMetadata.put(ORIGINAL_FILENAME_KEY, originalFilename);
            }
            if (owner != null && owner.hasValues()) {
                indexMetadata.putAll(owner.toMetadata());
            }

            BlobInfo indexBlob = BlobInfo.newBuilder(BlobId.of(properties.getBucket(), indexPath(contentHash, objectName)))
                .setContentType("application/json")
                .setMetadata(indexMetadata)
                .build();
            storage.create(indexBlob, new byte[0]);
        } catch (StorageException ex) {
            throw new InvoiceStorageException("Failed to create hash index entry for " + objectName,
                categoryFor(ex), ex);
        }
    }

    private String hashDirectory(String contentHash) {
        return hashIndexPrefix + contentHash.substring(0, HASH_PREFIX_LENGTH) + "/" + contentHash + "/";
    }

    private String indexPath(String contentHash, String objectName) {
        return hashDirectory(contentHash) + objectName;
    }

    private String buildObjectName(String originalFilename) {
        String filename = StringUtils.hasText(originalFilename) ? originalFilename : "invoice";
        filename = extractFilename(filename);
        filename = shortenFilename(filename, Math.max(8, properties.getMaxObjectNameLength()));
        filename = encodeFilename(filename);
        if (!StringUtils.hasText(filename)) {
            filename = "invoice";
        }
        String prefix = OBJECT_PREFIX.format(clock.instant());
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        return prefix + "_" + suffix + "_" + filename;
    }

    private String extractFilename(String filename) {
        try {
            Path path = Paths.get(filename);
            Path fileName = path.getFileName();
            if (fileName != null) {
                return fileName.toString();
            }
        } catch (InvalidPathException ex) {
            LOGGER.debug("Parsing file name {} manually: {}", filename, ex.getMessage());
        }
        int separatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (separatorIndex >= 0 && separatorIndex < filename.length() - 1) {
            return filename.substring(separatorIndex + 1);
        }
        return filename;
    }

    private String encodeFilename(String filename) {
        if (!StringUtils.hasText(filename)) {
            return filename;
        }
        return UriUtils.encodePathSegment(filename, StandardCharsets.UTF_8);
    }

    private String shortenFilename(String filename, int maxLength) {
        if (!StringUtils.hasText(filename) || filename.length() <= maxLength) {
            return filename;
        }

        int extensionIndex = filename.lastIndexOf('.');
        if (extensionIndex > 0 && extensionIndex < filename.length() - 1) {
            String baseName = filename.substring(0, extensionIndex);
            String extension = filename.substring(extensionIndex);
            int allowedBaseLength = Math.max(1, maxLength - extension.length() - 1);
            if (baseName.length() > allowedBaseLength) {
                baseName = baseName.substring(0, allowedBaseLength);
            }
            return baseName + "…" + extension;
        }

        int safeLength = Math.max(1, maxLength - 1);
        return filename.substring(0, safeLength) + "…";
    }

    private static Instant parseInstant(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            LOGGER.debug("Ignoring unparseable upload timestamp {}", value);
            return null;
        }
    }
}
