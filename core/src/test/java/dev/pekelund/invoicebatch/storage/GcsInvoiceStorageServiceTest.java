package dev.pekelund.invoicebatch.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import dev.pekelund.invoicebatch.invoice.InvoiceOwner;
import dev.pekelund.invoicebatch.invoice.InvoiceRef;
import dev.pekelund.invoicebatch.upload.CrossUserDuplicateInfo;
import dev.pekelund.invoicebatch.upload.DuplicateVerdict;
import dev.pekelund.invoicebatch.upload.Sha256ContentHasher;
import dev.pekelund.invoicebatch.upload.StoreRequest;
import dev.pekelund.invoicebatch.upload.StoredObject;
import dev.pekelund.invoicebatch.upload.UploadErrorCategory;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class GcsInvoiceStorageServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:15:30Z");
    private static final InvoiceOwner OWNER = new InvoiceOwner("user-123", "Test User", "test@example.com");
    private static final InvoiceOwner OTHER = new InvoiceOwner("user-456", "Other User", "bertil@example.com");

    private Storage storage;
    private GcsProperties properties;
    private GcsInvoiceStorageService service;

    @BeforeEach
    void setUp() {
        storage = mock(Storage.class);
        properties = new GcsProperties();
        properties.setBucket("test-bucket");
        service = new GcsInvoiceStorageService(storage, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void requiresABucket() {
        assertThatThrownBy(() -> new GcsInvoiceStorageService(storage, new GcsProperties()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void storesFileAndHashIndexWithOwnerMetadata() {
        byte[] content = "Invoice content".getBytes(StandardCharsets.UTF_8);
        String hash = hash(content);
        when(storage.create(any(BlobInfo.class), any(byte[].class))).thenReturn(mock(Blob.class));
        List<Long> transferred = new ArrayList<>();

        StoredObject stored = service.store(new StoreRequest("invoice.pdf", "application/pdf", content, hash, OWNER),
            (bytes, total) -> transferred.add(bytes));

        ArgumentCaptor<BlobInfo> captor = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage, times(2)).create(captor.capture(), any(byte[].class));
        BlobInfo invoiceBlob = captor.getAllValues().get(0);
        BlobInfo indexBlob = captor.getAllValues().get(1);

        assertThat(stored.bucket()).isEqualTo("test-bucket");
        assertThat(stored.objectName()).startsWith("20240601-101530-000_").endsWith("_invoice.pdf");
        assertThat(stored.path()).isEqualTo("test-bucket/" + stored.objectName());
        assertThat(invoiceBlob.getContentType()).isEqualTo("application/pdf");
        assertThat(invoiceBlob.getMetadata())
            .containsEntry("content-sha256", hash)
            .containsEntry("original-filename", "invoice.pdf")
            .containsAllEntriesOf(OWNER.toMetadata());
        assertThat(indexBlob.getName())
            .isEqualTo(".invoice-hashes/" + hash.substring(0, 4) + "/" + hash + "/" + stored.objectName());
        assertThat(indexBlob.getMetadata())
            .containsEntry("invoice-object-name", stored.objectName())
            .containsEntry("uploaded-at", NOW.toString())
            .containsAllEntriesOf(OWNER.toMetadata());
        assertThat(transferred).containsExactly(0L, (long) content.length);
    }

    @Test
    void rollsBackUploadWhenIndexEntryCannotBeWritten() {
        byte[] content = "Invoice content".getBytes(StandardCharsets.UTF_8);
        when(storage.create(any(BlobInfo.class), any(byte[].class)))
            .thenReturn(mock(Blob.class))
            .thenThrow(new StorageException(503, "Service Unavailable"));

        assertThatThrownBy(() -> service.store(
            new StoreRequest("invoice.pdf", "application/pdf", content, hash(content), OWNER), null))
            .isInstanceOfSatisfying(InvoiceStorageException.class,
                ex -> assertThat(ex.getCategory()).isEqualTo(UploadErrorCategory.SERVER_ERROR));

        ArgumentCaptor<BlobId> deleted = ArgumentCaptor.forClass(BlobId.class);
        verify(storage).delete(deleted.capture());
        assertThat(deleted.getValue().getName()).endsWith("_invoice.pdf");
        assertThat(deleted.getValue().getName()).doesNotStartWith(".invoice-hashes/");
    }

    @Test
    void writesIndexUnderTheConfiguredPrefixAndShortensLongNames() {
        properties.setHashIndexPrefix("hash-index");
        properties.setMaxObjectNameLength(20);
        service = new GcsInvoiceStorageService(storage, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        byte[] content = "Invoice content".getBytes(StandardCharsets.UTF_8);
        String hash = hash(content);

        StoredObject stored = service.store(new StoreRequest("a-very-long-supplier-invoice-name.pdf", "application/pdf",
            content, hash, OWNER), null);

        ArgumentCaptor<BlobInfo> captor = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage, times(2)).create(captor.capture(), any(byte[].class));
        assertThat(captor.getAllValues().get(1).getName())
            .isEqualTo("hash-index/" + hash.substring(0, 4) + "/" + hash + "/" + stored.objectName());
        assertThat(stored.objectName()).endsWith(".pdf").doesNotContain("supplier-invoice-name");
    }

    @Test
    void mapsPermissionErrorsFromTheUpload() {
        byte[] content = "Invoice content".getBytes(StandardCharsets.UTF_8);
        when(storage.create(any(BlobInfo.class), any(byte[].class)))
            .thenThrow(new StorageException(403, "Forbidden"));

        assertThatThrownBy(() -> service.store(
            new StoreRequest("invoice.pdf", "application/pdf", content, hash(content), OWNER), null))
            .isInstanceOfSatisfying(InvoiceStorageException.class,
                ex -> assertThat(ex.getCategory()).isEqualTo(UploadErrorCategory.PERMISSION_DENIED));
        verify(storage, times(1)).create(any(BlobInfo.class), any(byte[].class));
    }

    @Test
    void rejectsMalformedFingerprintBeforeUploading() {
        assertThatThrownBy(() -> service.store(
            new StoreRequest("invoice.pdf", "application/pdf", new byte[] {1}, "not-a-hash", OWNER), null))
            .isInstanceOf(InvoiceStorageException.class);
        verify(storage, never()).create(any(BlobInfo.class), any(byte[].class));
    }

    @Test
    void findsDuplicateOfTheSameOwner() {
        String hash = hash("Test invoice content".getBytes(StandardCharsets.UTF_8));
        Map<String, String> metadata = indexMetadata(hash, "existing-invoice.pdf", OWNER);
        metadata.put("invoice-id", "invoice-9");
        listIndex(indexBlob(metadata));

        DuplicateVerdict verdict = service.lookup(hash, OWNER);

        assertThat(verdict).isEqualTo(new DuplicateVerdict.SameUserDuplicate("existing-invoice.pdf", "invoice-9"));
        verify(storage).list(eq("test-bucket"), any(Storage.BlobListOption.class));
    }

    @Test
    void reportsCrossUserDuplicateWithDisclosureDetails() {
        String hash = hash("Shared invoice".getBytes(StandardCharsets.UTF_8));
        Map<String, String> metadata = indexMetadata(hash, "other-invoice.pdf", OTHER);
        metadata.put("uploaded-at", "2024-05-01T08:00:00Z");
        metadata.put("invoice-number", "INV-77");
        listIndex(indexBlob(metadata));

        DuplicateVerdict verdict = service.lookup(hash, OWNER);

        assertThat(verdict).isInstanceOf(DuplicateVerdict.CrossUserDuplicate.class);
        CrossUserDuplicateInfo info = ((DuplicateVerdict.CrossUserDuplicate) verdict).info();
        assertThat(info.invoiceNumber()).isEqualTo("INV-77");
        assertThat(info.originalUserEmail()).isEqualTo("bertil@example.com");
        assertThat(info.maskedOriginalUserEmail()).isEqualTo("be***l@example.com");
        assertThat(info.uploadedAt()).isEqualTo(Instant.parse("2024-05-01T08:00:00Z"));
        assertThat(info.similarityScore()).isEqualTo(1.0);
        assertThat(info.recommendations()).isNotEmpty();
    }

    @Test
    void sameOwnerMatchWinsOverEarlierCrossUserMatch() {
        String hash = hash("Shared invoice".getBytes(StandardCharsets.UTF_8));
        listIndex(indexBlob(indexMetadata(hash, "other-invoice.pdf", OTHER)),
            indexBlob(indexMetadata(hash, "my-invoice.pdf", OWNER)));

        DuplicateVerdict verdict = service.lookup(hash, OWNER);

        assertThat(verdict).isEqualTo(new DuplicateVerdict.SameUserDuplicate("my-invoice.pdf", null));
    }

    @Test
    void ignoresIndexEntriesForOtherHashesAndDirectories() {
        String hash = hash("Invoice".getBytes(StandardCharsets.UTF_8));
        Blob directory = mock(Blob.class);
        when(directory.isDirectory()).thenReturn(true);
        listIndex(directory, indexBlob(indexMetadata("b".repeat(64), "other.pdf", OWNER)));

        assertThat(service.lookup(hash, OWNER)).isEqualTo(DuplicateVerdict.none());
    }

    @Test
    void lookupFailureCarriesCategory() {
        String hash = hash("Invoice".getBytes(StandardCharsets.UTF_8));
        when(storage.list(eq("test-bucket"), any(Storage.BlobListOption.class)))
            .thenThrow(new StorageException(500, "Internal error"));

        assertThatThrownBy(() -> service.lookup(hash, OWNER))
            .isInstanceOfSatisfying(InvoiceStorageException.class,
                ex -> assertThat(ex.getCategory()).isEqualTo(UploadErrorCategory.SERVER_ERROR));
    }

    @Test
    void linksPersistedInvoiceToTheIndexEntry() {
        String hash = "a".repeat(64);
        StoredObject stored = new StoredObject("test-bucket", "20240601_invoice.pdf", hash);
        Blob indexBlob = mock(Blob.class);
        when(indexBlob.getMetadata()).thenReturn(indexMetadata(hash, "20240601_invoice.pdf", OWNER));
        when(storage.get(any(BlobId.class))).thenReturn(indexBlob);

        service.linkInvoice(stored, new InvoiceRef("invoice-1", "INV-1"));

        ArgumentCaptor<BlobId> requested = ArgumentCaptor.forClass(BlobId.class);
        verify(storage).get(requested.capture());
        assertThat(requested.getValue().getName()).isEqualTo(".invoice-hashes/aaaa/" + hash + "/20240601_invoice.pdf");
        ArgumentCaptor<BlobInfo> updated = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).update(updated.capture());
        assertThat(updated.getValue().getMetadata())
            .containsEntry("invoice-id", "invoice-1")
            .containsEntry("invoice-number", "INV-1")
            .containsEntry("invoice-object-name", "20240601_invoice.pdf");
    }

    @Test
    void missingIndexEntryIsNotLinked() {
        when(storage.get(any(BlobId.class))).thenReturn(null);

        service.linkInvoice(new StoredObject("test-bucket", "invoice.pdf", "a".repeat(64)), new InvoiceRef("invoice-1"));

        verify(storage, never()).update(any(BlobInfo.class));
    }

    @Test
    void discardRemovesIndexEntryBeforeTheFile() {
        String hash = "a".repeat(64);
        when(storage.delete(any(BlobId.class))).thenReturn(true);

        service.discard(new StoredObject("test-bucket", "20240601_invoice.pdf", hash));

        ArgumentCaptor<BlobId> deleted = ArgumentCaptor.forClass(BlobId.class);
        verify(storage, times(2)).delete(deleted.capture());
        assertThat(deleted.getAllValues()).extracting(BlobId::getName).containsExactly(
            ".invoice-hashes/aaaa/" + hash + "/20240601_invoice.pdf", "20240601_invoice.pdf");
    }

    @Test
    void discardFailsWhenTheIndexEntryCannotBeRemoved() {
        when(storage.delete(any(BlobId.class))).thenThrow(new StorageException(503, "Service Unavailable"));

        assertThatThrownBy(() -> service.discard(new StoredObject("test-bucket", "invoice.pdf", "a".repeat(64))))
            .isInstanceOfSatisfying(InvoiceStorageException.class,
                ex -> assertThat(ex.getCategory()).isEqualTo(UploadErrorCategory.SERVER_ERROR));
        verify(storage, times(1)).delete(any(BlobId.class));
    }

    @Test
    void discardToleratesAFileThatCannotBeDeleted() {
        when(storage.delete(any(BlobId.class)))
            .thenReturn(true)
            .thenThrow(new StorageException(500, "Internal error"));

        service.discard(new StoredObject("test-bucket", "invoice.pdf", "a".repeat(64)));

        verify(storage, times(2)).delete(any(BlobId.class));
    }

    private void listIndex(Blob... blobs) {
        @SuppressWarnings("unchecked")
        Page<Blob> page = mock(Page.class);
        when(page.iterateAll()).thenReturn(List.of(blobs));
        when(storage.list(eq("test-bucket"), any(Storage.BlobListOption.class))).thenReturn(page);
    }

    private static Blob indexBlob(Map<String, String> metadata) {
        Blob blob = mock(Blob.class);
        when(blob.isDirectory()).thenReturn(false);
        when(blob.getMetadata()).thenReturn(metadata);
        return blob;
    }

    private static Map<String, String> indexMetadata(String hash, String objectName, InvoiceOwner owner) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("content-sha256", hash);
        metadata.put("invoice-object-name", objectName);
        metadata.putAll(owner.toMetadata());
        return metadata;
    }

    private static String hash(byte[] content) {
        return new Sha256ContentHasher().hash(content);
    }
}
