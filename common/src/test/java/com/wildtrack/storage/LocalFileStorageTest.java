package com.wildtrack.storage;

import com.wildtrack.errors.WildtrackException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileStorageTest {

    private static final String INTEGRATION = "integration-1";

    @TempDir
    Path tmp;

    private LocalFileStorage storage;
    private Path localFile;

    @BeforeEach
    void setUp() throws Exception {
        storage = new LocalFileStorage(tmp.resolve("blobs"));
        localFile = tmp.resolve("payload.xml");
        Files.writeString(localFile, "<DataSet/>");
    }

    @Test
    void uploadStoresContentAndMetadata() {
        storage.upload(INTEGRATION, localFile, "a.xml", Map.of("integration_id", INTEGRATION)).join();

        assertTrue(storage.exists(INTEGRATION, "a.xml").join());
        assertEquals("<DataSet/>", storage.download(INTEGRATION, "a.xml").join());
        assertEquals(Map.of("integration_id", INTEGRATION), storage.getMetadata(INTEGRATION, "a.xml").join());
        assertTrue(Files.exists(localFile), "local file is copied, not moved");
    }

    @Test
    void updateMetadataMergesKeys() {
        storage.upload(INTEGRATION, localFile, "a.xml", Map.of("integration_id", INTEGRATION, "status", "pending")).join();

        storage.updateMetadata(INTEGRATION, "a.xml", Map.of("status", "processed")).join();

        Map<String, String> metadata = storage.getMetadata(INTEGRATION, "a.xml").join();
        assertEquals("processed", metadata.get("status"));
        assertEquals(INTEGRATION, metadata.get("integration_id"));
    }

    @Test
    void missingBlobFailsWithBlobNotFound() {
        CompletionException download = assertThrows(CompletionException.class,
                () -> storage.download(INTEGRATION, "missing.xml").join());
        assertInstanceOf(BlobNotFoundException.class, download.getCause());

        CompletionException update = assertThrows(CompletionException.class,
                () -> storage.updateMetadata(INTEGRATION, "missing.xml", Map.of("status", "pending")).join());
        assertInstanceOf(BlobNotFoundException.class, update.getCause());

        assertFalse(storage.exists(INTEGRATION, "missing.xml").join());
    }

    @Test
    void blobsArePartitionedByIntegration() {
        storage.upload(INTEGRATION, localFile, "a.xml", Map.of()).join();

        assertFalse(storage.exists("integration-2", "a.xml").join());
    }

    @Test
    void rejectsPathTraversal() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> storage.download(INTEGRATION, "../secret").join());
        assertInstanceOf(WildtrackException.class, e.getCause());
    }
}
