package com.wildtrack.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildtrack.errors.WildtrackException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * {@link FileStorage} backed by a local directory tree.
 *
 * <p>Layout: {@code <root>/<integrationId>/<blobName>} for content and
 * {@code <root>/<integrationId>/<blobName>.metadata.json} for metadata.  Blocking file I/O
 * runs on the supplied executor so callers only ever see futures.</p>
 */
@Slf4j
public class LocalFileStorage implements FileStorage {

    private static final String METADATA_SUFFIX = ".metadata.json";

    private final Path root;
    private final Executor executor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LocalFileStorage(Path root) {
        this(root, ForkJoinPool.commonPool());
    }

    public LocalFileStorage(Path root, Executor executor) {
        this.root = root;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> upload(String integrationId, Path localFile, String blobName,
                                          Map<String, String> metadata) {
        return CompletableFuture.runAsync(() -> {
            Path target = blobPath(integrationId, blobName);
            try {
                Files.createDirectories(target.getParent());
                Files.copy(localFile, target, StandardCopyOption.REPLACE_EXISTING);
                writeMetadata(metadataPath(integrationId, blobName), metadata);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to upload " + blobName, e);
            }
            log.info("Uploaded '{}' for integration {} ({} metadata keys)",
                    blobName, integrationId, metadata.size());
        }, executor);
    }

    @Override
    public CompletableFuture<Void> updateMetadata(String integrationId, String blobName,
                                                  Map<String, String> metadata) {
        return CompletableFuture.runAsync(() -> {
            requireBlob(integrationId, blobName);
            Path metadataPath = metadataPath(integrationId, blobName);
            try {
                Map<String, String> merged = readMetadata(metadataPath);
                merged.putAll(metadata);
                writeMetadata(metadataPath, merged);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to update metadata of " + blobName, e);
            }
            log.debug("Updated metadata of '{}' for integration {}: {}", blobName, integrationId, metadata);
        }, executor);
    }

    @Override
    public CompletableFuture<String> download(String integrationId, String blobName) {
        return CompletableFuture.supplyAsync(() -> {
            Path blob = requireBlob(integrationId, blobName);
            try {
                return Files.readString(blob, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + blobName, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Map<String, String>> getMetadata(String integrationId, String blobName) {
        return CompletableFuture.supplyAsync(() -> {
            requireBlob(integrationId, blobName);
            try {
                return readMetadata(metadataPath(integrationId, blobName));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read metadata of " + blobName, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Boolean> exists(String integrationId, String blobName) {
        return CompletableFuture.supplyAsync(
                () -> Files.isRegularFile(blobPath(integrationId, blobName)), executor);
    }

    // ──────────────────────── internals ──────────────────────────────────

    private Path requireBlob(String integrationId, String blobName) {
        Path blob = blobPath(integrationId, blobName);
        if (!Files.isRegularFile(blob)) {
            throw new BlobNotFoundException(integrationId, blobName);
        }
        return blob;
    }

    private Path blobPath(String integrationId, String blobName) {
        if (blobName.contains("/") || blobName.contains("\\") || blobName.startsWith(".")) {
            throw new WildtrackException("Illegal blob name: " + blobName);
        }
        return root.resolve(integrationId).resolve(blobName);
    }

    private Path metadataPath(String integrationId, String blobName) {
        return blobPath(integrationId, blobName + METADATA_SUFFIX);
    }

    private Map<String, String> readMetadata(Path metadataPath) throws IOException {
        if (!Files.exists(metadataPath)) {
            return new LinkedHashMap<>();
        }
        return objectMapper.readValue(metadataPath.toFile(), new TypeReference<LinkedHashMap<String, String>>() {});
    }

    private void writeMetadata(Path metadataPath, Map<String, String> metadata) throws IOException {
        objectMapper.writeValue(metadataPath.toFile(), metadata);
    }
}
