package com.wildtrack.storage;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Durable blob storage for staged raw payloads, partitioned by integration.
 *
 * <p>Blob names are generated by the caller and are globally unique, so concurrent writers
 * never address the same blob.  The core never deletes blobs; retention belongs to the
 * storage backend.</p>
 */
public interface FileStorage {

    /**
     * Uploads a local file under {@code blobName}, replacing its metadata.
     */
    CompletableFuture<Void> upload(String integrationId, Path localFile, String blobName,
                                   Map<String, String> metadata);

    /**
     * Merges {@code metadata} into the blob's existing metadata.
     *
     * @throws BlobNotFoundException (as the future's failure) if the blob does not exist
     */
    CompletableFuture<Void> updateMetadata(String integrationId, String blobName,
                                           Map<String, String> metadata);

    /**
     * Reads the blob's content as UTF-8 text.
     *
     * @throws BlobNotFoundException (as the future's failure) if the blob does not exist
     */
    CompletableFuture<String> download(String integrationId, String blobName);

    CompletableFuture<Map<String, String>> getMetadata(String integrationId, String blobName);

    CompletableFuture<Boolean> exists(String integrationId, String blobName);
}
