package com.wildtrack.storage;

import com.wildtrack.errors.WildtrackException;

public class BlobNotFoundException extends WildtrackException {

    private static final long serialVersionUID = 1L;

    public BlobNotFoundException(String integrationId, String blobName) {
        super("Blob '" + blobName + "' not found for integration " + integrationId);
    }
}
