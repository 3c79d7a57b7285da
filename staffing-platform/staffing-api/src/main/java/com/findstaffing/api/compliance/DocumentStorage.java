package com.findstaffing.api.compliance;

import java.time.Duration;
import java.util.List;

/**
 * Binary object store holding compliance documents.
 * Implementations signal failure with {@link com.findstaffing.api.error.StorageException}.
 */
public interface DocumentStorage {

    void upload(String path, byte[] content, String contentType);

    void remove(List<String> paths);

    /**
     * Time-limited retrieval URL for a stored object.
     */
    String createSignedUrl(String path, Duration ttl);

    /**
     * Object path of a document URL previously minted by this storage, or null
     * when the URL does not point into it.
     */
    String objectPathOf(String documentUrl);
}
