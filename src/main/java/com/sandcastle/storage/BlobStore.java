package com.sandcastle.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Object storage used for payloads too large to return inline.
 * Implementations: FileSystemBlobStore (local directory).
 */
public interface BlobStore {

    /**
     * Stores {@code data} under a new key starting with {@code keyPrefix}.
     *
     * @return the object key
     * @throws com.sandcastle.core.error.StorageException if the object cannot be written
     */
    String put(String keyPrefix, byte[] data, String contentType);

    Optional<Blob> get(String objectKey);

    /**
     * Returns a URL through which the object can be fetched until {@code ttl} elapses.
     */
    String sign(String objectKey, Duration ttl);

    /**
     * Whether objects can currently be written.
     */
    boolean isWritable();
}
