package com.sandcastle.storage;

import com.sandcastle.core.error.StorageException;
import com.sandcastle.core.metrics.SandcastleMetrics;
import com.sandcastle.core.model.StorageReference;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Persists oversized payloads and hands back signed references to them.
 * Every upload is bounded by the configured timeout.
 */
@Service
public class BlobPersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(BlobPersistenceGateway.class);

    private final BlobStore blobStore;
    private final SandcastleMetrics metrics;
    private final Duration urlTtl;
    private final Duration uploadTimeout;
    private final ExecutorService uploads;

    public BlobPersistenceGateway(BlobStore blobStore, StorageProperties properties, SandcastleMetrics metrics) {
        this.blobStore = blobStore;
        this.metrics = metrics;
        this.urlTtl = properties.getUrlTtl();
        this.uploadTimeout = properties.getUploadTimeout();
        this.uploads = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sandcastle-blob-upload");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Object key prefix for the {@code ordinal}-th payload of an execution.
     */
    public static String keyPrefix(String sessionId, String label, int ordinal, String kind) {
        return "sessions/" + sessionId + "/" + label + "/" + ordinal + "-" + kind;
    }

    /**
     * Uploads {@code data} and signs it.
     *
     * @throws StorageException if the upload fails, times out or cannot be signed
     */
    public StorageReference persist(String keyPrefix, byte[] data, String contentType) {
        Future<String> upload = uploads.submit(() -> blobStore.put(keyPrefix, data, contentType));
        String objectKey;
        try {
            objectKey = upload.get(uploadTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            upload.cancel(true);
            metrics.recordStorageFailure("put");
            throw new StorageException("Upload of " + keyPrefix + " timed out after " + uploadTimeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            metrics.recordStorageFailure("put");
            Throwable cause = e.getCause();
            if (cause instanceof StorageException se) {
                throw se;
            }
            throw new StorageException("Upload of " + keyPrefix + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            upload.cancel(true);
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while uploading " + keyPrefix, e);
        }

        Instant expiresAt = Instant.now().plus(urlTtl);
        String url;
        try {
            url = blobStore.sign(objectKey, urlTtl);
        } catch (RuntimeException e) {
            metrics.recordStorageFailure("sign");
            throw new StorageException("Could not sign " + objectKey + ": " + e.getMessage(), e);
        }
        log.info("Persisted {} bytes to {}", data.length, objectKey);
        return new StorageReference(objectKey, url, expiresAt, data.length, contentType);
    }

    public Duration getUrlTtl() {
        return urlTtl;
    }

    @PreDestroy
    public void shutdown() {
        uploads.shutdownNow();
    }
}
