package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Pointer to a payload persisted in the blob store.
 *
 * @param objectKey   key under which the payload was stored
 * @param url         signed, time-limited retrieval URL
 * @param expiresAt   instant after which {@code url} stops working
 * @param sizeBytes   payload size
 * @param contentType MIME type recorded with the object
 */
public record StorageReference(
    @JsonProperty("object_key") String objectKey,
    @JsonProperty("url") String url,
    @JsonProperty("expires_at") Instant expiresAt,
    @JsonProperty("size_bytes") long sizeBytes,
    @JsonProperty("content_type") String contentType
) implements Serializable {}
