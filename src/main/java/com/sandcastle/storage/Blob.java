package com.sandcastle.storage;

/**
 * A stored object read back from a {@link BlobStore}.
 */
public record Blob(String objectKey, byte[] data, String contentType) {}
