package com.sandcastle.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/files.
 *
 * @param filename      path relative to the session workspace
 * @param contentBase64 file content, base64-encoded
 */
public record UploadRequest(
    String filename,
    @JsonProperty("content_base64") String contentBase64
) {}
