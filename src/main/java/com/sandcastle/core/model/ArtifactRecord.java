package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A workspace file created or modified by an execution.
 *
 * @param path      path relative to the session scratch directory
 * @param action    "created" or "modified"
 * @param sizeBytes file size after the execution
 * @param storage   published copy, or null when publishing is disabled or failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtifactRecord(
    @JsonProperty("path") String path,
    @JsonProperty("action") String action,
    @JsonProperty("size_bytes") long sizeBytes,
    @JsonProperty("storage") StorageReference storage
) implements Serializable {

    public ArtifactRecord withStorage(StorageReference reference) {
        return new ArtifactRecord(path, action, sizeBytes, reference);
    }
}
