package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Outcome of a package installation. Failures are values, not exceptions.
 */
public record InstallResult(
    @JsonProperty("package_name") String packageName,
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("duration_ms") long durationMs
) implements Serializable {}
