package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Failure attached to an execution that did not complete normally.
 *
 * @param kind    stable error tag, e.g. "timeout" or "process_crash"
 * @param message human-readable detail
 */
public record ExecutionError(
    @JsonProperty("kind") String kind,
    @JsonProperty("message") String message
) implements Serializable {}
