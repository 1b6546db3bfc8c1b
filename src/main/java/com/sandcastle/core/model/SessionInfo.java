package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Read-only summary of a session for listings.
 */
public record SessionInfo(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("name") String name,
    @JsonProperty("state") SessionState state,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_activity_at") Instant lastActivityAt,
    @JsonProperty("execution_count") int executionCount
) implements Serializable {}
