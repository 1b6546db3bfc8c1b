package com.sandcastle.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/executions.
 *
 * @param code        source to run in the session
 * @param timeoutMs   timeout in milliseconds; nullable, defaults per timeout class
 * @param longRunning selects the long-running timeout class; nullable, defaults to false
 */
public record ExecuteRequest(
    String code,
    @JsonProperty("timeout_ms") Long timeoutMs,
    @JsonProperty("long_running") Boolean longRunning
) {}
