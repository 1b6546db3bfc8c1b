package com.sandcastle.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InstallRequest(
    @JsonProperty("package_name") String packageName,
    @JsonProperty("timeout_ms") Long timeoutMs
) {}
