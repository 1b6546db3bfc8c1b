package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A public global defined in a session's runtime.
 *
 * @param name    variable name
 * @param type    runtime type name
 * @param summary shortened repr of the value
 */
public record VariableInfo(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("summary") String summary
) implements Serializable {}
