package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Detailed view of one global in a session's runtime. Array and table
 * attributes are present only when the value has them.
 *
 * @param name    variable name
 * @param type    runtime type name
 * @param repr    repr of the value, cut to 500 characters
 * @param shape   shape of array-like values
 * @param dtype   element type of array-like values
 * @param length  result of len() when supported
 * @param columns first 20 column names of table-like values
 * @param head    rendered first rows of table-like values
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariableDetail(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("repr") String repr,
    @JsonProperty("shape") String shape,
    @JsonProperty("dtype") String dtype,
    @JsonProperty("length") Long length,
    @JsonProperty("columns") List<String> columns,
    @JsonProperty("head") String head
) implements Serializable {}
