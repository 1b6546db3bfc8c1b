package com.sandcastle.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sandcastle.core.model.ArtifactRecord;
import com.sandcastle.core.model.ExecutionError;
import com.sandcastle.core.model.ExecutionRecord;
import com.sandcastle.core.model.ExecutionStatus;
import com.sandcastle.core.model.OutputItem;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for a single execution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
    int index,
    ExecutionStatus status,
    List<OutputItem> outputs,
    List<ArtifactRecord> artifacts,
    @JsonProperty("duration_ms") long durationMs,
    ExecutionError error,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("ended_at") Instant endedAt
) {

    public static ExecutionResponse from(ExecutionRecord record) {
        return new ExecutionResponse(
                record.getIndex(),
                record.getStatus(),
                record.getOutputs(),
                record.getArtifacts(),
                record.getDurationMs(),
                record.getError(),
                record.getStartedAt(),
                record.getEndedAt());
    }

    /**
     * Entry in an execution listing.
     */
    public record Summary(int index, ExecutionStatus status) {

        public static Summary from(ExecutionRecord record) {
            return new Summary(record.getIndex(), record.getStatus());
        }
    }
}
