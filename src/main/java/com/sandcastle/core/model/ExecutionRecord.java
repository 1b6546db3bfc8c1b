package com.sandcastle.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One submitted unit of code and everything it produced.
 * <p>
 * The index is assigned at submission and never reused. Once the status is
 * terminal the record is frozen.
 */
public class ExecutionRecord {

    private final int index;
    private final String code;
    private final Instant submittedAt;

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private List<OutputItem> outputs = List.of();
    private List<ArtifactRecord> artifacts = List.of();
    private ExecutionError error;
    private Instant startedAt;
    private Instant endedAt;

    public ExecutionRecord(int index, String code, Instant submittedAt) {
        this.index = index;
        this.code = code;
        this.submittedAt = submittedAt;
    }

    public synchronized void markRunning(Instant when) {
        if (status != ExecutionStatus.PENDING) {
            throw new IllegalStateException("Execution " + index + " is already " + status.wire());
        }
        this.status = ExecutionStatus.RUNNING;
        this.startedAt = when;
    }

    public synchronized void complete(ExecutionStatus finalStatus, List<OutputItem> outputs,
                                      List<ArtifactRecord> artifacts, ExecutionError error, Instant when) {
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + finalStatus);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + index + " already finished as " + status.wire());
        }
        this.status = finalStatus;
        this.outputs = List.copyOf(outputs);
        this.artifacts = List.copyOf(artifacts);
        this.error = error;
        if (this.startedAt == null) {
            this.startedAt = when;
        }
        this.endedAt = when;
    }

    public int getIndex() { return index; }
    public String getCode() { return code; }
    public Instant getSubmittedAt() { return submittedAt; }
    public synchronized ExecutionStatus getStatus() { return status; }
    public synchronized List<OutputItem> getOutputs() { return outputs; }
    public synchronized List<ArtifactRecord> getArtifacts() { return artifacts; }
    public synchronized ExecutionError getError() { return error; }
    public synchronized Instant getStartedAt() { return startedAt; }
    public synchronized Instant getEndedAt() { return endedAt; }

    public synchronized long getDurationMs() {
        if (startedAt == null || endedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, endedAt).toMillis();
    }
}
