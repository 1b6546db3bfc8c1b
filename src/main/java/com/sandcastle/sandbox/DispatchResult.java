package com.sandcastle.sandbox;

import com.sandcastle.core.model.ExecutionStatus;

/**
 * Outcome of sending one unit of work to a runtime.
 *
 * @param status      terminal status of the unit
 * @param capture     everything the runtime wrote, possibly partial
 * @param durationMs  wall-clock time from write to completion
 * @param processLost true when the runtime is gone, either killed on timeout or exited on its own
 * @param failure     description of a timeout or crash, null otherwise
 */
public record DispatchResult(
    ExecutionStatus status,
    RawCapture capture,
    long durationMs,
    boolean processLost,
    String failure
) {}
