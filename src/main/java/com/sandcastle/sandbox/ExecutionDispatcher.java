package com.sandcastle.sandbox;

import com.sandcastle.core.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Sends a unit of work to a runtime and waits for it under a hard deadline.
 * <p>
 * A runtime that misses the deadline is killed: executed code is untrusted
 * and cannot be relied on to honour a cooperative stop. Nothing is retried.
 */
@Service
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private static final byte[] EMPTY = new byte[0];

    public DispatchResult execute(RuntimeHandle handle, String code, Duration timeout) {
        return invoke(handle, RuntimeProtocol.Op.EXEC, code, timeout);
    }

    public DispatchResult invoke(RuntimeHandle handle, RuntimeProtocol.Op op, String payload, Duration timeout) {
        Instant start = Instant.now();
        Instant deadline = start.plus(timeout);
        String unit = handle.nextUnit();

        try {
            handle.write(unit, RuntimeProtocol.encode(op, unit, payload));
        } catch (IOException e) {
            log.warn("Runtime process {} rejected input: {}", handle.pid(), e.getMessage());
            handle.terminate();
            var empty = new RawCapture(unit, EMPTY, EMPTY, RawCapture.End.END_OF_STREAM, false, false);
            return new DispatchResult(ExecutionStatus.FAILED, empty, elapsed(start), true,
                    "Runtime process is no longer accepting input");
        }

        RawCapture raw;
        try {
            raw = handle.readUntilIdle(unit, deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.terminate();
            var empty = new RawCapture(unit, EMPTY, EMPTY, RawCapture.End.END_OF_STREAM, false, false);
            return new DispatchResult(ExecutionStatus.FAILED, empty, elapsed(start), true,
                    "Interrupted while waiting for the runtime");
        }

        long durationMs = elapsed(start);
        return switch (raw.end()) {
            case COMPLETED -> {
                ExecutionStatus status = raw.runtimeError() ? ExecutionStatus.FAILED : ExecutionStatus.SUCCEEDED;
                log.debug("{} unit {} on process {} finished as {} in {}ms",
                        op, unit, handle.pid(), status.wire(), durationMs);
                yield new DispatchResult(status, raw, durationMs, false, null);
            }
            case DEADLINE -> {
                handle.terminate();
                log.info("{} unit {} on process {} exceeded {}ms, process killed",
                        op, unit, handle.pid(), timeout.toMillis());
                yield new DispatchResult(ExecutionStatus.TIMED_OUT, raw, durationMs, true,
                        "Execution exceeded timeout of " + timeout.toMillis() + "ms; runtime was terminated");
            }
            case END_OF_STREAM -> {
                handle.terminate();
                log.warn("Runtime process {} went away during {} unit {}", handle.pid(), op, unit);
                yield new DispatchResult(ExecutionStatus.FAILED, raw, durationMs, true,
                        "Runtime process exited unexpectedly");
            }
        };
    }

    private static long elapsed(Instant start) {
        return Duration.between(start, Instant.now()).toMillis();
    }
}
