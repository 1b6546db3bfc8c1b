package com.sandcastle.session;

import com.sandcastle.core.model.ExecutionRecord;
import com.sandcastle.core.model.SessionInfo;
import com.sandcastle.core.model.SessionState;
import com.sandcastle.sandbox.RuntimeHandle;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named, stateful runtime owned by exactly one caller-visible id.
 * <p>
 * The busy guard admits one unit of work at a time; anything arriving while
 * it is held is rejected rather than queued.
 */
public class Session {

    private final String id;
    private final String name;
    private final Instant createdAt;
    private final Path scratchDir;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.INITIALIZING);
    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final List<ExecutionRecord> executions = new ArrayList<>();

    private volatile RuntimeHandle handle;
    private volatile Instant lastActivityAt;
    private int nextIndex = 1;

    Session(String id, String name, Instant createdAt, Path scratchDir) {
        this.id = id;
        this.name = name;
        this.createdAt = createdAt;
        this.scratchDir = scratchDir;
        this.lastActivityAt = createdAt;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastActivityAt() { return lastActivityAt; }
    public Path getScratchDir() { return scratchDir; }
    public SessionState getState() { return state.get(); }

    RuntimeHandle handle() {
        return handle;
    }

    void attach(RuntimeHandle runtimeHandle) {
        this.handle = runtimeHandle;
        state.compareAndSet(SessionState.INITIALIZING, SessionState.READY);
    }

    /**
     * Swaps in a fresh runtime for a live session, leaving its state and
     * history alone.
     *
     * @return the runtime that was replaced
     */
    RuntimeHandle replaceHandle(RuntimeHandle runtimeHandle) {
        RuntimeHandle previous = this.handle;
        this.handle = runtimeHandle;
        return previous;
    }

    void touch(Instant now) {
        this.lastActivityAt = now;
    }

    boolean tryAcquire() {
        return busy.compareAndSet(false, true);
    }

    void release() {
        busy.set(false);
    }

    boolean isBusy() {
        return busy.get();
    }

    boolean beginWork() {
        return state.compareAndSet(SessionState.READY, SessionState.BUSY);
    }

    void endWork() {
        state.compareAndSet(SessionState.BUSY, SessionState.READY);
    }

    /**
     * Moves a live session to {@code CRASHED}. Returns false if it was already
     * crashed or closed.
     */
    boolean markCrashed() {
        while (true) {
            SessionState current = state.get();
            if (current == SessionState.CRASHED || current == SessionState.CLOSED) {
                return false;
            }
            if (state.compareAndSet(current, SessionState.CRASHED)) {
                return true;
            }
        }
    }

    /**
     * Returns true only for the call that performed the transition.
     */
    boolean markClosed() {
        return state.getAndSet(SessionState.CLOSED) != SessionState.CLOSED;
    }

    synchronized ExecutionRecord newExecution(String code, Instant now) {
        var record = new ExecutionRecord(nextIndex++, code, now);
        executions.add(record);
        return record;
    }

    public synchronized List<ExecutionRecord> getExecutions() {
        return List.copyOf(executions);
    }

    public synchronized Optional<ExecutionRecord> getExecution(int index) {
        return executions.stream().filter(e -> e.getIndex() == index).findFirst();
    }

    public synchronized SessionInfo info() {
        return new SessionInfo(id, name, state.get(), createdAt, lastActivityAt, executions.size());
    }
}
