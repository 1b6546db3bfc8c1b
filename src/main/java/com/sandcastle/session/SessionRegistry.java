package com.sandcastle.session;

import com.sandcastle.core.error.CapacityExceededException;
import com.sandcastle.core.error.ProcessCrashException;
import com.sandcastle.core.error.SessionBusyException;
import com.sandcastle.core.error.SessionNotFoundException;
import com.sandcastle.core.error.SpawnException;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.logging.MdcContext;
import com.sandcastle.core.metrics.SandcastleMetrics;
import com.sandcastle.core.model.ExecutionError;
import com.sandcastle.core.model.ExecutionRecord;
import com.sandcastle.core.model.ExecutionStatus;
import com.sandcastle.core.model.OutputItem;
import com.sandcastle.core.model.SessionInfo;
import com.sandcastle.core.model.SessionState;
import com.sandcastle.core.security.CredentialProbeDetector;
import com.sandcastle.core.security.EnvironmentSanitizer;
import com.sandcastle.sandbox.DispatchResult;
import com.sandcastle.sandbox.ExecutionDispatcher;
import com.sandcastle.sandbox.RuntimeHandle;
import com.sandcastle.sandbox.RuntimeLauncher;
import com.sandcastle.sandbox.SandboxProperties;
import com.sandcastle.sandbox.TimeoutClass;
import com.sandcastle.sandbox.TimeoutPolicy;
import com.sandcastle.sandbox.output.OutputCapture;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns every live session and routes work to them.
 * <p>
 * The table lock covers only insertion and removal. Spawning, executing and
 * tearing down happen outside it, so one slow session never stalls another.
 * Within a session, the busy guard serializes work and rejects overlap.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock tableLock = new ReentrantLock();

    private final SandboxProperties properties;
    private final EnvironmentSanitizer sanitizer;
    private final RuntimeLauncher launcher;
    private final ExecutionDispatcher dispatcher;
    private final OutputCapture outputCapture;
    private final WorkspaceFiles workspaceFiles;
    private final CredentialProbeDetector probeDetector;
    private final TimeoutPolicy timeoutPolicy;
    private final SandcastleMetrics metrics;
    private final Supplier<Map<String, String>> ambientEnvironment;
    private final Clock clock;

    @Autowired
    public SessionRegistry(SandboxProperties properties, EnvironmentSanitizer sanitizer,
                           RuntimeLauncher launcher, ExecutionDispatcher dispatcher,
                           OutputCapture outputCapture, WorkspaceFiles workspaceFiles,
                           CredentialProbeDetector probeDetector, TimeoutPolicy timeoutPolicy,
                           SandcastleMetrics metrics) {
        this(properties, sanitizer, launcher, dispatcher, outputCapture, workspaceFiles,
                probeDetector, timeoutPolicy, metrics, System::getenv, Clock.systemUTC());
    }

    SessionRegistry(SandboxProperties properties, EnvironmentSanitizer sanitizer,
                    RuntimeLauncher launcher, ExecutionDispatcher dispatcher,
                    OutputCapture outputCapture, WorkspaceFiles workspaceFiles,
                    CredentialProbeDetector probeDetector, TimeoutPolicy timeoutPolicy,
                    SandcastleMetrics metrics, Supplier<Map<String, String>> ambientEnvironment,
                    Clock clock) {
        this.properties = properties;
        this.sanitizer = sanitizer;
        this.launcher = launcher;
        this.dispatcher = dispatcher;
        this.outputCapture = outputCapture;
        this.workspaceFiles = workspaceFiles;
        this.probeDetector = probeDetector;
        this.timeoutPolicy = timeoutPolicy;
        this.metrics = metrics;
        this.ambientEnvironment = ambientEnvironment;
        this.clock = clock;
        metrics.registerActiveSessions(sessions::size);
    }

    /**
     * Starts a new session with its own runtime process and scratch directory.
     *
     * @return the new session id
     * @throws CapacityExceededException if the session limit is reached
     * @throws SpawnException if the runtime cannot be started
     */
    public String create(String name) {
        String id = UUID.randomUUID().toString();
        Path scratchDir = properties.getScratchRoot().toAbsolutePath().resolve("session_" + id);
        var session = new Session(id, name == null || name.isBlank() ? id : name, clock.instant(), scratchDir);

        tableLock.lock();
        try {
            if (sessions.size() >= properties.getMaxSessions()) {
                throw new CapacityExceededException(properties.getMaxSessions());
            }
            sessions.put(id, session);
        } finally {
            tableLock.unlock();
        }

        MdcContext.setSession(id);
        try {
            Files.createDirectories(scratchDir);
            Map<String, String> env = sanitizer.sanitize(ambientEnvironment.get());
            RuntimeHandle handle = launcher.spawn(env, scratchDir);
            session.attach(handle);
            handle.onExit(() -> onProcessExit(session, handle));
        } catch (IOException e) {
            discard(session);
            throw new SpawnException("Cannot create scratch directory " + scratchDir, e);
        } catch (RuntimeException e) {
            discard(session);
            throw e;
        } finally {
            MdcContext.clear();
        }

        metrics.recordSessionCreated();
        log.info("Created session {} ({})", id, session.getName());
        return id;
    }

    /**
     * @throws SessionNotFoundException if no session has this id
     */
    public Session get(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public List<SessionInfo> list() {
        var infos = new ArrayList<SessionInfo>();
        for (Session session : sessions.values()) {
            infos.add(session.info());
        }
        infos.sort(Comparator.comparing(SessionInfo::createdAt));
        return infos;
    }

    public int activeCount() {
        return sessions.size();
    }

    /**
     * Terminates the runtime and removes the session. A running execution is
     * cut short and reported as failed.
     */
    public void close(String sessionId) {
        Session session = remove(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        shutdown(session, "closed");
    }

    /**
     * Runs {@code code} in the session and returns the finished record.
     *
     * @param timeoutMs   requested timeout, or null for the class default
     * @param longRunning selects the long-running timeout class
     * @throws SessionBusyException   if the session is already running something
     * @throws ProcessCrashException  if the session's runtime is gone
     */
    public ExecutionRecord submit(String sessionId, String code, Long timeoutMs, boolean longRunning) {
        if (code == null) {
            throw new ValidationException("code is required");
        }
        if (code.getBytes(StandardCharsets.UTF_8).length > properties.getMaxCodeBytes()) {
            throw new ValidationException("code exceeds " + properties.getMaxCodeBytes() + " bytes");
        }
        Duration timeout = timeoutPolicy.resolve(longRunning ? TimeoutClass.LONG_RUNNING : TimeoutClass.AD_HOC, timeoutMs);

        return withExclusive(sessionId, session -> {
            probeDetector.inspect(sessionId, code);
            ExecutionRecord record = session.newExecution(code, clock.instant());
            MdcContext.setExecution(sessionId, record.getIndex());
            try {
                return run(session, record, timeout);
            } finally {
                MdcContext.setSession(sessionId);
            }
        });
    }

    /**
     * Runs {@code work} while holding the session's busy guard. Used by every
     * operation that talks to the runtime or its workspace.
     *
     * @throws SessionBusyException  if the guard is held
     * @throws ProcessCrashException if the session has crashed
     */
    public <T> T withExclusive(String sessionId, Function<Session, T> work) {
        Session session = get(sessionId);
        requireUsable(session);
        if (!session.tryAcquire()) {
            throw new SessionBusyException(sessionId);
        }
        MdcContext.setSession(sessionId);
        try {
            requireUsable(session);
            if (!session.beginWork()) {
                throw new SessionBusyException(sessionId);
            }
            try {
                return work.apply(session);
            } finally {
                session.endWork();
            }
        } finally {
            session.touch(clock.instant());
            session.release();
            MdcContext.clear();
        }
    }

    /**
     * Replaces the session's runtime with a fresh one in the same scratch
     * directory. Globals and installed-but-unimported modules are gone
     * afterwards; files, execution history and numbering are kept. If the new
     * runtime cannot be started the old one stays in place.
     *
     * @throws SessionBusyException  if the session is running something
     * @throws ProcessCrashException if the session has already crashed
     * @throws SpawnException        if the new runtime cannot be started
     */
    public SessionInfo restart(String sessionId) {
        Session restarted = withExclusive(sessionId, session -> {
            Map<String, String> env = sanitizer.sanitize(ambientEnvironment.get());
            RuntimeHandle fresh = launcher.spawn(env, session.getScratchDir());
            RuntimeHandle previous = session.replaceHandle(fresh);
            fresh.onExit(() -> onProcessExit(session, fresh));
            if (previous != null) {
                previous.terminate();
            }
            metrics.recordSessionRestarted();
            log.info("Restarted runtime of session {}", sessionId);
            return session;
        });
        return restarted.info();
    }

    public String uploadFile(String sessionId, String filename, String contentBase64) {
        return withExclusive(sessionId,
                session -> workspaceFiles.upload(session.getScratchDir(), filename, contentBase64));
    }

    /**
     * Closes sessions idle for longer than {@code retention}. Sessions with
     * work in flight are skipped.
     *
     * @return number of sessions evicted
     */
    public int evictIdle(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (Session session : List.copyOf(sessions.values())) {
            if (!session.getLastActivityAt().isBefore(cutoff) || !session.tryAcquire()) {
                continue;
            }
            try {
                if (session.getLastActivityAt().isBefore(cutoff) && remove(session.getId()) != null) {
                    log.info("Evicting session {} idle since {}", session.getId(), session.getLastActivityAt());
                    shutdown(session, "evicted");
                    evicted++;
                }
            } finally {
                session.release();
            }
        }
        return evicted;
    }

    /**
     * Records that the session's runtime is gone. Later submissions fail with
     * {@link ProcessCrashException}.
     */
    void markCrashed(Session session, String reason) {
        if (session.markCrashed()) {
            metrics.recordSessionCrashed();
            log.warn("Session {} crashed: {}", session.getId(), reason);
        }
    }

    @PreDestroy
    public void shutdownAll() {
        for (Session session : List.copyOf(sessions.values())) {
            if (remove(session.getId()) != null) {
                shutdown(session, "shutdown");
            }
        }
    }

    private ExecutionRecord run(Session session, ExecutionRecord record, Duration timeout) {
        Instant started = clock.instant();
        record.markRunning(started);
        Path scratchDir = session.getScratchDir();
        var before = WorkspaceFiles.snapshot(scratchDir);

        try {
            DispatchResult result = dispatcher.execute(session.handle(), record.getCode(), timeout);
            List<OutputItem> outputs = outputCapture.capture(result, session.getId(), "executions/" + record.getIndex());
            var artifacts = workspaceFiles.collectArtifacts(session.getId(), record.getIndex(), before, scratchDir);

            ExecutionError error = null;
            if (result.failure() != null) {
                String kind = result.status() == ExecutionStatus.TIMED_OUT ? "timeout" : "process_crash";
                error = new ExecutionError(kind, result.failure());
            }
            if (result.processLost()) {
                markCrashed(session, result.failure());
            }
            record.complete(result.status(), outputs, artifacts, error, started.plusMillis(result.durationMs()));
            metrics.recordExecution(result.status(), result.durationMs());
            log.info("Execution {} finished as {} in {}ms", record.getIndex(), result.status().wire(), result.durationMs());
            return record;
        } catch (RuntimeException e) {
            if (!record.getStatus().isTerminal()) {
                record.complete(ExecutionStatus.FAILED, List.of(), List.of(),
                        new ExecutionError("internal_error", e.getMessage()), clock.instant());
            }
            throw e;
        }
    }

    private void requireUsable(Session session) {
        SessionState state = session.getState();
        if (state == SessionState.CRASHED) {
            throw new ProcessCrashException("Session " + session.getId()
                    + " has crashed; close it and create a new one");
        }
        if (state == SessionState.CLOSED) {
            throw new SessionNotFoundException(session.getId());
        }
    }

    private void onProcessExit(Session session, RuntimeHandle exited) {
        if (session.handle() == exited && session.getState() != SessionState.CLOSED) {
            markCrashed(session, "runtime process exited");
        }
    }

    private Session remove(String sessionId) {
        tableLock.lock();
        try {
            return sessionId == null ? null : sessions.remove(sessionId);
        } finally {
            tableLock.unlock();
        }
    }

    private void discard(Session session) {
        remove(session.getId());
        session.markClosed();
        WorkspaceFiles.deleteRecursively(session.getScratchDir());
    }

    private void shutdown(Session session, String reason) {
        if (!session.markClosed()) {
            return;
        }
        RuntimeHandle handle = session.handle();
        if (handle != null) {
            handle.terminate();
        }
        WorkspaceFiles.deleteRecursively(session.getScratchDir());
        metrics.recordSessionClosed(reason);
        log.info("Session {} {}", session.getId(), reason);
    }
}
