package com.sandcastle.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.metrics.SandcastleMetrics;
import com.sandcastle.core.model.ExecutionStatus;
import com.sandcastle.core.model.InstallResult;
import com.sandcastle.sandbox.DispatchResult;
import com.sandcastle.sandbox.ExecutionDispatcher;
import com.sandcastle.sandbox.RuntimeProtocol;
import com.sandcastle.sandbox.TimeoutClass;
import com.sandcastle.sandbox.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Installs packages into a session's private package directory.
 * <p>
 * The installer inside the runtime gets a slightly shorter timeout than the
 * dispatcher deadline, so a slow install comes back as a failed result while
 * the session stays usable. Failures are reported, never thrown. Timeouts
 * shorter than {@link #MIN_TIMEOUT} leave no room for that and are refused.
 */
@Service
public class PackageInstaller {

    private static final Logger log = LoggerFactory.getLogger(PackageInstaller.class);

    /** Requirement name with optional extras and a single version clause. */
    static final Pattern PACKAGE_SPEC = Pattern.compile(
            "[A-Za-z0-9][A-Za-z0-9._-]*(\\[[A-Za-z0-9,._-]+])?((==|>=|<=|~=|!=|>|<)[A-Za-z0-9.*+!_-]+)?");

    /** Shortest install timeout that still leaves the installer a second of its own. */
    static final Duration MIN_TIMEOUT = Duration.ofSeconds(2);

    private static final ObjectMapper JSON = new ObjectMapper();

    private final SessionRegistry registry;
    private final ExecutionDispatcher dispatcher;
    private final TimeoutPolicy timeoutPolicy;
    private final SandcastleMetrics metrics;

    public PackageInstaller(SessionRegistry registry, ExecutionDispatcher dispatcher,
                            TimeoutPolicy timeoutPolicy, SandcastleMetrics metrics) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.timeoutPolicy = timeoutPolicy;
        this.metrics = metrics;
    }

    /**
     * @throws ValidationException if {@code packageName} is not a plain requirement
     *                             or the timeout is shorter than {@link #MIN_TIMEOUT}
     */
    public InstallResult installPackage(String sessionId, String packageName, Long timeoutMs) {
        if (packageName == null || !PACKAGE_SPEC.matcher(packageName.trim()).matches()) {
            throw new ValidationException("Invalid package name: " + packageName);
        }
        String name = packageName.trim();
        Duration timeout = timeoutPolicy.resolve(TimeoutClass.INSTALL, timeoutMs);
        if (timeout.compareTo(MIN_TIMEOUT) < 0) {
            throw new ValidationException("Install timeout must be at least " + MIN_TIMEOUT.toMillis()
                    + " ms, got " + timeout.toMillis() + " ms");
        }

        return registry.withExclusive(sessionId, session -> {
            log.info("Installing {} into session {}", name, sessionId);
            DispatchResult result = dispatcher.invoke(session.handle(), RuntimeProtocol.Op.INSTALL,
                    payload(name, innerTimeoutSeconds(timeout)), timeout);
            if (result.processLost()) {
                registry.markCrashed(session, result.failure());
            }
            InstallResult outcome = interpret(name, result);
            metrics.recordInstall(outcome.success(), outcome.durationMs());
            log.info("Install of {} {}: {}", name, outcome.success() ? "succeeded" : "failed", outcome.message());
            return outcome;
        });
    }

    /**
     * Seconds the runtime-side installer may use, always ending at least one
     * second before the dispatcher deadline.
     */
    static long innerTimeoutSeconds(Duration timeout) {
        long headroomMs = Math.max(1_000, Math.min(5_000, timeout.toMillis() / 10));
        return Math.max(1, (timeout.toMillis() - headroomMs) / 1000);
    }

    static InstallResult interpret(String name, DispatchResult result) {
        if (result.status() == ExecutionStatus.SUCCEEDED) {
            Map<String, Object> report = RuntimeProtocol.findStructured(
                    RuntimeProtocol.parseStdout(result.capture().stdout(), result.capture().unit()),
                    RuntimeProtocol.INSTALL_MIME, new TypeReference<Map<String, Object>>() {});
            if (report != null) {
                return new InstallResult(name, Boolean.TRUE.equals(report.get("success")),
                        String.valueOf(report.getOrDefault("message", "")), result.durationMs());
            }
            return new InstallResult(name, false, "Runtime returned no install report", result.durationMs());
        }
        String message = result.failure() != null
                ? result.failure()
                : RuntimeProtocol.stripRecords(result.capture().stderr(), result.capture().unit()).trim();
        return new InstallResult(name, false, message.isEmpty() ? "Install failed" : message, result.durationMs());
    }

    private static String payload(String name, long timeoutSeconds) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("timeout_seconds", timeoutSeconds);
        try {
            return JSON.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode install request", e);
        }
    }
}
