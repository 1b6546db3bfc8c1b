package com.sandcastle.core.metrics;

import com.sandcastle.core.model.ExecutionStatus;
import com.sandcastle.core.model.OutputKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for session and execution lifecycle.
 */
@Service
public class SandcastleMetrics {

    private final MeterRegistry registry;

    public SandcastleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSessionCreated() {
        Counter.builder("sandcastle.sessions.created")
                .register(registry)
                .increment();
    }

    /**
     * @param reason "closed", "evicted" or "shutdown"
     */
    public void recordSessionClosed(String reason) {
        Counter.builder("sandcastle.sessions.closed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSessionCrashed() {
        Counter.builder("sandcastle.sessions.crashed")
                .register(registry)
                .increment();
    }

    public void recordSessionRestarted() {
        Counter.builder("sandcastle.sessions.restarted")
                .register(registry)
                .increment();
    }

    public void recordExecution(ExecutionStatus status, long ms) {
        Timer.builder("sandcastle.execution.duration")
                .tag("status", status.wire())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSpill(OutputKind kind, long bytes) {
        Counter.builder("sandcastle.output.spills")
                .tag("kind", kind.wire())
                .register(registry)
                .increment();
        DistributionSummary.builder("sandcastle.output.spill.bytes")
                .baseUnit("bytes")
                .register(registry)
                .record(bytes);
    }

    public void recordStorageFailure(String operation) {
        Counter.builder("sandcastle.storage.failures")
                .description("Blob store operations that failed")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordCredentialProbe(boolean blocked) {
        Counter.builder("sandcastle.security.credential_probes")
                .description("Submitted code referencing withheld environment variables")
                .tag("blocked", String.valueOf(blocked))
                .register(registry)
                .increment();
    }

    public void recordInstall(boolean success, long ms) {
        Timer.builder("sandcastle.install.duration")
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void registerActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder("sandcastle.sessions.active", activeSessions)
                .description("Sessions currently held by the registry")
                .register(registry);
    }
}
