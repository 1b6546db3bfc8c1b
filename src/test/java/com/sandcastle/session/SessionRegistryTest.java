package com.sandcastle.session;

import com.sandcastle.core.error.CapacityExceededException;
import com.sandcastle.core.error.ProcessCrashException;
import com.sandcastle.core.error.SecurityViolationException;
import com.sandcastle.core.error.SessionBusyException;
import com.sandcastle.core.error.SessionNotFoundException;
import com.sandcastle.core.error.SpawnException;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.metrics.SandcastleMetrics;
import com.sandcastle.core.model.ExecutionRecord;
import com.sandcastle.core.model.ExecutionStatus;
import com.sandcastle.core.model.SessionState;
import com.sandcastle.core.model.StorageReference;
import com.sandcastle.core.security.CredentialProbeDetector;
import com.sandcastle.core.security.EnvironmentSanitizer;
import com.sandcastle.core.security.SecurityProperties;
import com.sandcastle.sandbox.ExecutionDispatcher;
import com.sandcastle.sandbox.FakeRuntimeHandle;
import com.sandcastle.sandbox.RuntimeLauncher;
import com.sandcastle.sandbox.SandboxProperties;
import com.sandcastle.sandbox.TimeoutPolicy;
import com.sandcastle.sandbox.output.OutputCapture;
import com.sandcastle.storage.BlobPersistenceGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SessionRegistryTest {

    private static final Map<String, String> HOST_ENV = Map.of(
            "PATH", "/usr/bin:/bin",
            "AWS_SECRET_ACCESS_KEY", "s3cr3t",
            "AWS_LAMBDA_FUNCTION_NAME", "fn",
            "SANDCASTLE_BLOB_SECRET", "host-signing-secret",
            "APP_MODE", "test");

    @TempDir
    Path tempDir;

    private SandboxProperties props;
    private SecurityProperties securityProps;
    private RuntimeLauncher launcher;
    private BlobPersistenceGateway gateway;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private final List<FakeRuntimeHandle> spawned = new CopyOnWriteArrayList<>();
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        props = new SandboxProperties();
        props.getRuntime().setScratchRoot(tempDir.toString());
        props.getSessions().setMaxSessions(2);
        securityProps = new SecurityProperties();
        launcher = mock(RuntimeLauncher.class);
        when(launcher.spawn(any(), any())).thenAnswer(inv -> {
            var handle = new FakeRuntimeHandle(inv.getArgument(1), inv.getArgument(0));
            spawned.add(handle);
            return handle;
        });
        gateway = mock(BlobPersistenceGateway.class);
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = newRegistry();
    }

    @AfterEach
    void tearDown() {
        registry.shutdownAll();
    }

    private SessionRegistry newRegistry() {
        var metrics = new SandcastleMetrics(meterRegistry);
        var sanitizer = new EnvironmentSanitizer(List.of(), List.of());
        return new SessionRegistry(props, sanitizer, launcher, new ExecutionDispatcher(),
                new OutputCapture(gateway, props, metrics), new WorkspaceFiles(gateway, props),
                new CredentialProbeDetector(sanitizer, metrics, securityProps), new TimeoutPolicy(props),
                metrics, () -> HOST_ENV, clock);
    }

    @Nested
    class Lifecycle {

        @Test
        @DisplayName("create spawns a runtime with a sanitized environment")
        @SuppressWarnings("unchecked")
        void createSanitizesEnvironment() {
            String id = registry.create("analysis");

            ArgumentCaptor<Map<String, String>> env = ArgumentCaptor.forClass(Map.class);
            verify(launcher).spawn(env.capture(), any());
            assertEquals("/usr/bin:/bin", env.getValue().get("PATH"));
            assertEquals("test", env.getValue().get("APP_MODE"));
            assertFalse(env.getValue().containsKey("AWS_SECRET_ACCESS_KEY"));
            assertFalse(env.getValue().containsKey("AWS_LAMBDA_FUNCTION_NAME"));
            assertFalse(env.getValue().containsKey("SANDCASTLE_BLOB_SECRET"));
            assertFalse(env.getValue().containsValue("host-signing-secret"));

            Session session = registry.get(id);
            assertEquals("analysis", session.getName());
            assertEquals(SessionState.READY, session.getState());
            assertTrue(Files.isDirectory(session.getScratchDir()));
            assertTrue(session.getScratchDir().startsWith(tempDir));
        }

        @Test
        @DisplayName("sessions get distinct ids and scratch directories")
        void distinctSessions() {
            String a = registry.create(null);
            String b = registry.create(null);

            assertNotEquals(a, b);
            assertNotEquals(registry.get(a).getScratchDir(), registry.get(b).getScratchDir());
            assertEquals(a, registry.get(a).getName());
            assertEquals(2, registry.list().size());
        }

        @Test
        @DisplayName("create beyond the limit is rejected until a session closes")
        void capacity() {
            String first = registry.create("a");
            registry.create("b");

            assertThrows(CapacityExceededException.class, () -> registry.create("c"));

            registry.close(first);
            assertDoesNotThrow(() -> registry.create("c"));
        }

        @Test
        @DisplayName("a failed spawn leaves nothing behind")
        void spawnFailure() throws IOException {
            doThrow(new SpawnException("no python")).when(launcher).spawn(any(), any());

            assertThrows(SpawnException.class, () -> registry.create("x"));

            assertTrue(registry.list().isEmpty());
            try (var entries = Files.list(tempDir)) {
                assertEquals(0, entries.count());
            }
        }

        @Test
        @DisplayName("close terminates the runtime and removes the workspace")
        void close() {
            String id = registry.create("x");
            Path scratch = registry.get(id).getScratchDir();

            registry.close(id);

            assertTrue(spawned.get(0).isTerminated());
            assertFalse(Files.exists(scratch));
            assertThrows(SessionNotFoundException.class, () -> registry.get(id));
            assertThrows(SessionNotFoundException.class, () -> registry.close(id));
            assertEquals(1.0, meterRegistry.find("sandcastle.sessions.closed").tag("reason", "closed").counter().count());
        }

        @Test
        void unknownSessionIsNotFound() {
            assertThrows(SessionNotFoundException.class, () -> registry.get("nope"));
            assertThrows(SessionNotFoundException.class, () -> registry.submit("nope", "1", null, false));
        }

        @Test
        @DisplayName("list is ordered by creation time")
        void listOrder() {
            String a = registry.create("a");
            clock.advance(Duration.ofSeconds(1));
            String b = registry.create("b");

            var ids = registry.list().stream().map(i -> i.sessionId()).toList();
            assertEquals(List.of(a, b), ids);
        }
    }

    @Nested
    class Execution {

        @Test
        @DisplayName("each submission gets the next index and is kept in history")
        void historyIndexes() {
            String id = registry.create("x");
            spawned.get(0).then(FakeRuntimeHandle.ok("4\n")).then(FakeRuntimeHandle.ok("5\n"));

            ExecutionRecord first = registry.submit(id, "2 + 2", null, false);
            ExecutionRecord second = registry.submit(id, "2 + 3", null, false);

            assertEquals(1, first.getIndex());
            assertEquals(2, second.getIndex());
            assertEquals(ExecutionStatus.SUCCEEDED, first.getStatus());
            assertEquals("4\n", first.getOutputs().get(0).inline());
            assertEquals(2, registry.get(id).info().executionCount());
            assertSame(second, registry.get(id).getExecution(2).orElseThrow());
            assertEquals(List.of("2 + 2", "2 + 3"),
                    spawned.get(0).received().stream().map(FakeRuntimeHandle.Command::payload).toList());
        }

        @Test
        @DisplayName("a runtime error fails the execution but keeps the session")
        void runtimeError() {
            String id = registry.create("x");
            spawned.get(0).then(FakeRuntimeHandle.failed("", "NameError", "name 'y' is not defined"));

            ExecutionRecord record = registry.submit(id, "y", null, false);

            assertEquals(ExecutionStatus.FAILED, record.getStatus());
            assertNull(record.getError());
            assertEquals(SessionState.READY, registry.get(id).getState());
        }

        @Test
        @DisplayName("a timeout kills the runtime and marks the session crashed")
        void timeoutCrashesSession() {
            String id = registry.create("x");
            spawned.get(0).then(FakeRuntimeHandle.hang("tick\n"));

            ExecutionRecord record = registry.submit(id, "while True: pass", 100L, false);

            assertEquals(ExecutionStatus.TIMED_OUT, record.getStatus());
            assertEquals("timeout", record.getError().kind());
            assertEquals("tick\n", record.getOutputs().get(0).inline());
            assertEquals(SessionState.CRASHED, registry.get(id).getState());
            assertThrows(ProcessCrashException.class, () -> registry.submit(id, "1", null, false));
            assertEquals(1, registry.list().size());
            assertEquals(1.0, meterRegistry.find("sandcastle.sessions.crashed").counter().count());
        }

        @Test
        @DisplayName("a runtime that exits on its own crashes the session")
        void processExit() {
            String id = registry.create("x");
            spawned.get(0).then(FakeRuntimeHandle.exit("Killed"));

            ExecutionRecord record = registry.submit(id, "import os; os._exit(9)", null, false);

            assertEquals(ExecutionStatus.FAILED, record.getStatus());
            assertEquals("process_crash", record.getError().kind());
            assertEquals(SessionState.CRASHED, registry.get(id).getState());
        }

        @Test
        @DisplayName("overlapping work on one session is rejected, not queued")
        void busyRejected() throws Exception {
            String id = registry.create("x");
            var started = new CountDownLatch(1);
            spawned.get(0).then((unit, deadline, handle) -> {
                started.countDown();
                return FakeRuntimeHandle.hang("").run(unit, deadline, handle);
            });

            var first = CompletableFuture.supplyAsync(() -> registry.submit(id, "import time; time.sleep(60)", 5_000L, false));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertThrows(SessionBusyException.class, () -> registry.submit(id, "1", null, false));
            assertThrows(SessionBusyException.class, () -> registry.uploadFile(id, "a.txt", "eA=="));
            assertEquals(SessionState.BUSY, registry.get(id).getState());

            registry.close(id);
            ExecutionRecord record = first.get(5, TimeUnit.SECONDS);
            assertEquals(ExecutionStatus.FAILED, record.getStatus());
        }

        @Test
        @DisplayName("sessions run independently of each other")
        void independentSessions() throws Exception {
            String slow = registry.create("slow");
            String fast = registry.create("fast");
            var started = new CountDownLatch(1);
            spawned.get(0).then((unit, deadline, handle) -> {
                started.countDown();
                return FakeRuntimeHandle.hang("").run(unit, deadline, handle);
            });
            spawned.get(1).then(FakeRuntimeHandle.ok("done\n"));

            var pending = CompletableFuture.supplyAsync(() -> registry.submit(slow, "sleep", 5_000L, false));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertEquals(ExecutionStatus.SUCCEEDED, registry.submit(fast, "x", null, false).getStatus());

            registry.close(slow);
            pending.get(5, TimeUnit.SECONDS);
        }

        @Test
        void codeIsValidated() {
            String id = registry.create("x");
            props.getSessions().setMaxCodeBytes(8);

            assertThrows(ValidationException.class, () -> registry.submit(id, null, null, false));
            assertThrows(ValidationException.class, () -> registry.submit(id, "x = 123456789", null, false));
            assertThrows(ValidationException.class, () -> registry.submit(id, "1", 0L, false));
            assertTrue(registry.get(id).getExecutions().isEmpty());
        }

        @Test
        @DisplayName("blocked credential probes never reach the runtime")
        void blockedProbe() {
            securityProps.setBlockCredentialProbes(true);
            registry = newRegistry();
            String id = registry.create("x");

            assertThrows(SecurityViolationException.class,
                    () -> registry.submit(id, "import os; os.environ['AWS_SECRET_ACCESS_KEY']", null, false));

            assertTrue(spawned.get(0).received().isEmpty());
            assertEquals(SessionState.READY, registry.get(id).getState());
        }

        @Test
        @DisplayName("files written during an execution are reported and published")
        void artifacts() {
            when(gateway.persist(anyString(), any(), anyString())).thenReturn(
                    new StorageReference("k", "http://blobs/k", Instant.now().plusSeconds(60), 5, "text/plain"));
            String id = registry.create("x");
            Path scratch = registry.get(id).getScratchDir();
            spawned.get(0).then((unit, deadline, handle) -> {
                try {
                    Files.writeString(scratch.resolve("report.txt"), "hello");
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return FakeRuntimeHandle.ok("").run(unit, deadline, handle);
            });

            ExecutionRecord record = registry.submit(id, "open('report.txt','w').write('hello')", null, false);

            assertEquals(1, record.getArtifacts().size());
            var artifact = record.getArtifacts().get(0);
            assertEquals("report.txt", artifact.path());
            assertEquals("created", artifact.action());
            assertEquals("http://blobs/k", artifact.storage().url());
        }
    }

    @Nested
    class Restart {

        @Test
        @DisplayName("restart swaps in a fresh runtime and keeps files and history")
        @SuppressWarnings("unchecked")
        void freshRuntimeSameWorkspace() throws IOException {
            String id = registry.create("x");
            Path scratch = registry.get(id).getScratchDir();
            Files.writeString(scratch.resolve("kept.txt"), "still here");
            spawned.get(0).then(FakeRuntimeHandle.ok(""));
            registry.submit(id, "x = 1", null, false);

            var info = registry.restart(id);

            assertEquals(SessionState.READY, info.state());
            assertEquals(1, info.executionCount());
            assertEquals(2, spawned.size());
            assertTrue(spawned.get(0).isTerminated());
            assertFalse(spawned.get(1).isTerminated());
            assertEquals(scratch, spawned.get(1).workingDirectory());
            assertFalse(spawned.get(1).environment().containsKey("SANDCASTLE_BLOB_SECRET"));
            assertTrue(Files.exists(scratch.resolve("kept.txt")));
            assertEquals(SessionState.READY, registry.get(id).getState());
            assertEquals(1.0, meterRegistry.find("sandcastle.sessions.restarted").counter().count());
            assertNull(meterRegistry.find("sandcastle.sessions.crashed").counter());

            spawned.get(1).then(FakeRuntimeHandle.ok("2\n"));
            ExecutionRecord next = registry.submit(id, "print(2)", null, false);
            assertEquals(2, next.getIndex());
            assertEquals(1, spawned.get(1).received().size());
            assertEquals(1, spawned.get(0).received().size());
        }

        @Test
        @DisplayName("a failed respawn keeps the old runtime in place")
        void spawnFailureKeepsOldRuntime() {
            String id = registry.create("x");
            doThrow(new SpawnException("no python")).when(launcher).spawn(any(), any());

            assertThrows(SpawnException.class, () -> registry.restart(id));

            assertFalse(spawned.get(0).isTerminated());
            assertEquals(SessionState.READY, registry.get(id).getState());
            spawned.get(0).then(FakeRuntimeHandle.ok("ok\n"));
            assertEquals(ExecutionStatus.SUCCEEDED, registry.submit(id, "print('ok')", null, false).getStatus());
        }

        @Test
        @DisplayName("crashed and unknown sessions cannot be restarted")
        void onlyLiveSessions() {
            String id = registry.create("x");
            spawned.get(0).then(FakeRuntimeHandle.exit("Killed"));
            registry.submit(id, "import os; os._exit(9)", null, false);

            assertThrows(ProcessCrashException.class, () -> registry.restart(id));
            assertThrows(SessionNotFoundException.class, () -> registry.restart("nope"));
            assertEquals(1, spawned.size());
        }

        @Test
        @DisplayName("restart is rejected while the session is running something")
        void busySessionRejectsRestart() {
            String id = registry.create("x");
            registry.withExclusive(id, session -> {
                assertThrows(SessionBusyException.class, () -> registry.restart(id));
                return null;
            });
            assertEquals(1, spawned.size());
        }
    }

    @Nested
    class Eviction {

        @Test
        @DisplayName("idle sessions past retention are closed")
        void evictsIdle() {
            String id = registry.create("x");
            clock.advance(Duration.ofHours(2));

            assertEquals(1, registry.evictIdle(Duration.ofHours(1)));

            assertThrows(SessionNotFoundException.class, () -> registry.get(id));
            assertTrue(spawned.get(0).isTerminated());
        }

        @Test
        @DisplayName("recent activity keeps a session alive")
        void activityResetsIdleTimer() {
            String id = registry.create("x");
            clock.advance(Duration.ofMinutes(50));
            registry.submit(id, "1", null, false);
            clock.advance(Duration.ofMinutes(50));

            assertEquals(0, registry.evictIdle(Duration.ofHours(1)));
            assertNotNull(registry.get(id));
        }

        @Test
        @DisplayName("a session with work in flight is never evicted")
        void busyNotEvicted() throws Exception {
            String id = registry.create("x");
            var started = new CountDownLatch(1);
            spawned.get(0).then((unit, deadline, handle) -> {
                started.countDown();
                return FakeRuntimeHandle.hang("").run(unit, deadline, handle);
            });
            var pending = CompletableFuture.supplyAsync(() -> registry.submit(id, "sleep", 5_000L, false));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            clock.advance(Duration.ofHours(2));

            assertEquals(0, registry.evictIdle(Duration.ofHours(1)));

            registry.close(id);
            pending.get(5, TimeUnit.SECONDS);
        }

        @Test
        void housekeeperSweepDelegatesToRegistry() {
            props.getSessions().setIdleRetentionMinutes(30);
            registry.create("x");
            clock.advance(Duration.ofMinutes(31));

            assertEquals(1, new SessionHousekeeper(registry, props).sweep());
        }
    }
}
