package com.sandcastle.session;

import com.sandcastle.core.error.SessionBusyException;
import com.sandcastle.core.error.SessionNotFoundException;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.model.ExecutionStatus;
import com.sandcastle.core.model.InstallResult;
import com.sandcastle.core.model.SessionState;
import com.sandcastle.sandbox.DispatchResult;
import com.sandcastle.sandbox.ExecutionDispatcher;
import com.sandcastle.sandbox.FakeRuntimeHandle;
import com.sandcastle.sandbox.RawCapture;
import com.sandcastle.sandbox.RuntimeProtocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PackageInstallerTest {

    @TempDir
    Path tempDir;

    private RegistryFixture fixture;
    private PackageInstaller installer;

    @BeforeEach
    void setUp() {
        fixture = new RegistryFixture(tempDir);
        installer = new PackageInstaller(fixture.registry, new ExecutionDispatcher(),
                fixture.timeoutPolicy(), fixture.metrics);
    }

    @AfterEach
    void tearDown() {
        fixture.registry.shutdownAll();
    }

    private static FakeRuntimeHandle.Script report(boolean success, String message) {
        String json = "{\"success\":" + success + ",\"message\":\"" + message + "\"}";
        return FakeRuntimeHandle.ok(FakeRuntimeHandle.displayFrame(RuntimeProtocol.INSTALL_MIME,
                json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("a successful install reports the runtime's message")
    void success() {
        String id = fixture.registry.create("x");
        fixture.runtime(0).then(report(true, "Successfully installed six-1.16.0"));

        InstallResult result = installer.installPackage(id, "six==1.16.0", null);

        assertTrue(result.success());
        assertEquals("six==1.16.0", result.packageName());
        assertEquals("Successfully installed six-1.16.0", result.message());
        var command = fixture.runtime(0).received().get(0);
        assertEquals(RuntimeProtocol.Op.INSTALL, command.op());
        assertTrue(command.payload().contains("\"name\":\"six==1.16.0\""));
        assertTrue(command.payload().contains("\"timeout_seconds\":115"));
    }

    @Test
    @DisplayName("a pip failure is a result, not an exception, and the session stays usable")
    void failure() {
        String id = fixture.registry.create("x");
        fixture.runtime(0).then(report(false, "No matching distribution found for nosuchpkg"));

        InstallResult result = installer.installPackage(id, "nosuchpkg", null);

        assertFalse(result.success());
        assertTrue(result.message().contains("No matching distribution"));
        assertEquals(SessionState.READY, fixture.registry.get(id).getState());
        assertEquals(1.0, fixture.meterRegistry.find("sandcastle.install.duration")
                .tag("success", "false").timer().count());
    }

    @Test
    @DisplayName("an install past the deadline is reported and crashes the session")
    void timeout() {
        String id = fixture.registry.create("x");
        fixture.runtime(0).then(FakeRuntimeHandle.hang(""));

        InstallResult result = installer.installPackage(id, "numpy", 2_000L);

        assertFalse(result.success());
        assertTrue(result.message().contains("timeout"), result.message());
        assertEquals(SessionState.CRASHED, fixture.registry.get(id).getState());
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 500L, 1_100L, 1_999L})
    @DisplayName("a timeout too short for the installer is refused before anything runs")
    void rejectsTimeoutBelowFloor(long timeoutMs) {
        String id = fixture.registry.create("x");

        assertThrows(ValidationException.class, () -> installer.installPackage(id, "requests", timeoutMs));

        assertTrue(fixture.runtime(0).received().isEmpty());
        assertEquals(SessionState.READY, fixture.registry.get(id).getState());
    }

    @Test
    @DisplayName("the shortest accepted timeout still gives the installer its own earlier deadline")
    void floorTimeoutIsAccepted() {
        String id = fixture.registry.create("x");
        fixture.runtime(0).then(report(true, "Requirement already satisfied: requests"));

        InstallResult result = installer.installPackage(id, "requests", PackageInstaller.MIN_TIMEOUT.toMillis());

        assertTrue(result.success());
        assertTrue(fixture.runtime(0).received().get(0).payload().contains("\"timeout_seconds\":1"));
        assertEquals(SessionState.READY, fixture.registry.get(id).getState());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "--index-url=http://evil", "-r requirements.txt", "six; rm -rf /", "../pkg", "a b"})
    void rejectsNonRequirements(String name) {
        String id = fixture.registry.create("x");
        assertThrows(ValidationException.class, () -> installer.installPackage(id, name, null));
        assertTrue(fixture.runtime(0).received().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"requests", "pandas>=2.0", "uvicorn[standard]", "scikit-learn==1.4.2", "zope.interface"})
    void acceptsRequirements(String name) {
        assertTrue(PackageInstaller.PACKAGE_SPEC.matcher(name).matches());
    }

    @Test
    void unknownSession() {
        assertThrows(SessionNotFoundException.class, () -> installer.installPackage("nope", "six", null));
    }

    @Test
    void busySessionRejectsInstall() {
        String id = fixture.registry.create("x");
        fixture.registry.withExclusive(id, session -> {
            assertThrows(SessionBusyException.class, () -> installer.installPackage(id, "six", null));
            return null;
        });
    }

    @Test
    void innerTimeoutLeavesHeadroom() {
        assertEquals(115, PackageInstaller.innerTimeoutSeconds(Duration.ofSeconds(120)));
        assertEquals(9, PackageInstaller.innerTimeoutSeconds(Duration.ofSeconds(10)));
        assertEquals(1, PackageInstaller.innerTimeoutSeconds(Duration.ofMillis(2_500)));
        for (long ms = PackageInstaller.MIN_TIMEOUT.toMillis(); ms <= 20_000; ms += 250) {
            assertTrue(PackageInstaller.innerTimeoutSeconds(Duration.ofMillis(ms)) * 1000 < ms, "at " + ms + " ms");
        }
    }

    @Test
    void missingReportIsFailure() {
        var raw = new RawCapture("1-00", new byte[0], new byte[0], RawCapture.End.COMPLETED, false, false);
        InstallResult result = PackageInstaller.interpret("six",
                new DispatchResult(ExecutionStatus.SUCCEEDED, raw, 5, false, null));

        assertFalse(result.success());
        assertEquals(5, result.durationMs());
    }
}
