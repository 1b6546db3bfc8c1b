package com.sandcastle.core.health;

import com.sandcastle.sandbox.RuntimeLauncher;
import com.sandcastle.sandbox.SandboxProperties;
import com.sandcastle.storage.BlobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private SandboxProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SandboxProperties();
        properties.getRuntime().setScratchRoot(tempDir.resolve("scratch").toString());
    }

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream()
                .filter(s -> component.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns runtime, scratch and blob-store components")
    void checkAllReturnsAllComponents() {
        var results = new HealthCheckService(properties, null, null).checkAll();

        var components = results.stream().map(HealthStatus::component).toList();
        assertEquals(List.of("runtime", "scratch", "blob-store"), components);
    }

    @Test
    @DisplayName("Missing launcher -> runtime DOWN, missing blob store -> DEGRADED")
    void missingCollaborators() {
        var results = new HealthCheckService(properties, null, null).checkAll();

        assertEquals(HealthStatus.Status.DOWN, find(results, "runtime").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "blob-store").status());
        assertEquals(HealthStatus.Status.UP, find(results, "scratch").status());
    }

    @Test
    @DisplayName("Available interpreter and writable store -> all UP")
    void allUp() {
        RuntimeLauncher launcher = mock(RuntimeLauncher.class);
        when(launcher.isAvailable()).thenReturn(true);
        when(launcher.describe()).thenReturn("python3");
        BlobStore store = mock(BlobStore.class);
        when(store.isWritable()).thenReturn(true);

        var results = new HealthCheckService(properties, launcher, store).checkAll();

        results.forEach(s -> assertEquals(HealthStatus.Status.UP, s.status(), s.component()));
        assertTrue(find(results, "runtime").detail().contains("python3"));
    }

    @Test
    @DisplayName("Interpreter missing from PATH -> runtime DOWN")
    void interpreterMissing() {
        RuntimeLauncher launcher = mock(RuntimeLauncher.class);
        when(launcher.isAvailable()).thenReturn(false);
        when(launcher.describe()).thenReturn("python9");

        var runtime = find(new HealthCheckService(properties, launcher, null).checkAll(), "runtime");

        assertEquals(HealthStatus.Status.DOWN, runtime.status());
        assertTrue(runtime.detail().contains("python9"));
    }

    @Test
    @DisplayName("overall status is the worst component status")
    void overallStatus() {
        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(
                HealthStatus.up("runtime", "ok"), HealthStatus.degraded("blob-store", "read-only"))));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(
                HealthStatus.down("scratch", "gone"), HealthStatus.degraded("blob-store", "read-only"))));
    }

    @Test
    @DisplayName("scratch status carries the checked path")
    void scratchPathInMetadata() {
        var scratch = find(new HealthCheckService(properties, null, null).checkAll(), "scratch");

        assertEquals(properties.getScratchRoot().toString(), scratch.metadata().get("path"));
    }
}
