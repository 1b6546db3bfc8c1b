package com.sandcastle.sandbox;

import com.sandcastle.core.error.SpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Starts the bundled Python driver as a local child process.
 */
@Component
public class ProcessRuntimeLauncher implements RuntimeLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessRuntimeLauncher.class);

    static final String DRIVER_RESOURCE = "runtime/session_driver.py";
    static final String CONTROL_DIR = ".sandcastle";
    static final String PACKAGES_DIR = "packages";

    private final SandboxProperties properties;
    private final byte[] driverSource;

    public ProcessRuntimeLauncher(SandboxProperties properties) {
        this.properties = properties;
        try (InputStream in = new ClassPathResource(DRIVER_RESOURCE).getInputStream()) {
            this.driverSource = in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Runtime driver missing from classpath: " + DRIVER_RESOURCE, e);
        }
    }

    @Override
    public RuntimeHandle spawn(Map<String, String> sanitizedEnv, Path workingDirectory) {
        Path controlDir = workingDirectory.resolve(CONTROL_DIR);
        Path packagesDir = controlDir.resolve(PACKAGES_DIR);
        Path driver = controlDir.resolve("driver.py");
        try {
            Files.createDirectories(packagesDir);
            Files.write(driver, driverSource);
        } catch (IOException e) {
            throw new SpawnException("Cannot prepare runtime directory " + workingDirectory, e);
        }

        List<String> command = new ArrayList<>(properties.getInterpreter());
        command.add("-u");
        command.add(driver.toString());

        Map<String, String> env = runtimeEnvironment(sanitizedEnv, workingDirectory, packagesDir);
        ProcessBuilder pb = new ProcessBuilder(command).directory(workingDirectory.toFile());
        pb.environment().clear();
        pb.environment().putAll(env);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SpawnException("Failed to start runtime " + command + ": " + e.getMessage(), e);
        }

        var handle = new ProcessRuntimeHandle(process, workingDirectory, env, properties.getMaxCaptureBytes());
        awaitReady(handle);
        log.info("Started runtime process {} in {}", handle.pid(), workingDirectory);
        return handle;
    }

    /**
     * Sanitized input plus the settings the driver relies on. Nothing read here
     * comes from the host environment.
     */
    static Map<String, String> runtimeEnvironment(Map<String, String> sanitizedEnv,
                                                  Path workingDirectory, Path packagesDir) {
        Map<String, String> env = new LinkedHashMap<>(sanitizedEnv);
        env.putIfAbsent("PATH", "/usr/local/bin:/usr/bin:/bin");
        env.putIfAbsent("HOME", workingDirectory.toString());
        env.putIfAbsent("LANG", "C.UTF-8");
        env.put("MPLBACKEND", "Agg");
        env.put("PYTHONUNBUFFERED", "1");
        env.put("PYTHONDONTWRITEBYTECODE", "1");
        env.put("PYTHONIOENCODING", "utf-8");
        env.put("SANDCASTLE_PACKAGES_DIR", packagesDir.toString());
        return env;
    }

    private void awaitReady(ProcessRuntimeHandle handle) {
        Instant deadline = Instant.now().plusSeconds(properties.getStartupTimeoutSeconds());
        RawCapture boot;
        try {
            boot = handle.readUntilIdle(RuntimeProtocol.BOOT_UNIT, deadline);
        } catch (InterruptedException e) {
            handle.terminate();
            Thread.currentThread().interrupt();
            throw new SpawnException("Interrupted while waiting for runtime to start", e);
        }
        if (boot.end() != RawCapture.End.COMPLETED) {
            handle.terminate();
            String stderr = RuntimeProtocol.stripRecords(boot.stderr(), RuntimeProtocol.BOOT_UNIT).trim();
            throw new SpawnException("Runtime did not become ready (" + boot.end() + ")"
                    + (stderr.isEmpty() ? "" : ": " + stderr));
        }
    }

    @Override
    public boolean isAvailable() {
        List<String> interpreter = properties.getInterpreter();
        if (interpreter.isEmpty()) {
            return false;
        }
        String executable = interpreter.get(0);
        if (executable.contains("/")) {
            return Files.isExecutable(Path.of(executable));
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String describe() {
        return String.join(" ", properties.getInterpreter());
    }
}
