package com.sandcastle.sandbox;

import java.nio.file.Path;
import java.util.Map;

/**
 * Abstraction for starting runtime processes.
 * Implementations: ProcessRuntimeLauncher (local interpreter).
 */
public interface RuntimeLauncher {

    /**
     * Starts a runtime in {@code workingDirectory} with exactly the given
     * environment plus the runtime's own non-sensitive settings, and waits
     * until it is ready to accept work.
     *
     * @throws com.sandcastle.core.error.SpawnException if the process cannot be started or never becomes ready
     */
    RuntimeHandle spawn(Map<String, String> sanitizedEnv, Path workingDirectory);

    /**
     * Whether the configured runtime can be started on this host.
     */
    boolean isAvailable();

    /**
     * Short human-readable description for health output.
     */
    String describe();
}
