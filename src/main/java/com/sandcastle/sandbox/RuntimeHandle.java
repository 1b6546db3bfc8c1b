package com.sandcastle.sandbox;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Exclusive channel to one runtime process. A handle is owned by exactly one
 * session and is never shared.
 */
public interface RuntimeHandle {

    long pid();

    Path workingDirectory();

    /**
     * Snapshot of the sanitized environment the process was started with.
     */
    Map<String, String> environment();

    /**
     * Reserves the identifier for the next command, see {@link RuntimeProtocol#unitId(int)}.
     */
    String nextUnit();

    /**
     * Starts collecting output for {@code unit} and sends the encoded command.
     *
     * @throws IOException if the process no longer accepts input
     */
    void write(String unit, byte[] frame) throws IOException;

    /**
     * Blocks until {@code unit} completes on both streams, the deadline passes
     * or the process goes away, whichever comes first.
     */
    RawCapture readUntilIdle(String unit, Instant deadline) throws InterruptedException;

    boolean isAlive();

    /**
     * Kills the process and its descendants and wakes any pending read.
     * Safe to call more than once and from any thread.
     */
    void terminate();

    /**
     * Registers a callback run once when the process exits for any reason.
     */
    void onExit(Runnable callback);
}
