package com.sandcastle.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.ref.Cleaner;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link RuntimeHandle} backed by a local OS process.
 * <p>
 * Two daemon threads drain stdout and stderr into per-unit buffers. The
 * collectors only reference {@link CaptureState} and the streams, so a handle
 * that is dropped without {@link #terminate()} becomes unreachable and its
 * process is reaped by the cleaner.
 */
public class ProcessRuntimeHandle implements RuntimeHandle {

    private static final Logger log = LoggerFactory.getLogger(ProcessRuntimeHandle.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final Process process;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final CaptureState state;
    private final Cleaner.Cleanable cleanable;
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final AtomicInteger units = new AtomicInteger();

    public ProcessRuntimeHandle(Process process, Path workingDirectory,
                                Map<String, String> environment, int maxCaptureBytes) {
        this.process = process;
        this.workingDirectory = workingDirectory;
        this.environment = Map.copyOf(environment);
        this.state = new CaptureState(maxCaptureBytes);
        this.cleanable = CLEANER.register(this, new Reaper(process));

        startCollector(process.getInputStream(), state.stdout, "stdout");
        startCollector(process.getErrorStream(), state.stderr, "stderr");
        process.onExit().thenRun(state::signalAll);
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public Path workingDirectory() {
        return workingDirectory;
    }

    @Override
    public Map<String, String> environment() {
        return environment;
    }

    @Override
    public String nextUnit() {
        return RuntimeProtocol.unitId(units.incrementAndGet());
    }

    @Override
    public void write(String unit, byte[] frame) throws IOException {
        if (terminated.get()) {
            throw new IOException("Runtime process " + pid() + " was terminated");
        }
        state.begin(unit);
        OutputStream stdin = process.getOutputStream();
        stdin.write(frame);
        stdin.flush();
    }

    @Override
    public RawCapture readUntilIdle(String unit, Instant deadline) throws InterruptedException {
        return state.await(unit, deadline, terminated);
    }

    @Override
    public boolean isAlive() {
        return !terminated.get() && process.isAlive();
    }

    @Override
    public void terminate() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        log.debug("Terminating runtime process {}", pid());
        cleanable.clean();
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of process {}: {}", pid(), e.getMessage());
        }
        state.signalAll();
    }

    @Override
    public void onExit(Runnable callback) {
        process.onExit().thenRun(callback);
    }

    private void startCollector(InputStream stream, StreamCapture target, String name) {
        Thread thread = new Thread(() -> collect(stream, target, state),
                "sandcastle-" + process.pid() + "-" + name);
        thread.setDaemon(true);
        thread.start();
    }

    private static void collect(InputStream stream, StreamCapture target, CaptureState state) {
        byte[] chunk = new byte[8192];
        try (stream) {
            int n;
            while ((n = stream.read(chunk)) != -1) {
                state.append(target, chunk, n);
            }
        } catch (IOException e) {
            log.debug("Runtime stream closed: {}", e.getMessage());
        } finally {
            state.markEof(target);
        }
    }

    /**
     * Shared between the handle and its collector threads.
     */
    static final class CaptureState {

        private final ReentrantLock lock = new ReentrantLock();
        private final Condition changed = lock.newCondition();
        private final StreamCapture stdout;
        private final StreamCapture stderr;
        private String unit = RuntimeProtocol.BOOT_UNIT;

        CaptureState(int maxCaptureBytes) {
            this.stdout = new StreamCapture(maxCaptureBytes);
            this.stderr = new StreamCapture(maxCaptureBytes);
        }

        void begin(String newUnit) {
            lock.lock();
            try {
                unit = newUnit;
                stdout.reset();
                stderr.reset();
            } finally {
                lock.unlock();
            }
        }

        void append(StreamCapture target, byte[] chunk, int n) {
            lock.lock();
            try {
                target.append(chunk, n, unit);
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        void markEof(StreamCapture target) {
            lock.lock();
            try {
                target.eof = true;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        void signalAll() {
            lock.lock();
            try {
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        RawCapture await(String expectedUnit, Instant deadline, AtomicBoolean terminated)
                throws InterruptedException {
            lock.lock();
            try {
                while (true) {
                    boolean done = unit.equals(expectedUnit) && stdout.done != null && stderr.done != null;
                    if (done) {
                        boolean error = stdout.done == RuntimeProtocol.DoneStatus.ERROR
                                || stderr.done == RuntimeProtocol.DoneStatus.ERROR;
                        return snapshot(RawCapture.End.COMPLETED, error);
                    }
                    if (terminated.get() || (stdout.eof && stderr.eof)) {
                        return snapshot(RawCapture.End.END_OF_STREAM, false);
                    }
                    long remaining = Duration.between(Instant.now(), deadline).toNanos();
                    if (remaining <= 0) {
                        return snapshot(RawCapture.End.DEADLINE, false);
                    }
                    changed.awaitNanos(remaining);
                }
            } finally {
                lock.unlock();
            }
        }

        private RawCapture snapshot(RawCapture.End end, boolean error) {
            return new RawCapture(unit, stdout.bytes(), stderr.bytes(), end, error,
                    stdout.overflowed || stderr.overflowed);
        }
    }

    /**
     * Output of one stream for the current unit. Bytes past the limit are
     * dropped, but a short trailing window is still scanned for the completion
     * record.
     */
    static final class StreamCapture {

        private static final int WINDOW = 256;

        private final int limit;
        private byte[] buf = new byte[8192];
        private int len;
        private byte[] window = new byte[0];
        private boolean overflowed;
        private boolean eof;
        private RuntimeProtocol.DoneStatus done;

        StreamCapture(int limit) {
            this.limit = limit;
        }

        void reset() {
            len = 0;
            window = new byte[0];
            overflowed = false;
            done = null;
        }

        void append(byte[] chunk, int n, String unit) {
            int keep = Math.min(n, limit - len);
            if (keep > 0) {
                ensureCapacity(len + keep);
                System.arraycopy(chunk, 0, buf, len, keep);
                len += keep;
            }
            if (keep < n) {
                overflowed = true;
            }
            if (done == null) {
                byte[] scan = new byte[window.length + n];
                System.arraycopy(window, 0, scan, 0, window.length);
                System.arraycopy(chunk, 0, scan, window.length, n);
                RuntimeProtocol.DoneStatus status = RuntimeProtocol.scanDone(scan, scan.length, unit);
                if (status != RuntimeProtocol.DoneStatus.NONE) {
                    done = status;
                }
                window = Arrays.copyOfRange(scan, Math.max(0, scan.length - WINDOW), scan.length);
            }
        }

        byte[] bytes() {
            return Arrays.copyOf(buf, len);
        }

        private void ensureCapacity(int needed) {
            if (needed > buf.length) {
                buf = Arrays.copyOf(buf, Math.max(needed, buf.length * 2));
            }
        }
    }

    private static final class Reaper implements Runnable {

        private final Process process;

        Reaper(Process process) {
            this.process = process;
        }

        @Override
        public void run() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }
}
