package com.sandcastle.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "sandcastle")
public class SandboxProperties {

    private Runtime runtime = new Runtime();
    private Timeouts timeouts = new Timeouts();
    private Output output = new Output();
    private Sessions sessions = new Sessions();
    private Workspace workspace = new Workspace();

    // -- Runtime accessors (delegate to nested) --
    public List<String> getInterpreter() { return runtime.interpreter; }
    public Path getScratchRoot() { return Path.of(runtime.scratchRoot); }
    public int getStartupTimeoutSeconds() { return runtime.startupTimeoutSeconds; }

    // -- Output accessors --
    public int getTextInlineLimitBytes() { return output.textInlineLimitBytes; }
    public int getImageInlineLimitBytes() { return output.imageInlineLimitBytes; }
    public int getMaxCaptureBytes() { return output.maxCaptureBytes; }

    // -- Session accessors --
    public int getMaxSessions() { return sessions.maxSessions; }
    public int getIdleRetentionMinutes() { return sessions.idleRetentionMinutes; }
    public int getSweepIntervalSeconds() { return sessions.sweepIntervalSeconds; }
    public int getMaxCodeBytes() { return sessions.maxCodeBytes; }

    // -- Workspace accessors --
    public long getMaxUploadBytes() { return workspace.maxUploadBytes; }
    public boolean isPublishArtifacts() { return workspace.publishArtifacts; }
    public int getMaxPublishedArtifacts() { return workspace.maxPublishedArtifacts; }

    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }
    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }
    public Sessions getSessions() { return sessions; }
    public void setSessions(Sessions sessions) { this.sessions = sessions; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }

    public static class Runtime {
        private List<String> interpreter = List.of("python3");
        private String scratchRoot = System.getProperty("java.io.tmpdir") + "/sandcastle";
        private int startupTimeoutSeconds = 20;

        public List<String> getInterpreter() { return interpreter; }
        public void setInterpreter(List<String> interpreter) { this.interpreter = interpreter; }
        public String getScratchRoot() { return scratchRoot; }
        public void setScratchRoot(String scratchRoot) { this.scratchRoot = scratchRoot; }
        public int getStartupTimeoutSeconds() { return startupTimeoutSeconds; }
        public void setStartupTimeoutSeconds(int startupTimeoutSeconds) { this.startupTimeoutSeconds = startupTimeoutSeconds; }
    }

    /**
     * Default and ceiling per timeout class, in milliseconds.
     */
    public static class Timeouts {
        private Window adHoc = new Window(30_000, 30_000);
        private Window longRunning = new Window(300_000, 900_000);
        private Window install = new Window(120_000, 600_000);

        public Window getAdHoc() { return adHoc; }
        public void setAdHoc(Window adHoc) { this.adHoc = adHoc; }
        public Window getLongRunning() { return longRunning; }
        public void setLongRunning(Window longRunning) { this.longRunning = longRunning; }
        public Window getInstall() { return install; }
        public void setInstall(Window install) { this.install = install; }
    }

    public static class Window {
        private long defaultMs;
        private long maxMs;

        public Window() {}

        public Window(long defaultMs, long maxMs) {
            this.defaultMs = defaultMs;
            this.maxMs = maxMs;
        }

        public long getDefaultMs() { return defaultMs; }
        public void setDefaultMs(long defaultMs) { this.defaultMs = defaultMs; }
        public long getMaxMs() { return maxMs; }
        public void setMaxMs(long maxMs) { this.maxMs = maxMs; }
    }

    public static class Output {
        private int textInlineLimitBytes = 64 * 1024;
        private int imageInlineLimitBytes = 4 * 1024 * 1024;
        private int maxCaptureBytes = 64 * 1024 * 1024;

        public int getTextInlineLimitBytes() { return textInlineLimitBytes; }
        public void setTextInlineLimitBytes(int textInlineLimitBytes) { this.textInlineLimitBytes = textInlineLimitBytes; }
        public int getImageInlineLimitBytes() { return imageInlineLimitBytes; }
        public void setImageInlineLimitBytes(int imageInlineLimitBytes) { this.imageInlineLimitBytes = imageInlineLimitBytes; }
        public int getMaxCaptureBytes() { return maxCaptureBytes; }
        public void setMaxCaptureBytes(int maxCaptureBytes) { this.maxCaptureBytes = maxCaptureBytes; }
    }

    public static class Sessions {
        private int maxSessions = 32;
        private int idleRetentionMinutes = 60;
        private int sweepIntervalSeconds = 60;
        private int maxCodeBytes = 1024 * 1024;

        public int getMaxSessions() { return maxSessions; }
        public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
        public int getIdleRetentionMinutes() { return idleRetentionMinutes; }
        public void setIdleRetentionMinutes(int idleRetentionMinutes) { this.idleRetentionMinutes = idleRetentionMinutes; }
        public int getSweepIntervalSeconds() { return sweepIntervalSeconds; }
        public void setSweepIntervalSeconds(int sweepIntervalSeconds) { this.sweepIntervalSeconds = sweepIntervalSeconds; }
        public int getMaxCodeBytes() { return maxCodeBytes; }
        public void setMaxCodeBytes(int maxCodeBytes) { this.maxCodeBytes = maxCodeBytes; }
    }

    public static class Workspace {
        private long maxUploadBytes = 50L * 1024 * 1024;
        private boolean publishArtifacts = true;
        private int maxPublishedArtifacts = 20;

        public long getMaxUploadBytes() { return maxUploadBytes; }
        public void setMaxUploadBytes(long maxUploadBytes) { this.maxUploadBytes = maxUploadBytes; }
        public boolean isPublishArtifacts() { return publishArtifacts; }
        public void setPublishArtifacts(boolean publishArtifacts) { this.publishArtifacts = publishArtifacts; }
        public int getMaxPublishedArtifacts() { return maxPublishedArtifacts; }
        public void setMaxPublishedArtifacts(int maxPublishedArtifacts) { this.maxPublishedArtifacts = maxPublishedArtifacts; }
    }
}
