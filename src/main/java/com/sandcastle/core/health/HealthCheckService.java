package com.sandcastle.core.health;

import com.sandcastle.sandbox.RuntimeLauncher;
import com.sandcastle.sandbox.SandboxProperties;
import com.sandcastle.storage.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxProperties sandboxProperties;
    private final RuntimeLauncher runtimeLauncher;
    private final BlobStore blobStore;

    public HealthCheckService(
            SandboxProperties sandboxProperties,
            @Autowired(required = false) RuntimeLauncher runtimeLauncher,
            @Autowired(required = false) BlobStore blobStore) {
        this.sandboxProperties = sandboxProperties;
        this.runtimeLauncher = runtimeLauncher;
        this.blobStore = blobStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRuntime());
        results.add(checkScratch());
        results.add(checkBlobStore());
        return results;
    }

    private HealthStatus checkRuntime() {
        if (runtimeLauncher == null) {
            return HealthStatus.down("runtime", "No RuntimeLauncher configured");
        }
        if (runtimeLauncher.isAvailable()) {
            return HealthStatus.up("runtime", "Interpreter available (" + runtimeLauncher.describe() + ")");
        }
        return HealthStatus.down("runtime", "Interpreter not found: " + runtimeLauncher.describe());
    }

    private HealthStatus checkScratch() {
        Path root = sandboxProperties.getScratchRoot();
        try {
            Files.createDirectories(root);
            if (Files.isWritable(root)) {
                return HealthStatus.up("scratch", "Scratch root writable").with("path", root.toString());
            }
            return HealthStatus.down("scratch", "Scratch root not writable").with("path", root.toString());
        } catch (IOException e) {
            log.warn("Scratch health check failed: {}", e.getMessage());
            return HealthStatus.down("scratch", "Scratch error: " + e.getMessage()).with("path", root.toString());
        }
    }

    private HealthStatus checkBlobStore() {
        if (blobStore == null) {
            return HealthStatus.degraded("blob-store", "No BlobStore configured; large outputs will be truncated");
        }
        if (blobStore.isWritable()) {
            return HealthStatus.up("blob-store", "BlobStore available (" + blobStore.getClass().getSimpleName() + ")");
        }
        return HealthStatus.degraded("blob-store", "BlobStore not writable; large outputs will be truncated");
    }
}
