package com.sandcastle.session;

import com.sandcastle.core.error.StorageException;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.model.ArtifactRecord;
import com.sandcastle.core.model.StorageReference;
import com.sandcastle.sandbox.SandboxProperties;
import com.sandcastle.storage.BlobPersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Files inside a session's scratch directory: caller uploads, and artifacts
 * an execution leaves behind.
 */
@Component
public class WorkspaceFiles {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceFiles.class);

    static final String CONTROL_DIR = ".sandcastle";

    private final BlobPersistenceGateway gateway;
    private final SandboxProperties properties;

    public WorkspaceFiles(BlobPersistenceGateway gateway, SandboxProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    /**
     * Size and modification time of a workspace file.
     */
    public record FileStamp(long modifiedMillis, long size) {}

    /**
     * Writes a caller-supplied file into the scratch directory.
     *
     * @return the path of the written file relative to the scratch directory
     * @throws ValidationException if the name escapes the workspace, the content is not base64, or it is too large
     */
    public String upload(Path scratchDir, String filename, String contentBase64) {
        Path target = resolveUploadTarget(scratchDir, filename);
        if (contentBase64 == null) {
            throw new ValidationException("content_base64 is required");
        }
        byte[] content;
        try {
            content = Base64.getMimeDecoder().decode(contentBase64);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("content_base64 is not valid base64", e);
        }
        if (content.length > properties.getMaxUploadBytes()) {
            throw new ValidationException("File of " + content.length + " bytes exceeds the upload limit of "
                    + properties.getMaxUploadBytes() + " bytes");
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + filename, e);
        }
        String relative = scratchDir.relativize(target).toString();
        log.info("Uploaded {} ({} bytes)", relative, content.length);
        return relative;
    }

    static Path resolveUploadTarget(Path scratchDir, String filename) {
        if (filename == null || filename.isBlank()) {
            throw new ValidationException("filename is required");
        }
        if (filename.indexOf('\0') >= 0 || filename.startsWith("/") || filename.contains("\\")) {
            throw new ValidationException("filename must be a relative path: " + filename);
        }
        Path root = scratchDir.toAbsolutePath().normalize();
        Path target = root.resolve(filename).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new ValidationException("filename escapes the session workspace: " + filename);
        }
        if (root.relativize(target).startsWith(CONTROL_DIR)) {
            throw new ValidationException("filename targets a reserved directory: " + filename);
        }
        return target;
    }

    /**
     * Stamps every regular file under {@code directory}, keyed by relative path.
     * The control directory is excluded.
     */
    static Map<String, FileStamp> snapshot(Path directory) {
        if (!Files.isDirectory(directory)) {
            return Map.of();
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> !directory.relativize(p).startsWith(CONTROL_DIR))
                .collect(Collectors.toMap(
                    p -> directory.relativize(p).toString(),
                    WorkspaceFiles::stamp
                ));
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not snapshot workspace {}: {}", directory, e.getMessage());
            return Map.of();
        }
    }

    /**
     * Compares a before-snapshot with the current state of a directory
     * to find created and modified files, sorted by path.
     */
    static List<ArtifactRecord> detectChanges(Map<String, FileStamp> before, Path directory) {
        Map<String, FileStamp> after = snapshot(directory);
        var changes = new ArrayList<ArtifactRecord>();

        for (var entry : after.entrySet()) {
            FileStamp previous = before.get(entry.getKey());
            FileStamp current = entry.getValue();
            if (previous == null) {
                changes.add(new ArtifactRecord(entry.getKey(), "created", current.size(), null));
            } else if (!previous.equals(current)) {
                changes.add(new ArtifactRecord(entry.getKey(), "modified", current.size(), null));
            }
        }
        changes.sort(Comparator.comparing(ArtifactRecord::path));
        return changes;
    }

    /**
     * Detects artifacts of execution {@code index} and, when enabled, publishes
     * them with signed URLs. A failed upload leaves the artifact unpublished.
     */
    public List<ArtifactRecord> collectArtifacts(String sessionId, int index,
                                                 Map<String, FileStamp> before, Path directory) {
        List<ArtifactRecord> changes = detectChanges(before, directory);
        if (!properties.isPublishArtifacts() || changes.isEmpty()) {
            return changes;
        }
        var published = new ArrayList<ArtifactRecord>(changes.size());
        int ordinal = 0;
        for (ArtifactRecord artifact : changes) {
            if (ordinal >= properties.getMaxPublishedArtifacts()
                    || artifact.sizeBytes() > properties.getMaxUploadBytes()) {
                published.add(artifact);
                continue;
            }
            String prefix = BlobPersistenceGateway.keyPrefix(sessionId, "executions/" + index + "/files", ordinal++, "file");
            try {
                byte[] data = Files.readAllBytes(directory.resolve(artifact.path()));
                StorageReference ref = gateway.persist(prefix, data, contentType(artifact.path()));
                published.add(artifact.withStorage(ref));
            } catch (IOException | StorageException e) {
                log.warn("Could not publish artifact {}: {}", artifact.path(), e.getMessage());
                published.add(artifact);
            }
        }
        return published;
    }

    static void deleteRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", directory, e.getMessage());
        }
    }

    private static FileStamp stamp(Path p) {
        try {
            return new FileStamp(Files.getLastModifiedTime(p).toMillis(), Files.size(p));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String contentType(String path) {
        String guessed = URLConnection.guessContentTypeFromName(path);
        return guessed != null ? guessed : "application/octet-stream";
    }
}
