package com.sandcastle.storage;

import com.sandcastle.core.error.StorageException;
import com.sandcastle.core.security.BlobTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * {@link BlobStore} over a local directory. Objects are served back through
 * the blob endpoint with a signed token in the query string.
 */
@Component
public class FileSystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    private static final Pattern KEY = Pattern.compile("[A-Za-z0-9._/-]+");
    private static final String TYPE_SUFFIX = ".content-type";

    private final Path root;
    private final String publicBaseUrl;
    private final BlobTokenService tokenService;

    public FileSystemBlobStore(StorageProperties properties, BlobTokenService tokenService) {
        this.root = properties.getRootPath().toAbsolutePath().normalize();
        this.publicBaseUrl = stripTrailingSlash(properties.getPublicBaseUrl());
        this.tokenService = tokenService;
    }

    @Override
    public String put(String keyPrefix, byte[] data, String contentType) {
        String objectKey = keyPrefix + "-" + UUID.randomUUID().toString().substring(0, 8);
        Path target = resolve(objectKey);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            Files.writeString(typeFile(target), contentType == null ? "application/octet-stream" : contentType);
        } catch (IOException e) {
            throw new StorageException("Failed to store object " + objectKey + ": " + e.getMessage(), e);
        }
        log.debug("Stored {} bytes as {}", data.length, objectKey);
        return objectKey;
    }

    @Override
    public Optional<Blob> get(String objectKey) {
        Path file = resolve(objectKey);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            byte[] data = Files.readAllBytes(file);
            Path typeFile = typeFile(file);
            String contentType = Files.exists(typeFile)
                    ? Files.readString(typeFile).trim()
                    : "application/octet-stream";
            return Optional.of(new Blob(objectKey, data, contentType));
        } catch (IOException e) {
            throw new StorageException("Failed to read object " + objectKey + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String sign(String objectKey, Duration ttl) {
        resolve(objectKey);
        String token = tokenService.issue(objectKey, Instant.now().plus(ttl));
        return publicBaseUrl + "/api/v1/blobs?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    @Override
    public boolean isWritable() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (IOException e) {
            log.warn("Blob root {} is not usable: {}", root, e.getMessage());
            return false;
        }
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String objectKey) {
        if (objectKey == null || !KEY.matcher(objectKey).matches() || objectKey.contains("..")
                || objectKey.startsWith("/") || objectKey.endsWith(TYPE_SUFFIX)) {
            throw new StorageException("Invalid object key: " + objectKey);
        }
        Path path = root.resolve(objectKey).normalize();
        if (!path.startsWith(root)) {
            throw new StorageException("Object key escapes the blob root: " + objectKey);
        }
        return path;
    }

    private static Path typeFile(Path object) {
        return object.resolveSibling(object.getFileName() + TYPE_SUFFIX);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
