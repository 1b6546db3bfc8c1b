package com.sandcastle.storage;

import com.sandcastle.core.error.StorageException;
import com.sandcastle.core.security.BlobTokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemBlobStoreTest {

    @TempDir
    Path tempDir;

    private BlobTokenService tokens;
    private FileSystemBlobStore store;

    @BeforeEach
    void setUp() {
        var props = new StorageProperties();
        props.setRoot(tempDir.toString());
        props.setPublicBaseUrl("https://sandcastle.example/");
        tokens = new BlobTokenService("test-secret-key-must-be-at-least-256-bits-long-for-hmac");
        store = new FileSystemBlobStore(props, tokens);
    }

    @Test
    void putThenGetReturnsSameBytesAndType() {
        byte[] data = "hello blob".getBytes(StandardCharsets.UTF_8);

        String key = store.put("sessions/s1/executions/1/0-text", data, "text/plain; charset=utf-8");

        assertTrue(key.startsWith("sessions/s1/executions/1/0-text-"));
        Blob blob = store.get(key).orElseThrow();
        assertArrayEquals(data, blob.data());
        assertEquals("text/plain; charset=utf-8", blob.contentType());
    }

    @Test
    void repeatedPutsGetDistinctKeys() {
        String a = store.put("p", new byte[]{1}, "application/octet-stream");
        String b = store.put("p", new byte[]{2}, "application/octet-stream");

        assertNotEquals(a, b);
        assertArrayEquals(new byte[]{1}, store.get(a).orElseThrow().data());
    }

    @Test
    void missingObjectIsEmpty() {
        assertTrue(store.get("sessions/none/x").isEmpty());
    }

    @Test
    void traversalKeysAreRejected() {
        assertThrows(StorageException.class, () -> store.get("../outside"));
        assertThrows(StorageException.class, () -> store.get("/etc/passwd"));
        assertThrows(StorageException.class, () -> store.put("a/../../b", new byte[0], "text/plain"));
    }

    @Test
    void sidecarFilesAreNotAddressable() {
        String key = store.put("p", new byte[]{1}, "text/plain");
        assertThrows(StorageException.class, () -> store.get(key + ".content-type"));
    }

    @Test
    void signedUrlCarriesTokenForKey() {
        String key = store.put("p", new byte[]{1}, "text/plain");

        String url = store.sign(key, Duration.ofMinutes(5));

        assertTrue(url.startsWith("https://sandcastle.example/api/v1/blobs?token="), url);
        String token = URLDecoder.decode(url.substring(url.indexOf("token=") + 6), StandardCharsets.UTF_8);
        assertEquals(key, tokens.resolve(token));
    }

    @Test
    void writableWhenRootCanBeCreated() {
        assertTrue(store.isWritable());
    }
}
