package com.sandcastle.dispatch.api;

import com.sandcastle.core.security.BlobTokenService;
import com.sandcastle.storage.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves spilled payloads to holders of a signed token.
 */
@RestController
@RequestMapping("/api/v1/blobs")
public class BlobController {

    private static final Logger log = LoggerFactory.getLogger(BlobController.class);

    private final BlobTokenService tokenService;
    private final BlobStore blobStore;

    public BlobController(BlobTokenService tokenService, BlobStore blobStore) {
        this.tokenService = tokenService;
        this.blobStore = blobStore;
    }

    /**
     * GET /api/v1/blobs?token=...: 403 for a bad or expired token, 404 once the object is gone.
     */
    @GetMapping
    public ResponseEntity<byte[]> fetch(@RequestParam("token") String token) {
        String objectKey = tokenService.resolve(token);
        return blobStore.get(objectKey)
                .map(blob -> ResponseEntity.ok()
                        .contentType(mediaType(blob.contentType()))
                        .header(HttpHeaders.CACHE_CONTROL, "private, no-store")
                        .header("X-Content-Type-Options", "nosniff")
                        .body(blob.data()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static MediaType mediaType(String stored) {
        try {
            return MediaType.parseMediaType(stored);
        } catch (InvalidMediaTypeException e) {
            log.warn("Serving blob with unparseable content type '{}' as octet-stream", stored);
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
