package com.sandcastle.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "sandcastle.storage")
public class StorageProperties {

    private String root = System.getProperty("java.io.tmpdir") + "/sandcastle-blobs";
    private String publicBaseUrl = "http://localhost:8080";
    private int urlTtlHours = 24;
    private int uploadTimeoutSeconds = 30;

    public Path getRootPath() { return Path.of(root); }
    public Duration getUrlTtl() { return Duration.ofHours(urlTtlHours); }
    public Duration getUploadTimeout() { return Duration.ofSeconds(uploadTimeoutSeconds); }

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }
    public String getPublicBaseUrl() { return publicBaseUrl; }
    public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }
    public int getUrlTtlHours() { return urlTtlHours; }
    public void setUrlTtlHours(int urlTtlHours) { this.urlTtlHours = urlTtlHours; }
    public int getUploadTimeoutSeconds() { return uploadTimeoutSeconds; }
    public void setUploadTimeoutSeconds(int uploadTimeoutSeconds) { this.uploadTimeoutSeconds = uploadTimeoutSeconds; }
}
