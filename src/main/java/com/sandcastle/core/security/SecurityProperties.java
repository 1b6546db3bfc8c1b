package com.sandcastle.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "sandcastle.security")
public class SecurityProperties {

    private BlobToken blobToken = new BlobToken();
    private List<String> extraDeniedVariables = List.of();
    private List<String> extraAllowedVariables = List.of();
    private boolean blockCredentialProbes = false;

    public BlobToken getBlobToken() {
        return blobToken;
    }

    public void setBlobToken(BlobToken blobToken) {
        this.blobToken = blobToken;
    }

    public List<String> getExtraDeniedVariables() {
        return extraDeniedVariables;
    }

    public void setExtraDeniedVariables(List<String> extraDeniedVariables) {
        this.extraDeniedVariables = extraDeniedVariables;
    }

    public List<String> getExtraAllowedVariables() {
        return extraAllowedVariables;
    }

    public void setExtraAllowedVariables(List<String> extraAllowedVariables) {
        this.extraAllowedVariables = extraAllowedVariables;
    }

    public boolean isBlockCredentialProbes() {
        return blockCredentialProbes;
    }

    public void setBlockCredentialProbes(boolean blockCredentialProbes) {
        this.blockCredentialProbes = blockCredentialProbes;
    }

    public static class BlobToken {
        private String secret = "sandcastle-dev-blob-secret-change-in-production";

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }
    }
}
