package com.sandcastle.core.security;

import com.sandcastle.core.error.SecurityViolationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies the signed tokens embedded in blob retrieval URLs.
 * The token subject is the object key; possession of an unexpired token is
 * the only authorization needed to read that object.
 */
@Service
public class BlobTokenService {

    private final SecretKey signingKey;

    public BlobTokenService(@Value("${sandcastle.security.blob-token.secret}") String secret) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public String issue(String objectKey, Instant expiresAt) {
        return Jwts.builder()
                .subject(objectKey)
                .claim("scope", "blob:read")
                .issuedAt(new Date())
                .expiration(Date.from(expiresAt))
                .signWith(signingKey)
                .compact();
    }

    /**
     * Returns the object key the token grants access to.
     *
     * @throws SecurityViolationException if the token is malformed, forged or expired
     */
    public String resolve(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            if (!"blob:read".equals(claims.get("scope", String.class))) {
                throw new SecurityViolationException("Token does not grant blob access");
            }
            return claims.getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            throw new SecurityViolationException("Invalid or expired blob token", e);
        }
    }
}
