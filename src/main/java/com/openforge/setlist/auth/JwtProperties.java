package com.openforge.setlist.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Token signing configuration.
 *
 * application.yml:
 *
 * app:
 *   jwt:
 *     secret: ${SETLIST_JWT_SECRET}   # at least 32 bytes, no default
 *     issuer: setlist
 *     access-token-ttl: 30m
 *     refresh-token-ttl: 7d
 */
@ConfigurationProperties(prefix = "app.jwt")
public record JwtProperties(
        String secret,
        @DefaultValue("setlist") String   issuer,
        @DefaultValue("30m")     Duration accessTokenTtl,
        @DefaultValue("7d")      Duration refreshTokenTtl
) {

    public static final int MIN_SECRET_BYTES = 32;

    public JwtProperties {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("app.jwt.secret must be set (env SETLIST_JWT_SECRET)");
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("app.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (accessTokenTtl.isNegative() || accessTokenTtl.isZero()) {
            throw new IllegalStateException("app.jwt.access-token-ttl must be positive");
        }
        if (refreshTokenTtl.compareTo(accessTokenTtl) <= 0) {
            throw new IllegalStateException("app.jwt.refresh-token-ttl must be longer than the access token ttl");
        }
    }
}
