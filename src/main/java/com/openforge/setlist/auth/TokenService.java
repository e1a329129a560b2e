package com.openforge.setlist.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HMAC-signed, time-limited bearer tokens.
 *
 * Stateless: nothing about an issued token is stored here. Revocation lives
 * in {@link TokenRevocationList}.
 */
@Slf4j
@Component
public class TokenService {

    static final String TYPE_CLAIM = "typ";

    private final SecretKey     key;
    private final JwtProperties properties;
    private final Clock         clock;

    public TokenService(JwtProperties properties, Clock clock) {
        this.key        = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
        this.properties = properties;
        this.clock      = clock;
    }

    /** Issue a token of the given type with its configured ttl. */
    public String issue(String subject, TokenType type) {
        return issue(subject, type, ttlFor(type));
    }

    /** Issue a signed token; expiry is issue-time + ttl. */
    public String issue(String subject, TokenType type, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Token subject must not be blank");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(properties.issuer())
                .subject(subject)
                .claim(TYPE_CLAIM, type.claimValue())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key)
                .compact();
    }

    /**
     * Verify signature, expiry and shape of a token.
     *
     * @throws TokenException with INVALID_SIGNATURE, EXPIRED or MALFORMED
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenException(TokenException.Reason.MALFORMED, "Token is empty");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenException(TokenException.Reason.EXPIRED, "Token expired", e);
        } catch (SignatureException e) {
            throw new TokenException(TokenException.Reason.INVALID_SIGNATURE, "Signature mismatch", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenException(TokenException.Reason.MALFORMED, e.getMessage(), e);
        }

        // the padding bits of the last base64url character are not covered by
        // the HMAC, so only the canonical spelling of a signature is accepted
        if (!hasCanonicalSignature(token)) {
            throw new TokenException(TokenException.Reason.INVALID_SIGNATURE, "Non-canonical signature encoding");
        }

        Date expiration = claims.getExpiration();
        if (expiration == null) {
            throw new TokenException(TokenException.Reason.MALFORMED, "Token has no expiry");
        }
        // exp is second-granular; a token is dead from its expiry instant on
        Instant expiresAt = expiration.toInstant();
        if (!clock.instant().isBefore(expiresAt)) {
            throw new TokenException(TokenException.Reason.EXPIRED, "Token expired");
        }

        String subject = claims.getSubject();
        String tokenId = claims.getId();
        if (subject == null || subject.isBlank() || tokenId == null) {
            throw new TokenException(TokenException.Reason.MALFORMED, "Token is missing sub or jti");
        }
        TokenType type = TokenType.fromClaim(claims.get(TYPE_CLAIM, String.class))
                .orElseThrow(() -> new TokenException(TokenException.Reason.MALFORMED, "Unknown token type"));

        Date issuedAt = claims.getIssuedAt();
        return new TokenClaims(
                tokenId,
                subject,
                type,
                issuedAt != null ? issuedAt.toInstant() : null,
                expiresAt);
    }

    private static boolean hasCanonicalSignature(String token) {
        String signature = token.substring(token.lastIndexOf('.') + 1);
        return Encoders.BASE64URL.encode(Decoders.BASE64URL.decode(signature)).equals(signature);
    }

    public Duration ttlFor(TokenType type) {
        return type == TokenType.REFRESH ? properties.refreshTokenTtl() : properties.accessTokenTtl();
    }
}
