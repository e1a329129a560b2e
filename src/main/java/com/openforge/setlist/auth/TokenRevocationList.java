package com.openforge.setlist.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local deny-list of token ids.
 *
 * An entry is only kept until the token's own expiry, after which the token
 * is rejected by signature verification anyway. Other instances of the
 * service do not see these entries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenRevocationList {

    private final Map<String, Instant> revoked = new ConcurrentHashMap<>();
    private final Clock clock;

    public void revoke(TokenClaims claims) {
        purgeExpired();
        revoked.put(claims.tokenId(), claims.expiresAt());
        log.debug("[JWT] Revoked token jti={} type={} until={}", claims.tokenId(), claims.type(), claims.expiresAt());
    }

    public boolean isRevoked(String tokenId) {
        Instant until = revoked.get(tokenId);
        return until != null && clock.instant().isBefore(until);
    }

    int size() {
        return revoked.size();
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        revoked.values().removeIf(until -> !now.isBefore(until));
    }
}
