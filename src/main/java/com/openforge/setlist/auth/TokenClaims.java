package com.openforge.setlist.auth;

import java.time.Instant;

/**
 * The verified content of a token.
 *
 * @param tokenId   unique id (jti), used as the revocation key
 * @param subject   the account username
 */
public record TokenClaims(
        String    tokenId,
        String    subject,
        TokenType type,
        Instant   issuedAt,
        Instant   expiresAt
) {
}
