package com.openforge.setlist.auth;

import com.openforge.setlist.domain.Account;
import com.openforge.setlist.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns credentials or a bearer token into a verified {@link Account}.
 *
 * Unknown identifier and wrong password both end in INVALID_CREDENTIALS.
 * The deactivation check runs only after the password matched. A successful
 * login stamps {@code last_login_time} without dirtying the managed entity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Authenticator {

    /**
     * Well-formed BCrypt string that matches no password. Checked when the
     * identifier is unknown so both failure paths pay for one hash.
     */
    static final String TIMING_DUMMY_HASH =
            "$2a$10$7EqJtq98hPqEX7fNZaFWoOhi5BWX4Z3ySE1nbV1dOeZqwbv9YxN1G";

    private final AccountRepository   accountRepository;
    private final CredentialHasher    credentialHasher;
    private final TokenService        tokenService;
    private final TokenRevocationList revocationList;
    private final Clock               clock;

    /** Login by username or email plus password. */
    @Transactional
    public Account authenticateByPassword(String identifier, String password) {
        Optional<Account> found = lookup(identifier);

        if (found.isEmpty()) {
            credentialHasher.verify(password, TIMING_DUMMY_HASH);
            log.info("[Auth] Login rejected: no account for identifier");
            throw new AuthException(AuthError.INVALID_CREDENTIALS);
        }

        Account account = found.get();
        if (!credentialHasher.verify(password, account.getPasswordHash())) {
            log.info("[Auth] Login rejected: bad password for accountId={}", account.getId());
            throw new AuthException(AuthError.INVALID_CREDENTIALS);
        }

        if (!account.isActive()) {
            log.info("[Auth] Login rejected: accountId={} is deactivated", account.getId());
            throw new AuthException(AuthError.ACCOUNT_DEACTIVATED);
        }

        accountRepository.stampLastLogin(account.getId(), LocalDateTime.now(clock));
        return account;
    }

    /** Resolve an access token to its account. */
    @Transactional(readOnly = true)
    public Account authenticateByToken(String token) {
        return resolveSubject(verifyToken(token, TokenType.ACCESS));
    }

    /** Same as {@link #authenticateByToken} but keeps the token claims for the security context. */
    @Transactional(readOnly = true)
    public AccountPrincipal authenticateBearer(String token) {
        TokenClaims claims = verifyToken(token, TokenType.ACCESS);
        return AccountPrincipal.of(resolveSubject(claims), claims);
    }

    /**
     * Verify a token and check that it has the expected type and has not
     * been revoked.
     */
    public TokenClaims verifyToken(String token, TokenType expectedType) {
        TokenClaims claims;
        try {
            claims = tokenService.verify(token);
        } catch (TokenException e) {
            log.debug("[JWT] Token rejected: reason={} detail={}", e.getReason(), e.getMessage());
            AuthError error = e.getReason() == TokenException.Reason.EXPIRED
                    ? AuthError.TOKEN_EXPIRED
                    : AuthError.TOKEN_INVALID;
            throw new AuthException(error, e);
        }

        if (claims.type() != expectedType) {
            log.debug("[JWT] Token rejected: type={} expected={}", claims.type(), expectedType);
            throw new AuthException(AuthError.TOKEN_INVALID);
        }
        if (revocationList.isRevoked(claims.tokenId())) {
            log.debug("[JWT] Token rejected: jti={} is revoked", claims.tokenId());
            throw new AuthException(AuthError.TOKEN_INVALID);
        }
        return claims;
    }

    /** The subject must still name an active account. */
    public Account resolveSubject(TokenClaims claims) {
        Account account = accountRepository.findByUsername(claims.subject())
                .orElseThrow(() -> {
                    log.debug("[JWT] Token subject no longer resolves: {}", claims.subject());
                    return new AuthException(AuthError.INVALID_CREDENTIALS);
                });
        if (!account.isActive()) {
            throw new AuthException(AuthError.ACCOUNT_DEACTIVATED);
        }
        return account;
    }

    private Optional<Account> lookup(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String key = identifier.trim();
        return accountRepository.findByUsernameOrEmail(key, key.toLowerCase(Locale.ROOT));
    }
}
