package com.openforge.setlist.auth;

import com.openforge.setlist.auth.dto.AccountResponse;
import com.openforge.setlist.auth.dto.LoginRequest;
import com.openforge.setlist.auth.dto.RefreshRequest;
import com.openforge.setlist.auth.dto.TokenResponse;
import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.ArtistProfile;
import com.openforge.setlist.domain.Role;
import com.openforge.setlist.repository.AccountRepository;
import com.openforge.setlist.repository.ArtistProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session-level operations once an account exists: login, refresh, logout,
 * current identity and self-deactivation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final Authenticator           authenticator;
    private final TokenService            tokenService;
    private final TokenRevocationList     revocationList;
    private final AccountRepository       accountRepository;
    private final ArtistProfileRepository artistProfileRepository;

    @Transactional
    public TokenResponse login(LoginRequest req) {
        Account account = authenticator.authenticateByPassword(req.identifier(), req.password());
        log.info("[Auth] Login accountId={} username={}", account.getId(), account.getUsername());
        return issuePair(account);
    }

    /**
     * Exchange a refresh token for a new pair. The presented refresh token is
     * revoked so it cannot be replayed.
     */
    @Transactional(readOnly = true)
    public TokenResponse refresh(RefreshRequest req) {
        TokenClaims claims = authenticator.verifyToken(req.refreshToken(), TokenType.REFRESH);
        Account account = authenticator.resolveSubject(claims);
        revocationList.revoke(claims);
        log.info("[Auth] Refreshed tokens for accountId={}", account.getId());
        return issuePair(account);
    }

    /**
     * Revoke the access token the request was made with. Other tokens of the
     * same account stay valid until they expire.
     */
    public void logout(AccountPrincipal principal) {
        revocationList.revoke(principal.token());
        log.info("[Auth] Logout accountId={}", principal.accountId());
    }

    @Transactional(readOnly = true)
    public AccountResponse currentAccount(AccountPrincipal principal) {
        Account account = loadAccount(principal);
        ArtistProfile profile = account.hasRole(Role.ARTIST)
                ? artistProfileRepository.findByAccountId(account.getId()).orElse(null)
                : null;
        return AccountResponse.from(account, profile);
    }

    @Transactional
    public void deactivate(AccountPrincipal principal) {
        Account account = loadAccount(principal);
        account.setActive(false);
        accountRepository.save(account);
        revocationList.revoke(principal.token());
        log.info("[Auth] Deactivated accountId={}", account.getId());
    }

    private Account loadAccount(AccountPrincipal principal) {
        return accountRepository.findById(principal.accountId())
                .orElseThrow(() -> new AuthException(AuthError.INVALID_CREDENTIALS));
    }

    private TokenResponse issuePair(Account account) {
        String accessToken  = tokenService.issue(account.getUsername(), TokenType.ACCESS);
        String refreshToken = tokenService.issue(account.getUsername(), TokenType.REFRESH);
        return TokenResponse.bearer(accessToken, refreshToken, AccountResponse.from(account));
    }
}
