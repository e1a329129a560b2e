package com.openforge.setlist.auth;

import com.openforge.setlist.artist.dto.ArtistProfileResponse;
import com.openforge.setlist.auth.dto.AccountResponse;
import com.openforge.setlist.auth.dto.RegisterRequest;
import com.openforge.setlist.auth.dto.RegistrationResponse;
import com.openforge.setlist.auth.dto.TokenResponse;
import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.ArtistProfile;
import com.openforge.setlist.domain.Role;
import com.openforge.setlist.repository.AccountRepository;
import com.openforge.setlist.repository.ArtistProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Creates an account, and for artists its profile, in one transaction and
 * mints the first token pair.
 *
 * Checks run in a fixed order: password strength, email, username. The
 * exists-queries only give a friendly error; the unique indexes on the
 * accounts table are what stop two concurrent registrations. A registration
 * that loses that race is reported by the index it hit, the same way as if
 * the exists-query had caught it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationService {

    static final int MIN_PASSWORD_LENGTH = 8;

    private final AccountRepository       accountRepository;
    private final ArtistProfileRepository artistProfileRepository;
    private final CredentialHasher        credentialHasher;
    private final TokenService            tokenService;

    @Transactional
    public RegistrationResponse register(RegisterRequest req) {
        if (req.password() == null || req.password().length() < MIN_PASSWORD_LENGTH) {
            throw new AuthException(AuthError.WEAK_PASSWORD);
        }

        String email    = normalizeEmail(req.email());
        String username = req.username().trim();

        if (accountRepository.existsByEmail(email)) {
            throw new AuthException(AuthError.DUPLICATE_EMAIL);
        }
        if (accountRepository.existsByUsername(username)) {
            throw new AuthException(AuthError.DUPLICATE_USERNAME);
        }

        Account account = new Account();
        account.setEmail(email);
        account.setUsername(username);
        account.setDisplayName(req.displayName().trim());
        account.setPasswordHash(credentialHasher.hash(req.password()));
        account.setRole(req.role());
        account.setActive(true);

        // flush now so a unique-index violation surfaces inside this transaction
        Account saved;
        try {
            saved = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            throw duplicateOrRethrow(e, email, username);
        }

        ArtistProfile profile = null;
        if (saved.hasRole(Role.ARTIST)) {
            profile = artistProfileRepository.saveAndFlush(seedProfile(saved, req));
        }

        log.info("[Auth] Registered accountId={} username={} role={}",
                saved.getId(), saved.getUsername(), saved.getRole());

        String accessToken  = tokenService.issue(saved.getUsername(), TokenType.ACCESS);
        String refreshToken = tokenService.issue(saved.getUsername(), TokenType.REFRESH);

        return new RegistrationResponse(
                AccountResponse.from(saved, profile),
                accessToken,
                refreshToken,
                TokenResponse.BEARER,
                profile != null ? ArtistProfileResponse.from(profile) : null);
    }

    private static ArtistProfile seedProfile(Account account, RegisterRequest req) {
        ArtistProfile profile = ArtistProfile.emptyFor(account);
        profile.setBio(req.bio());
        profile.replaceGenres(trimmed(req.genres()));
        profile.replaceInstruments(trimmed(req.instruments()));
        profile.setLocation(req.location());
        profile.setWebsite(req.website());
        return profile;
    }

    private static List<String> trimmed(List<String> values) {
        return values == null ? null : values.stream().map(String::trim).toList();
    }

    /**
     * Map a unique-index violation on the accounts table to the matching
     * duplicate error. Any other violation is returned unchanged.
     */
    private static RuntimeException duplicateOrRethrow(
            DataIntegrityViolationException e, String email, String username) {
        AuthError error = duplicateError(e);
        if (error == null) {
            return e;
        }
        log.info("[Auth] Registration lost race: error={} email={} username={}", error, email, username);
        return new AuthException(error);
    }

    /**
     * Reads the violated index from the constraint name Hibernate extracted,
     * falling back to the driver message when the dialect found none.
     */
    static AuthError duplicateError(DataIntegrityViolationException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException cve && cve.getConstraintName() != null) {
                AuthError byName = duplicateErrorFor(cve.getConstraintName());
                if (byName != null) {
                    return byName;
                }
            }
        }
        return duplicateErrorFor(e.getMostSpecificCause().getMessage());
    }

    private static AuthError duplicateErrorFor(String text) {
        if (text == null) {
            return null;
        }
        // H2 reports index names upper-case
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains(Account.EMAIL_CONSTRAINT)) {
            return AuthError.DUPLICATE_EMAIL;
        }
        if (lower.contains(Account.USERNAME_CONSTRAINT)) {
            return AuthError.DUPLICATE_USERNAME;
        }
        return null;
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
