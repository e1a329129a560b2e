package com.openforge.setlist.auth;

import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Role gate. Exact role match, no hierarchy and no admin bypass.
 */
@Slf4j
@Component
public class Authorizer {

    public Account requireRole(Account account, Role required) {
        if (account == null || !account.hasRole(required)) {
            log.debug("[Auth] Forbidden: accountId={} role={} required={}",
                    account != null ? account.getId() : null,
                    account != null ? account.getRole() : null,
                    required);
            throw new AuthException(AuthError.FORBIDDEN, forbiddenMessage(required));
        }
        return account;
    }

    private static String forbiddenMessage(Role required) {
        return switch (required) {
            case ARTIST   -> "Only artists can access this endpoint";
            case PROMOTER -> "Only promoters can access this endpoint";
            case VENUE    -> "Only venues can access this endpoint";
            case USER     -> "Only standard users can access this endpoint";
        };
    }
}
