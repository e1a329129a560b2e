package com.openforge.setlist.auth;

import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.Role;

/**
 * What the security context holds for an authenticated request.
 *
 * Carries the verified token claims so logout can revoke exactly the token
 * the request was made with.
 */
public record AccountPrincipal(
        Long        accountId,
        String      username,
        Role        role,
        TokenClaims token
) {

    public static AccountPrincipal of(Account account, TokenClaims token) {
        return new AccountPrincipal(account.getId(), account.getUsername(), account.getRole(), token);
    }
}
