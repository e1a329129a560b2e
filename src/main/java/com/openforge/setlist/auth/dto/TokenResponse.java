package com.openforge.setlist.auth.dto;

/**
 * Login / refresh result.
 */
public record TokenResponse(
        String          accessToken,
        String          refreshToken,
        String          tokenType,
        AccountResponse account
) {

    public static final String BEARER = "bearer";

    public static TokenResponse bearer(String accessToken, String refreshToken, AccountResponse account) {
        return new TokenResponse(accessToken, refreshToken, BEARER, account);
    }
}
