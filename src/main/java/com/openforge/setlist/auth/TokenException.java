package com.openforge.setlist.auth;

import lombok.Getter;

/**
 * Raised by {@link TokenService#verify}. The reason is for logs only; callers
 * outside the auth package see a single unauthenticated outcome.
 */
@Getter
public class TokenException extends RuntimeException {

    public enum Reason {
        INVALID_SIGNATURE,
        EXPIRED,
        MALFORMED
    }

    private final Reason reason;

    public TokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
