package com.openforge.setlist.auth;

import org.springframework.http.HttpStatus;

/**
 * Every way registration, authentication or authorization can fail.
 *
 * The token codes share one client message on purpose: the caller only learns
 * that the token was not accepted, the reason goes to the debug log.
 */
public enum AuthError {

    WEAK_PASSWORD(HttpStatus.UNPROCESSABLE_ENTITY, "Password must be at least 8 characters long"),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "Email already registered"),
    DUPLICATE_USERNAME(HttpStatus.BAD_REQUEST, "Username already taken"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Incorrect username/email or password"),
    ACCOUNT_DEACTIVATED(HttpStatus.UNAUTHORIZED, "Account is deactivated"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "You do not have permission to access this resource"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "Could not validate credentials"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "Could not validate credentials");

    private final HttpStatus status;
    private final String clientMessage;

    AuthError(HttpStatus status, String clientMessage) {
        this.status = status;
        this.clientMessage = clientMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String clientMessage() {
        return clientMessage;
    }
}
