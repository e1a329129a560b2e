package com.openforge.setlist.auth;

import lombok.Getter;

@Getter
public class AuthException extends RuntimeException {

    private final AuthError error;

    public AuthException(AuthError error) {
        this(error, error.clientMessage());
    }

    public AuthException(AuthError error, String message) {
        super(message);
        this.error = error;
    }

    public AuthException(AuthError error, Throwable cause) {
        super(error.clientMessage(), cause);
        this.error = error;
    }
}
