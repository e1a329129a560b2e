package com.openforge.setlist.auth;

import java.util.Arrays;
import java.util.Optional;

public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaim(String value) {
        return Arrays.stream(values())
                .filter(t -> t.claimValue.equals(value))
                .findFirst();
    }
}
