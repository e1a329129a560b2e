package com.openforge.setlist.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way password hashing on top of the configured {@link PasswordEncoder}
 * (BCrypt, random salt embedded in every hash).
 *
 * {@link #verify} never throws: a corrupted or foreign stored hash simply
 * does not match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialHasher {

    private final PasswordEncoder passwordEncoder;

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, storedHash);
        } catch (RuntimeException e) {
            log.warn("[Hash] Stored hash could not be checked: {}", e.getClass().getSimpleName());
            return false;
        }
    }
}
