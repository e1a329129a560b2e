package com.openforge.setlist.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Login using username or email + password.
 */
public record LoginRequest(
        @NotBlank
        @Size(max = 255)
        String identifier,

        @NotBlank
        @Size(max = 72)
        String password
) {
}
