package com.openforge.setlist.auth.dto;

import com.openforge.setlist.domain.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Registration payload for every role. The artist fields are optional and
 * only used when {@code role} is artist; they seed the artist profile.
 *
 * Password length below 8 is not a bean-validation error here, the
 * registration workflow reports it as WEAK_PASSWORD.
 */
public record RegisterRequest(
        @NotBlank
        @Email
        @Size(max = 255)
        String email,

        @NotBlank
        @Pattern(regexp = "^[A-Za-z0-9_.-]{3,50}$",
                 message = "must be 3-50 characters of letters, digits, '_', '.' or '-'")
        String username,

        @NotBlank
        @Size(max = 72)
        String password,

        @NotBlank
        @Size(max = 100)
        String displayName,

        @NotNull
        Role role,

        @Size(max = 5000)
        String bio,

        List<@NotBlank @Size(max = 64) String> genres,

        List<@NotBlank @Size(max = 64) String> instruments,

        @Size(max = 255)
        String location,

        @Size(max = 255)
        String website
) {

    /** Registration without any artist profile fields. */
    public static RegisterRequest basic(String email, String username, String password,
                                        String displayName, Role role) {
        return new RegisterRequest(email, username, password, displayName, role,
                null, null, null, null, null);
    }
}
