package com.openforge.setlist.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.setlist.artist.dto.ArtistProfileResponse;

/**
 * Result of a successful registration. {@code artistProfile} is only present
 * for artist accounts.
 */
public record RegistrationResponse(
        AccountResponse account,
        String          accessToken,
        String          refreshToken,
        String          tokenType,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        ArtistProfileResponse artistProfile
) {
}
