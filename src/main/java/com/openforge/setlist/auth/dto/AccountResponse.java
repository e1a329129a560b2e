package com.openforge.setlist.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.ArtistProfile;
import com.openforge.setlist.domain.Role;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Public view of an account. Never carries the password hash.
 *
 * For artists the profile fields are merged in; genres and instruments are
 * then empty lists rather than null. Other roles omit those keys.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountResponse(
        Long          id,
        String        email,
        String        username,
        String        displayName,
        Role          role,
        boolean       active,
        LocalDateTime createTime,
        LocalDateTime updateTime,
        String        bio,
        List<String>  genres,
        List<String>  instruments,
        String        location,
        String        website
) {

    public static AccountResponse from(Account account) {
        return new AccountResponse(
                account.getId(),
                account.getEmail(),
                account.getUsername(),
                account.getDisplayName(),
                account.getRole(),
                account.isActive(),
                account.getCreateTime(),
                account.getUpdateTime(),
                null, null, null, null, null);
    }

    public static AccountResponse from(Account account, ArtistProfile profile) {
        if (profile == null) {
            if (!account.hasRole(Role.ARTIST)) {
                return from(account);
            }
            profile = ArtistProfile.emptyFor(account);
        }
        return new AccountResponse(
                account.getId(),
                account.getEmail(),
                account.getUsername(),
                account.getDisplayName(),
                account.getRole(),
                account.isActive(),
                account.getCreateTime(),
                account.getUpdateTime(),
                profile.getBio(),
                List.copyOf(profile.getGenres()),
                List.copyOf(profile.getInstruments()),
                profile.getLocation(),
                profile.getWebsite());
    }
}
