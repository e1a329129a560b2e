package com.openforge.setlist.artist.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.setlist.auth.dto.AccountResponse;
import com.openforge.setlist.domain.ArtistProfile;

import java.time.LocalDateTime;
import java.util.List;

public record ArtistProfileResponse(
        Long          id,
        Long          accountId,
        String        bio,
        List<String>  genres,
        List<String>  instruments,
        String        location,
        String        website,
        boolean       hasProfilePicture,
        LocalDateTime createTime,
        LocalDateTime updateTime,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        AccountResponse account
) {

    public static ArtistProfileResponse from(ArtistProfile profile) {
        return of(profile, null);
    }

    /** Profile with its owning account embedded. */
    public static ArtistProfileResponse withAccount(ArtistProfile profile) {
        return of(profile, AccountResponse.from(profile.getAccount()));
    }

    private static ArtistProfileResponse of(ArtistProfile profile, AccountResponse account) {
        return new ArtistProfileResponse(
                profile.getId(),
                profile.getAccount().getId(),
                profile.getBio(),
                List.copyOf(profile.getGenres()),
                List.copyOf(profile.getInstruments()),
                profile.getLocation(),
                profile.getWebsite(),
                profile.hasProfilePicture(),
                profile.getCreateTime(),
                profile.getUpdateTime(),
                account);
    }
}
