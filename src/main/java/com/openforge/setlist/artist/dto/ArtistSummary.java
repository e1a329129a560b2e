package com.openforge.setlist.artist.dto;

import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.ArtistProfile;

import java.time.LocalDateTime;
import java.util.List;

/** One row of an artist search result. */
public record ArtistSummary(
        Long          id,
        Long          accountId,
        String        username,
        String        displayName,
        String        bio,
        List<String>  genres,
        List<String>  instruments,
        String        location,
        String        website,
        LocalDateTime createTime,
        LocalDateTime updateTime
) {

    public static ArtistSummary from(ArtistProfile profile) {
        Account account = profile.getAccount();
        return new ArtistSummary(
                profile.getId(),
                account.getId(),
                account.getUsername(),
                account.getDisplayName(),
                profile.getBio(),
                List.copyOf(profile.getGenres()),
                List.copyOf(profile.getInstruments()),
                profile.getLocation(),
                profile.getWebsite(),
                profile.getCreateTime(),
                profile.getUpdateTime());
    }
}
