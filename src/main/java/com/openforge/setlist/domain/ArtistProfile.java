package com.openforge.setlist.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional 1:1 extension of an {@link Account} whose role is ARTIST.
 *
 * Every descriptive field is independently nullable. Genre and instrument
 * tags are stored in their own collection tables and are never null on the
 * Java side, an unset list is simply empty.
 */
@Getter
@Setter
@Entity
@Table(
    name = "artist_profiles",
    uniqueConstraints = @UniqueConstraint(name = "uq_artist_profiles_account", columnNames = "account_id")
)
public class ArtistProfile extends BaseEntity {

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_id", nullable = false, updatable = false)
    private Account account;

    @Column(columnDefinition = "TEXT")
    private String bio;

    @ElementCollection
    @CollectionTable(name = "artist_profile_genres", joinColumns = @JoinColumn(name = "profile_id"))
    @OrderColumn(name = "tag_index")
    @Column(name = "genre", nullable = false, length = 64)
    private List<String> genres = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "artist_profile_instruments", joinColumns = @JoinColumn(name = "profile_id"))
    @OrderColumn(name = "tag_index")
    @Column(name = "instrument", nullable = false, length = 64)
    private List<String> instruments = new ArrayList<>();

    @Column(length = 255)
    private String location;

    @Column(length = 255)
    private String website;

    @Lob
    @Basic(fetch = FetchType.LAZY)
    @Column(name = "profile_picture", length = 10 * 1024 * 1024)
    private byte[] profilePicture;

    @Column(name = "profile_picture_content_type", length = 100)
    private String profilePictureContentType;

    @Column(name = "profile_picture_filename", length = 255)
    private String profilePictureFilename;

    public static ArtistProfile emptyFor(Account account) {
        ArtistProfile profile = new ArtistProfile();
        profile.setAccount(account);
        return profile;
    }

    public void replaceGenres(List<String> values) {
        genres.clear();
        if (values != null) {
            genres.addAll(values);
        }
    }

    public void replaceInstruments(List<String> values) {
        instruments.clear();
        if (values != null) {
            instruments.addAll(values);
        }
    }

    public boolean hasProfilePicture() {
        return profilePicture != null && profilePicture.length > 0;
    }
}
