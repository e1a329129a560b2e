package com.openforge.setlist.artist;

import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.ArtistProfile;
import com.openforge.setlist.domain.Role;
import jakarta.persistence.criteria.Join;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Filters for the public artist search. Only present filters are added to the
 * query; tag joins switch the query to DISTINCT so a profile shows once.
 */
final class ArtistSearchSpecifications {

    private ArtistSearchSpecifications() {
    }

    static Specification<ArtistProfile> search(String genre, String location, String instrument) {
        Specification<ArtistProfile> spec = activeArtists();
        if (hasText(genre)) {
            spec = spec.and(hasTag("genres", genre));
        }
        if (hasText(instrument)) {
            spec = spec.and(hasTag("instruments", instrument));
        }
        if (hasText(location)) {
            spec = spec.and(locationContains(location));
        }
        return spec;
    }

    static Specification<ArtistProfile> activeArtists() {
        return (root, query, cb) -> {
            Join<ArtistProfile, Account> account = root.join("account");
            return cb.and(
                    cb.isTrue(account.get("active")),
                    cb.equal(account.get("role"), Role.ARTIST));
        };
    }

    static Specification<ArtistProfile> hasTag(String collection, String tag) {
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        return (root, query, cb) -> {
            query.distinct(true);
            Join<ArtistProfile, String> tags = root.join(collection);
            return cb.equal(cb.lower(tags), wanted);
        };
    }

    static Specification<ArtistProfile> locationContains(String location) {
        String pattern = "%" + escapeLike(location.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.get("location")), pattern, '\\');
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
