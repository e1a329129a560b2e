package com.openforge.setlist.artist;

import com.openforge.setlist.artist.dto.ArtistProfileResponse;
import com.openforge.setlist.artist.dto.ArtistSearchResponse;
import com.openforge.setlist.artist.dto.ArtistSummary;
import com.openforge.setlist.artist.dto.ProfilePictureResponse;
import com.openforge.setlist.auth.AccountPrincipal;
import com.openforge.setlist.auth.AuthError;
import com.openforge.setlist.auth.AuthException;
import com.openforge.setlist.auth.Authorizer;
import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.ArtistProfile;
import com.openforge.setlist.domain.Role;
import com.openforge.setlist.repository.AccountRepository;
import com.openforge.setlist.repository.ArtistProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Set;

/**
 * Artist profile reads and writes. Every "me" operation looks the profile up
 * by the caller's own account id, so an artist can only ever touch their own
 * profile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtistProfileService {

    static final int MAX_SEARCH_LIMIT = 100;

    static final Set<MediaType> ALLOWED_PICTURE_TYPES = Set.of(
            MediaType.IMAGE_PNG,
            MediaType.IMAGE_JPEG,
            MediaType.IMAGE_GIF,
            new MediaType("image", "webp"));

    private final ArtistProfileRepository profileRepository;
    private final AccountRepository       accountRepository;
    private final Authorizer              authorizer;
    private final ArtistProperties        properties;

    @Transactional(readOnly = true)
    public ArtistProfileResponse getOwnProfile(AccountPrincipal principal) {
        Account artist = requireArtist(principal);
        ArtistProfile profile = profileRepository.findByAccountId(artist.getId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Artist profile not found"));
        return ArtistProfileResponse.withAccount(profile);
    }

    /**
     * Apply a partial update. The profile is created on the fly if this
     * artist does not have one yet.
     */
    @Transactional
    public ArtistProfileResponse updateOwnProfile(AccountPrincipal principal, ArtistProfilePatch patch) {
        Account artist = requireArtist(principal);
        ArtistProfile profile = profileRepository.findByAccountId(artist.getId())
                .orElseGet(() -> {
                    log.info("[Artist] Creating missing profile for accountId={}", artist.getId());
                    return ArtistProfile.emptyFor(artist);
                });

        patch.applyTo(profile);
        ArtistProfile saved = profileRepository.saveAndFlush(profile);
        log.info("[Artist] Profile updated accountId={} fields={}", artist.getId(), patch.presentFields());
        return ArtistProfileResponse.withAccount(saved);
    }

    @Transactional
    public ProfilePictureResponse uploadProfilePicture(AccountPrincipal principal, MultipartFile file) {
        Account artist = requireArtist(principal);

        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No file uploaded");
        }
        String contentType = pictureType(file.getContentType()).toString();
        long maxBytes = properties.profilePictureMaxSize().toBytes();
        if (file.getSize() > maxBytes) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "File too large. Maximum size is " + properties.profilePictureMaxSize().toMegabytes() + "MB.");
        }

        ArtistProfile profile = profileRepository.findByAccountId(artist.getId())
                .orElseGet(() -> ArtistProfile.emptyFor(artist));

        byte[] data;
        try {
            data = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read uploaded profile picture", e);
        }
        profile.setProfilePicture(data);
        profile.setProfilePictureContentType(contentType);
        profile.setProfilePictureFilename(file.getOriginalFilename());
        profileRepository.save(profile);

        log.info("[Artist] Profile picture stored accountId={} type={} bytes={}",
                artist.getId(), contentType, data.length);
        return new ProfilePictureResponse(file.getOriginalFilename(), contentType, data.length);
    }

    @Transactional(readOnly = true)
    public ProfilePicture getProfilePicture(Long accountId) {
        return profileRepository.findByAccountId(accountId)
                .filter(ArtistProfile::hasProfilePicture)
                .map(p -> new ProfilePicture(p.getProfilePicture(), p.getProfilePictureContentType()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Profile picture not found"));
    }

    /**
     * Filter active artists by genre, instrument (exact tag, case-insensitive)
     * and location (substring). {@code page} is 1-based.
     */
    @Transactional(readOnly = true)
    public ArtistSearchResponse search(String genre, String location, String instrument, int page, int limit) {
        if (page < 1) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "page must be >= 1");
        }
        if (limit < 1 || limit > MAX_SEARCH_LIMIT) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "limit must be between 1 and " + MAX_SEARCH_LIMIT);
        }

        Page<ArtistProfile> result = profileRepository.findAll(
                ArtistSearchSpecifications.search(genre, location, instrument),
                PageRequest.of(page - 1, limit, Sort.by("id")));

        return new ArtistSearchResponse(
                result.getContent().stream().map(ArtistSummary::from).toList(),
                new ArtistSearchResponse.Pagination(page, limit, result.getTotalElements(), result.getTotalPages()));
    }

    /**
     * The stored type is served back verbatim on a public endpoint, so it must
     * parse and be one of the raster formats, without parameters.
     */
    static MediaType pictureType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            throw invalidPictureType();
        }
        MediaType parsed;
        try {
            parsed = MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            throw invalidPictureType();
        }
        MediaType bare = new MediaType(parsed.getType(), parsed.getSubtype());
        if (!ALLOWED_PICTURE_TYPES.contains(bare)) {
            throw invalidPictureType();
        }
        return bare;
    }

    private static ResponseStatusException invalidPictureType() {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid file type. Only images are allowed.");
    }

    private Account requireArtist(AccountPrincipal principal) {
        Account account = accountRepository.findById(principal.accountId())
                .orElseThrow(() -> new AuthException(AuthError.INVALID_CREDENTIALS));
        return authorizer.requireRole(account, Role.ARTIST);
    }
}
