package com.openforge.setlist.artist;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.setlist.artist.dto.ArtistProfileResponse;
import com.openforge.setlist.artist.dto.ArtistSearchResponse;
import com.openforge.setlist.artist.dto.ProfilePictureResponse;
import com.openforge.setlist.auth.AccountPrincipal;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.time.Duration;

/**
 * Artist profile endpoints.
 *
 *   GET  /api/artists/me                          : own profile (artist only)
 *   PUT  /api/artists/me                          : partial update (artist only)
 *   POST /api/artists/me/profile-picture          : multipart "file" (artist only)
 *   GET  /api/artists/{accountId}/profile-picture : public, raw image bytes
 *   GET  /api/artists/search                      : public, paginated filter
 */
@RestController
@RequestMapping("/api/artists")
@RequiredArgsConstructor
public class ArtistController {

    private final ArtistProfileService profileService;

    @GetMapping("/me")
    public ArtistProfileResponse me(@AuthenticationPrincipal AccountPrincipal principal) {
        return profileService.getOwnProfile(principal);
    }

    @PutMapping(path = "/me", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ArtistProfileResponse update(
            @AuthenticationPrincipal AccountPrincipal principal,
            @RequestBody JsonNode body) {
        return profileService.updateOwnProfile(principal, ArtistProfilePatch.fromJson(body));
    }

    @PostMapping(path = "/me/profile-picture", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ProfilePictureResponse uploadProfilePicture(
            @AuthenticationPrincipal AccountPrincipal principal,
            @RequestPart("file") MultipartFile file) {
        return profileService.uploadProfilePicture(principal, file);
    }

    @GetMapping("/{accountId}/profile-picture")
    public ResponseEntity<byte[]> profilePicture(@PathVariable Long accountId) {
        ProfilePicture picture = profileService.getProfilePicture(accountId);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(picture.contentType()))
                .cacheControl(CacheControl.maxAge(Duration.ofHours(1)).cachePublic())
                .body(picture.data());
    }

    @GetMapping("/search")
    public ArtistSearchResponse search(
            @RequestParam(required = false) String genre,
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String instrument,
            @RequestParam(defaultValue = "1")  int page,
            @RequestParam(defaultValue = "10") int limit) {
        return profileService.search(genre, location, instrument, page, limit);
    }
}
