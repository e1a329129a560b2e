package com.openforge.setlist.artist;

import com.openforge.setlist.artist.dto.ArtistProfileResponse;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.util.unit.DataSize;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ArtistProfileServiceTest {

    @Mock
    private ArtistProfileRepository profileRepository;

    @Mock
    private AccountRepository accountRepository;

    private ArtistProfileService service;

    private Account artist;
    private AccountPrincipal artistPrincipal;

    @BeforeEach
    void setUp() {
        service = new ArtistProfileService(profileRepository, accountRepository, new Authorizer(),
                new ArtistProperties(DataSize.ofKilobytes(1)));

        artist = account(1L, "alice", Role.ARTIST);
        artistPrincipal = new AccountPrincipal(1L, "alice", Role.ARTIST, null);
    }

    private static Account account(Long id, String username, Role role) {
        Account a = new Account();
        a.setId(id);
        a.setUsername(username);
        a.setEmail(username + "@example.com");
        a.setDisplayName(username);
        a.setRole(role);
        a.setActive(true);
        return a;
    }

    private static int status(Throwable e) {
        return ((ResponseStatusException) e).getStatusCode().value();
    }

    // ========================================
    // PROFILE
    // ========================================

    @Test
    @DisplayName("getOwnProfile should return 404 when the artist has no profile row")
    void getOwnProfile_shouldReturn404_whenMissing() {
        when(accountRepository.findById(1L)).thenReturn(Optional.of(artist));
        when(profileRepository.findByAccountId(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getOwnProfile(artistPrincipal))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("Artist profile not found")
                .satisfies(e -> assertThat(status(e)).isEqualTo(404));
    }

    @Test
    @DisplayName("getOwnProfile should be forbidden for non-artists")
    void getOwnProfile_shouldBeForbidden_forUserRole() {
        Account user = account(2L, "bob", Role.USER);
        when(accountRepository.findById(2L)).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> service.getOwnProfile(new AccountPrincipal(2L, "bob", Role.USER, null)))
                .isInstanceOf(AuthException.class)
                .satisfies(e -> assertThat(((AuthException) e).getError()).isEqualTo(AuthError.FORBIDDEN));
        verifyNoInteractions(profileRepository);
    }

    @Test
    @DisplayName("updateOwnProfile should create the profile lazily and apply the patch")
    void updateOwnProfile_shouldCreateMissingProfile() {
        when(accountRepository.findById(1L)).thenReturn(Optional.of(artist));
        when(profileRepository.findByAccountId(1L)).thenReturn(Optional.empty());
        when(profileRepository.saveAndFlush(any(ArtistProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        ArtistProfilePatch patch = new ArtistProfilePatch(
                PatchField.of("Bassist"), PatchField.of(List.of("jazz")), PatchField.absent(),
                PatchField.absent(), PatchField.absent());

        ArtistProfileResponse response = service.updateOwnProfile(artistPrincipal, patch);

        assertThat(response.accountId()).isEqualTo(1L);
        assertThat(response.bio()).isEqualTo("Bassist");
        assertThat(response.genres()).containsExactly("jazz");
        assertThat(response.instruments()).isEmpty();
        assertThat(response.account().username()).isEqualTo("alice");
    }

    // ========================================
    // PICTURE
    // ========================================

    @Test
    @DisplayName("uploadProfilePicture should reject a non-image content type with 400")
    void upload_shouldRejectNonImage() {
        when(accountRepository.findById(1L)).thenReturn(Optional.of(artist));
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", new byte[] {1, 2});

        assertThatThrownBy(() -> service.uploadProfilePicture(artistPrincipal, file))
                .hasMessageContaining("Invalid file type. Only images are allowed.")
                .satisfies(e -> assertThat(status(e)).isEqualTo(400));
    }

    @Test
    @DisplayName("uploadProfilePicture should reject unparseable and non-raster image types with 400")
    void upload_shouldRejectUnsafeImageTypes() {
        when(accountRepository.findById(1L)).thenReturn(Optional.of(artist));

        for (String type : new String[] {"image/", "image", "image/svg+xml", "image/x-icon", "text/html"}) {
            MockMultipartFile file = new MockMultipartFile("file", "me.img", type, new byte[] {1, 2});

            assertThatThrownBy(() -> service.uploadProfilePicture(artistPrincipal, file))
                    .as(type)
                    .hasMessageContaining("Invalid file type. Only images are allowed.")
                    .satisfies(e -> assertThat(status(e)).isEqualTo(400));
        }
        verify(profileRepository, never()).save(any());
    }

    @Test
    @DisplayName("uploadProfilePicture should store the bare media type without parameters")
    void upload_shouldNormaliseContentType() {
        ArtistProfile profile = ArtistProfile.emptyFor(artist);
        when(accountRepository.findById(1L)).thenReturn(Optional.of(artist));
        when(profileRepository.findByAccountId(1L)).thenReturn(Optional.of(profile));
        MockMultipartFile file = new MockMultipartFile("file", "me.webp", "IMAGE/WebP; q=0.9", new byte[] {5});

        ProfilePictureResponse response = service.uploadProfilePicture(artistPrincipal, file);

        assertThat(response.contentType()).isEqualTo("image/webp");
        assertThat(profile.getProfilePictureContentType()).isEqualTo("image/webp");
    }

    @Test
    @DisplayName("uploadProfilePicture should reject a file above the configured size with 400")
    void upload_shouldRejectOversizedFile() {
        when(accountRepository.findById(1L)).thenReturn(Optional.of(artist));
        MockMultipartFile file = new MockMultipartFile("file", "big.png", "image/png", new byte[2048]);

        assertThatThrownBy(() -> service.uploadProfilePicture(artistPrincipal, file))
                .hasMessageContaining("File too large")
                .satisfies(e -> assertThat(status(e)).isEqualTo(400));
    }

    @Test
    @DisplayName("uploadProfilePicture should store bytes and content type on the profile")
    void upload_shouldStorePicture() {
        ArtistProfile profile = ArtistProfile.emptyFor(artist);
        when(accountRepository.findById(1L)).thenReturn(Optional.of(artist));
        when(profileRepository.findByAccountId(1L)).thenReturn(Optional.of(profile));
        MockMultipartFile file = new MockMultipartFile("file", "me.png", "image/png", new byte[] {9, 8, 7});

        ProfilePictureResponse response = service.uploadProfilePicture(artistPrincipal, file);

        assertThat(response.filename()).isEqualTo("me.png");
        assertThat(response.contentType()).isEqualTo("image/png");
        assertThat(response.sizeBytes()).isEqualTo(3);
        assertThat(profile.getProfilePicture()).containsExactly(9, 8, 7);
        verify(profileRepository).save(profile);
    }

    @Test
    @DisplayName("getProfilePicture should return 404 when none was uploaded")
    void getPicture_shouldReturn404_whenNone() {
        when(profileRepository.findByAccountId(5L)).thenReturn(Optional.of(ArtistProfile.emptyFor(artist)));

        assertThatThrownBy(() -> service.getProfilePicture(5L))
                .satisfies(e -> assertThat(status(e)).isEqualTo(HttpStatus.NOT_FOUND.value()));
    }

    // ========================================
    // SEARCH
    // ========================================

    @Test
    @DisplayName("search should reject page 0 and limits outside 1..100")
    void search_shouldValidatePaging() {
        assertThatThrownBy(() -> service.search(null, null, null, 0, 10))
                .satisfies(e -> assertThat(status(e)).isEqualTo(422));
        assertThatThrownBy(() -> service.search(null, null, null, 1, 0))
                .satisfies(e -> assertThat(status(e)).isEqualTo(422));
        assertThatThrownBy(() -> service.search(null, null, null, 1, 101))
                .satisfies(e -> assertThat(status(e)).isEqualTo(422));
        verifyNoInteractions(profileRepository);
    }
}
