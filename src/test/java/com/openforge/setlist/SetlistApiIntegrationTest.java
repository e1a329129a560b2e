package com.openforge.setlist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end HTTP tests against an H2 database.
 *
 * The context and database are shared by every test here, so each test
 * registers accounts under its own random suffix.
 */
@SpringBootTest
@AutoConfigureMockMvc
class SetlistApiIntegrationTest {

    private static final String PASSWORD = "longenough1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    // ── helpers ──────────────────────────────────────────────────────────────

    private static String unique(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private static Map<String, Object> registration(String username, String role) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", username + "@example.com");
        body.put("username", username);
        body.put("password", PASSWORD);
        body.put("display_name", "Display " + username);
        body.put("role", role);
        return body;
    }

    private JsonNode postJson(String path, Object body, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(body)))
                .andExpect(status().is(expectedStatus))
                .andReturn();
        String content = result.getResponse().getContentAsString();
        return content.isEmpty() ? objectMapper.nullNode() : objectMapper.readTree(content);
    }

    /** Registers an account and returns the registration body. */
    private JsonNode register(String username, String role) throws Exception {
        return postJson("/api/auth/register", registration(username, role), 201);
    }

    private String accessTokenOf(JsonNode response) {
        return response.get("access_token").asText();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    // ========================================
    // REGISTRATION / LOGIN SCENARIO
    // ========================================

    @Test
    @DisplayName("register, current identity, duplicate email, wrong password and role gate behave end to end")
    void endToEndScenario() throws Exception {
        // register alice as artist
        Map<String, Object> alice = new LinkedHashMap<>();
        alice.put("email", "alice@example.com");
        alice.put("username", "alice");
        alice.put("password", PASSWORD);
        alice.put("display_name", "Alice");
        alice.put("role", "artist");
        alice.put("genres", List.of("jazz"));

        JsonNode registered = postJson("/api/auth/register", alice, 201);
        assertThat(registered.get("token_type").asText()).isEqualTo("bearer");
        assertThat(registered.get("account").has("password_hash")).isFalse();
        assertThat(registered.get("account").has("password")).isFalse();
        String aliceToken = accessTokenOf(registered);

        // the token resolves to alice
        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.role").value("artist"))
                .andExpect(jsonPath("$.genres[0]").value("jazz"))
                .andExpect(jsonPath("$.instruments").isArray())
                .andExpect(jsonPath("$.password_hash").doesNotExist());

        // same email again (different case) → 400
        Map<String, Object> duplicate = registration("alice2", "user");
        duplicate.put("email", "ALICE@example.com");
        JsonNode dupError = postJson("/api/auth/register", duplicate, 400);
        assertThat(dupError.get("message").asText()).isEqualTo("Email already registered");

        // wrong password → 401
        JsonNode wrong = postJson("/api/auth/login", Map.of("identifier", "alice", "password", "wrongpass1"), 401);
        assertThat(wrong.get("message").asText()).isEqualTo("Incorrect username/email or password");

        // login by email works
        JsonNode login = postJson("/api/auth/login", Map.of("identifier", "Alice@Example.com", "password", PASSWORD), 200);
        assertThat(login.get("account").get("username").asText()).isEqualTo("alice");

        // a user-role account is forbidden on an artist endpoint
        String userToken = accessTokenOf(register(unique("fan"), "user"));
        mockMvc.perform(get("/api/artists/me").header(HttpHeaders.AUTHORIZATION, bearer(userToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Only artists can access this endpoint"));
    }

    @Test
    @DisplayName("register should reject a 7-character password with 422")
    void register_shouldRejectWeakPassword() throws Exception {
        Map<String, Object> body = registration(unique("weak"), "user");
        body.put("password", "short12");

        JsonNode error = postJson("/api/auth/register", body, 422);

        assertThat(error.get("error").asText()).isEqualTo("WEAK_PASSWORD");
    }

    @Test
    @DisplayName("register should report field errors with 422 for an invalid email and unknown role")
    void register_shouldRejectInvalidInput() throws Exception {
        Map<String, Object> body = registration(unique("bad"), "user");
        body.put("email", "not-an-email");

        JsonNode error = postJson("/api/auth/register", body, 422);
        assertThat(error.get("fields").has("email")).isTrue();

        Map<String, Object> badRole = registration(unique("bad"), "drummer");
        postJson("/api/auth/register", badRole, 422);
    }

    @Test
    @DisplayName("register should reject a taken username with 400")
    void register_shouldRejectDuplicateUsername() throws Exception {
        String username = unique("dup");
        register(username, "user");

        Map<String, Object> again = registration(username, "user");
        again.put("email", unique("other") + "@example.com");

        JsonNode error = postJson("/api/auth/register", again, 400);
        assertThat(error.get("message").asText()).isEqualTo("Username already taken");
    }

    // ========================================
    // TOKENS
    // ========================================

    @Test
    @DisplayName("protected endpoints should return 401 with a Bearer challenge without a valid token")
    void protectedEndpoint_shouldRequireToken() throws Exception {
        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"));

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer("garbage")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Could not validate credentials"));
    }

    @Test
    @DisplayName("refresh should rotate the pair and refuse the old refresh token")
    void refresh_shouldRotateTokens() throws Exception {
        JsonNode registered = register(unique("rot"), "user");
        String refreshToken = registered.get("refresh_token").asText();

        // a refresh token is not a bearer token
        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(refreshToken)))
                .andExpect(status().isUnauthorized());

        JsonNode rotated = postJson("/api/auth/refresh", Map.of("refresh_token", refreshToken), 200);
        assertThat(rotated.get("refresh_token").asText()).isNotEqualTo(refreshToken);

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(accessTokenOf(rotated))))
                .andExpect(status().isOk());

        postJson("/api/auth/refresh", Map.of("refresh_token", refreshToken), 401);
    }

    @Test
    @DisplayName("logout should revoke the presented access token")
    void logout_shouldRevokeToken() throws Exception {
        String token = accessTokenOf(register(unique("out"), "venue"));

        mockMvc.perform(post("/api/auth/logout").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("deactivation should block later logins after the password check")
    void deactivate_shouldBlockLogin() throws Exception {
        String username = unique("gone");
        String token = accessTokenOf(register(username, "promoter"));

        mockMvc.perform(post("/api/auth/me/deactivate").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isNoContent());

        JsonNode denied = postJson("/api/auth/login", Map.of("identifier", username, "password", PASSWORD), 401);
        assertThat(denied.get("error").asText()).isEqualTo("ACCOUNT_DEACTIVATED");

        JsonNode wrong = postJson("/api/auth/login", Map.of("identifier", username, "password", "wrongpass1"), 401);
        assertThat(wrong.get("error").asText()).isEqualTo("INVALID_CREDENTIALS");
    }

    // ========================================
    // ARTIST PROFILE
    // ========================================

    @Test
    @DisplayName("profile update should keep absent fields and clear explicit nulls")
    void updateProfile_shouldBePresenceAware() throws Exception {
        Map<String, Object> body = registration(unique("bass"), "artist");
        body.put("bio", "Bassist");
        body.put("location", "Berlin");
        JsonNode registered = postJson("/api/auth/register", body, 201);
        String token = accessTokenOf(registered);

        mockMvc.perform(put("/api/artists/me")
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"location\": null, \"instruments\": [\"bass\", \"synth\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bio").value("Bassist"))
                .andExpect(jsonPath("$.location").doesNotExist())
                .andExpect(jsonPath("$.instruments", contains("bass", "synth")));

        mockMvc.perform(get("/api/artists/me").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bio").value("Bassist"))
                .andExpect(jsonPath("$.account.username").value(body.get("username")));
    }

    @Test
    @DisplayName("profile picture upload should be served back publicly with its content type")
    void profilePicture_shouldRoundTrip() throws Exception {
        JsonNode registered = register(unique("pic"), "artist");
        String token = accessTokenOf(registered);
        long accountId = registered.get("account").get("id").asLong();
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};

        mockMvc.perform(multipart("/api/artists/me/profile-picture")
                        .file(new MockMultipartFile("file", "me.png", "image/png", png))
                        .header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content_type").value("image/png"))
                .andExpect(jsonPath("$.size_bytes").value(png.length));

        mockMvc.perform(get("/api/artists/{id}/profile-picture", accountId))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"))
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, containsString("max-age=3600")))
                .andExpect(content().bytes(png));

        mockMvc.perform(multipart("/api/artists/me/profile-picture")
                        .file(new MockMultipartFile("file", "notes.txt", "text/plain", new byte[] {1}))
                        .header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid file type. Only images are allowed."));

        for (String unsafe : new String[] {"image/", "image/svg+xml"}) {
            mockMvc.perform(multipart("/api/artists/me/profile-picture")
                            .file(new MockMultipartFile("file", "x.svg", unsafe, "<svg/>".getBytes()))
                            .header(HttpHeaders.AUTHORIZATION, bearer(token)))
                    .andExpect(status().isBadRequest());
        }

        // the earlier png is still what the public endpoint serves
        mockMvc.perform(get("/api/artists/{id}/profile-picture", accountId))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"));
    }

    @Test
    @DisplayName("search should filter active artists by tag and paginate")
    void search_shouldFilterByGenre() throws Exception {
        String genre = unique("genre");
        for (int i = 0; i < 3; i++) {
            Map<String, Object> body = registration(unique("srch"), "artist");
            body.put("genres", List.of(genre));
            postJson("/api/auth/register", body, 201);
        }

        mockMvc.perform(get("/api/artists/search")
                        .param("genre", genre.toUpperCase())
                        .param("page", "1")
                        .param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.artists", hasSize(2)))
                .andExpect(jsonPath("$.pagination.total").value(3))
                .andExpect(jsonPath("$.pagination.pages").value(2));

        mockMvc.perform(get("/api/artists/search").param("limit", "0"))
                .andExpect(status().isUnprocessableEntity());
    }

    // ========================================
    // COLLABORATIONS
    // ========================================

    @Test
    @DisplayName("collaboration requests should allow one pending request per pair and only the target may answer")
    void collaboration_lifecycle() throws Exception {
        String requesterToken = accessTokenOf(register(unique("req"), "artist"));
        JsonNode target = register(unique("tgt"), "artist");
        String targetToken = accessTokenOf(target);
        long targetId = target.get("account").get("id").asLong();

        Map<String, Object> request = Map.of("target_artist_id", targetId, "message", "Let's jam");

        MvcResult created = mockMvc.perform(post("/api/artists/collaborations")
                        .header(HttpHeaders.AUTHORIZATION, bearer(requesterToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("pending"))
                .andReturn();
        long collaborationId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

        mockMvc.perform(post("/api/artists/collaborations")
                        .header(HttpHeaders.AUTHORIZATION, bearer(requesterToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(request)))
                .andExpect(status().isConflict());

        mockMvc.perform(put("/api/artists/collaborations/{id}/accept", collaborationId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(requesterToken)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/artists/collaborations").header(HttpHeaders.AUTHORIZATION, bearer(targetToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.collaborations.received", hasSize(1)))
                .andExpect(jsonPath("$.collaborations.sent", hasSize(0)));

        mockMvc.perform(put("/api/artists/collaborations/{id}/accept", collaborationId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(targetToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("accepted"));

        mockMvc.perform(put("/api/artists/collaborations/{id}/decline", collaborationId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(targetToken)))
                .andExpect(status().isConflict());
    }
}
