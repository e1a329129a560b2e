package com.openforge.setlist.artist;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.setlist.domain.ArtistProfile;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

/**
 * Presence-aware update of an artist profile, read straight from the JSON
 * body so that a missing key and an explicit {@code null} stay distinct.
 */
public record ArtistProfilePatch(
        PatchField<String>       bio,
        PatchField<List<String>> genres,
        PatchField<List<String>> instruments,
        PatchField<String>       location,
        PatchField<String>       website
) {

    static final int MAX_BIO_LENGTH  = 5000;
    static final int MAX_TEXT_LENGTH = 255;
    static final int MAX_TAG_LENGTH  = 64;

    public static ArtistProfilePatch empty() {
        return new ArtistProfilePatch(
                PatchField.absent(), PatchField.absent(), PatchField.absent(),
                PatchField.absent(), PatchField.absent());
    }

    public static ArtistProfilePatch fromJson(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw invalid("request body must be a JSON object");
        }
        return new ArtistProfilePatch(
                text(body, "bio", MAX_BIO_LENGTH),
                tags(body, "genres"),
                tags(body, "instruments"),
                text(body, "location", MAX_TEXT_LENGTH),
                text(body, "website", MAX_TEXT_LENGTH));
    }

    public boolean isEmpty() {
        return !bio.isPresent() && !genres.isPresent() && !instruments.isPresent()
                && !location.isPresent() && !website.isPresent();
    }

    /** Names of the fields this patch touches, in wire order. */
    public List<String> presentFields() {
        List<String> names = new ArrayList<>();
        if (bio.isPresent())         names.add("bio");
        if (genres.isPresent())      names.add("genres");
        if (instruments.isPresent()) names.add("instruments");
        if (location.isPresent())    names.add("location");
        if (website.isPresent())     names.add("website");
        return names;
    }

    /** Write every present field; a present null clears (lists become empty). */
    public void applyTo(ArtistProfile profile) {
        bio.applyTo(profile::setBio);
        genres.applyTo(profile::replaceGenres);
        instruments.applyTo(profile::replaceInstruments);
        location.applyTo(profile::setLocation);
        website.applyTo(profile::setWebsite);
    }

    // ── JSON helpers ─────────────────────────────────────────────────────────

    private static PatchField<String> text(JsonNode body, String field, int maxLength) {
        if (!body.has(field)) {
            return PatchField.absent();
        }
        JsonNode node = body.get(field);
        if (node.isNull()) {
            return PatchField.of(null);
        }
        if (!node.isTextual()) {
            throw invalid(field + " must be a string or null");
        }
        String value = node.asText();
        if (value.length() > maxLength) {
            throw invalid(field + " must be at most " + maxLength + " characters");
        }
        return PatchField.of(value);
    }

    private static PatchField<List<String>> tags(JsonNode body, String field) {
        if (!body.has(field)) {
            return PatchField.absent();
        }
        JsonNode node = body.get(field);
        if (node.isNull()) {
            return PatchField.of(null);
        }
        if (!node.isArray()) {
            throw invalid(field + " must be a list of strings or null");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw invalid(field + " must contain only non-blank strings");
            }
            String tag = item.asText().trim();
            if (tag.length() > MAX_TAG_LENGTH) {
                throw invalid(field + " entries must be at most " + MAX_TAG_LENGTH + " characters");
            }
            values.add(tag);
        }
        return PatchField.of(List.copyOf(values));
    }

    private static ResponseStatusException invalid(String reason) {
        return new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, reason);
    }
}
