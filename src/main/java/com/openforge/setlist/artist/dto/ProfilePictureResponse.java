package com.openforge.setlist.artist.dto;

public record ProfilePictureResponse(
        String filename,
        String contentType,
        long   sizeBytes
) {
}
