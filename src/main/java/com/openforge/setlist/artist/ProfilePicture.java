package com.openforge.setlist.artist;

/** Stored picture bytes with their declared content type. */
public record ProfilePicture(byte[] data, String contentType) {
}
