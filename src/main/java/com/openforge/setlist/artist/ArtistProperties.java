package com.openforge.setlist.artist;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * app:
 *   artist:
 *     profile-picture-max-size: 5MB
 */
@ConfigurationProperties(prefix = "app.artist")
public record ArtistProperties(
        @DefaultValue("5MB") DataSize profilePictureMaxSize
) {}
