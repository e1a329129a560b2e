package com.openforge.setlist.collaboration.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateCollaborationRequest(
        @NotNull
        Long targetArtistId,

        @NotBlank
        @Size(max = 2000)
        String message,

        @Size(max = 64)
        String projectType
) {
}
