package com.openforge.setlist.collaboration.dto;

import com.openforge.setlist.domain.Collaboration;

import java.time.LocalDateTime;

public record CollaborationResponse(
        Long                 id,
        Long                 requesterId,
        String               requesterUsername,
        Long                 targetArtistId,
        String               targetUsername,
        String               message,
        String               projectType,
        Collaboration.Status status,
        LocalDateTime        createTime,
        LocalDateTime        updateTime
) {

    public static CollaborationResponse from(Collaboration c) {
        return new CollaborationResponse(
                c.getId(),
                c.getRequester().getId(),
                c.getRequester().getUsername(),
                c.getTarget().getId(),
                c.getTarget().getUsername(),
                c.getMessage(),
                c.getProjectType(),
                c.getStatus(),
                c.getCreateTime(),
                c.getUpdateTime());
    }
}
