package com.openforge.setlist.collaboration.dto;

import java.util.List;

/**
 * {"collaborations": {"sent": [...], "received": [...]}}
 */
public record CollaborationListResponse(Collaborations collaborations) {

    public record Collaborations(
            List<CollaborationResponse> sent,
            List<CollaborationResponse> received
    ) {}
}
