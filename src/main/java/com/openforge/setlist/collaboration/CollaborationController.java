package com.openforge.setlist.collaboration;

import com.openforge.setlist.auth.AccountPrincipal;
import com.openforge.setlist.collaboration.dto.CollaborationListResponse;
import com.openforge.setlist.collaboration.dto.CollaborationResponse;
import com.openforge.setlist.collaboration.dto.CreateCollaborationRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Artist-only collaboration endpoints.
 *
 *   POST /api/artists/collaborations               : send a request, 201
 *   GET  /api/artists/collaborations               : sent and received
 *   PUT  /api/artists/collaborations/{id}/accept   : target only
 *   PUT  /api/artists/collaborations/{id}/decline  : target only
 */
@RestController
@RequestMapping("/api/artists/collaborations")
@RequiredArgsConstructor
public class CollaborationController {

    private final CollaborationService collaborationService;

    @PostMapping
    public ResponseEntity<CollaborationResponse> create(
            @AuthenticationPrincipal AccountPrincipal principal,
            @Valid @RequestBody CreateCollaborationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(collaborationService.create(principal, request));
    }

    @GetMapping
    public CollaborationListResponse list(@AuthenticationPrincipal AccountPrincipal principal) {
        return collaborationService.list(principal);
    }

    @PutMapping("/{id}/accept")
    public CollaborationResponse accept(
            @AuthenticationPrincipal AccountPrincipal principal,
            @PathVariable Long id) {
        return collaborationService.accept(principal, id);
    }

    @PutMapping("/{id}/decline")
    public CollaborationResponse decline(
            @AuthenticationPrincipal AccountPrincipal principal,
            @PathVariable Long id) {
        return collaborationService.decline(principal, id);
    }
}
