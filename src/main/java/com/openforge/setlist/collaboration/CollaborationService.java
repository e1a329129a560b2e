package com.openforge.setlist.collaboration;

import com.openforge.setlist.auth.AccountPrincipal;
import com.openforge.setlist.auth.AuthError;
import com.openforge.setlist.auth.AuthException;
import com.openforge.setlist.auth.Authorizer;
import com.openforge.setlist.collaboration.dto.CollaborationListResponse;
import com.openforge.setlist.collaboration.dto.CollaborationResponse;
import com.openforge.setlist.collaboration.dto.CreateCollaborationRequest;
import com.openforge.setlist.domain.Account;
import com.openforge.setlist.domain.Collaboration;
import com.openforge.setlist.domain.Role;
import com.openforge.setlist.repository.AccountRepository;
import com.openforge.setlist.repository.CollaborationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Collaboration requests between artists.
 *
 * At most one PENDING request per (requester, target) pair. The requester's
 * account row is locked while the pair is checked and the request inserted,
 * so two concurrent sends from the same artist cannot both pass the check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollaborationService {

    private final CollaborationRepository collaborationRepository;
    private final AccountRepository       accountRepository;
    private final Authorizer              authorizer;

    @Transactional
    public CollaborationResponse create(AccountPrincipal principal, CreateCollaborationRequest req) {
        Account requester = accountRepository.findByIdForUpdate(principal.accountId())
                .orElseThrow(() -> new AuthException(AuthError.INVALID_CREDENTIALS));
        authorizer.requireRole(requester, Role.ARTIST);

        if (requester.getId().equals(req.targetArtistId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Cannot send a collaboration request to yourself");
        }

        Account target = accountRepository.findById(req.targetArtistId())
                .filter(Account::isActive)
                .filter(a -> a.hasRole(Role.ARTIST))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Target artist not found"));

        if (collaborationRepository.existsByRequesterIdAndTargetIdAndStatus(
                requester.getId(), target.getId(), Collaboration.Status.PENDING)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "A pending collaboration request to this artist already exists");
        }

        Collaboration collaboration = new Collaboration();
        collaboration.setRequester(requester);
        collaboration.setTarget(target);
        collaboration.setMessage(req.message().trim());
        collaboration.setProjectType(req.projectType());
        collaboration.setStatus(Collaboration.Status.PENDING);

        Collaboration saved = collaborationRepository.saveAndFlush(collaboration);
        log.info("[Collab] Request id={} from accountId={} to accountId={}",
                saved.getId(), requester.getId(), target.getId());
        return CollaborationResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public CollaborationListResponse list(AccountPrincipal principal) {
        Account artist = requireArtist(principal);
        return new CollaborationListResponse(new CollaborationListResponse.Collaborations(
                collaborationRepository.findByRequesterIdOrderByIdDesc(artist.getId())
                        .stream().map(CollaborationResponse::from).toList(),
                collaborationRepository.findByTargetIdOrderByIdDesc(artist.getId())
                        .stream().map(CollaborationResponse::from).toList()));
    }

    @Transactional
    public CollaborationResponse accept(AccountPrincipal principal, Long collaborationId) {
        return resolve(principal, collaborationId, Collaboration.Status.ACCEPTED);
    }

    @Transactional
    public CollaborationResponse decline(AccountPrincipal principal, Long collaborationId) {
        return resolve(principal, collaborationId, Collaboration.Status.DECLINED);
    }

    /** PENDING → outcome, target only. */
    private CollaborationResponse resolve(AccountPrincipal principal, Long collaborationId,
                                          Collaboration.Status outcome) {
        Account artist = requireArtist(principal);

        Collaboration collaboration = collaborationRepository.findById(collaborationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Collaboration request not found"));

        if (!collaboration.getTarget().getId().equals(artist.getId())) {
            throw new AuthException(AuthError.FORBIDDEN, "Only the target artist can respond to this request");
        }
        if (!collaboration.isPending()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Collaboration request is already " + collaboration.getStatus().wireName());
        }

        collaboration.setStatus(outcome);
        Collaboration saved = collaborationRepository.saveAndFlush(collaboration);
        log.info("[Collab] Request id={} {} by accountId={}", saved.getId(), outcome, artist.getId());
        return CollaborationResponse.from(saved);
    }

    private Account requireArtist(AccountPrincipal principal) {
        Account account = accountRepository.findById(principal.accountId())
                .orElseThrow(() -> new AuthException(AuthError.INVALID_CREDENTIALS));
        return authorizer.requireRole(account, Role.ARTIST);
    }
}
