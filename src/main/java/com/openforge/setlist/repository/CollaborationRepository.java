package com.openforge.setlist.repository;

import com.openforge.setlist.domain.Collaboration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CollaborationRepository extends JpaRepository<Collaboration, Long> {

    boolean existsByRequesterIdAndTargetIdAndStatus(
            Long requesterId, Long targetId, Collaboration.Status status);

    List<Collaboration> findByRequesterIdOrderByIdDesc(Long requesterId);

    List<Collaboration> findByTargetIdOrderByIdDesc(Long targetId);
}
