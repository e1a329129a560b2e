package com.openforge.setlist.repository;

import com.openforge.setlist.domain.ArtistProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ArtistProfileRepository
        extends JpaRepository<ArtistProfile, Long>, JpaSpecificationExecutor<ArtistProfile> {

    Optional<ArtistProfile> findByAccountId(Long accountId);

    boolean existsByAccountId(Long accountId);
}
