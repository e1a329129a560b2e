package com.openforge.setlist.repository;

import com.openforge.setlist.domain.Account;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    Optional<Account> findByUsername(String username);

    Optional<Account> findByEmail(String email);

    /**
     * Login helper: allow username or email.
     */
    Optional<Account> findByUsernameOrEmail(String username, String email);

    /**
     * Row-locks the account for the rest of the transaction. Used to serialise
     * check-then-insert sequences that a unique index cannot express.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Account a where a.id = :id")
    Optional<Account> findByIdForUpdate(@Param("id") Long id);

    /**
     * Stamps the login time with a bulk update, so the row's @Version is left
     * alone and overlapping logins do not conflict.
     */
    @Modifying
    @Query("update Account a set a.lastLoginTime = :time where a.id = :id")
    int stampLastLogin(@Param("id") Long id, @Param("time") LocalDateTime time);
}
