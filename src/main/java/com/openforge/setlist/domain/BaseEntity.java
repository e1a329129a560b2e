package com.openforge.setlist.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Audit columns shared by every table.
 *
 * - create_time  : set once on INSERT, never touched again
 * - update_time  : refreshed on every UPDATE of an owned field
 * - version      : JPA @Version, optimistic-lock counter
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private LocalDateTime createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    /**
     * Two concurrent writers flushing the same row make the second one fail
     * with OptimisticLockException instead of silently overwriting.
     */
    @Version
    @Column(nullable = false)
    private Integer version;
}
