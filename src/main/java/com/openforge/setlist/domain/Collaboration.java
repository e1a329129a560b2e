package com.openforge.setlist.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.Locale;

/**
 * A directed collaboration request from one artist to another.
 *
 * Status only ever moves PENDING → ACCEPTED or PENDING → DECLINED, and only
 * the target account may move it. Both outcomes are terminal.
 */
@Getter
@Setter
@Entity
@Table(
    name = "collaborations",
    indexes = @Index(name = "idx_collaborations_pair", columnList = "requester_id, target_id, status")
)
public class Collaboration extends BaseEntity {

    public enum Status {
        PENDING,
        ACCEPTED,
        DECLINED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "requester_id", nullable = false, updatable = false)
    private Account requester;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "target_id", nullable = false, updatable = false)
    private Account target;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    /** recording | live | songwriting | ... free-form tag, optional. */
    @Column(name = "project_type", length = 64)
    private String projectType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.PENDING;

    public boolean isPending() {
        return status == Status.PENDING;
    }
}
