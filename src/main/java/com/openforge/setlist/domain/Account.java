package com.openforge.setlist.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A registered identity: credentials plus role.
 *
 * Email and username are each backed by a unique index; that index is what
 * keeps two racing registrations from both succeeding. Email is stored
 * lower-cased so the index is effectively case-insensitive.
 */
@Getter
@Setter
@Entity
@Table(
    name = "accounts",
    uniqueConstraints = {
        @UniqueConstraint(name = Account.EMAIL_CONSTRAINT, columnNames = "email"),
        @UniqueConstraint(name = Account.USERNAME_CONSTRAINT, columnNames = "username")
    }
)
public class Account extends BaseEntity {

    public static final String EMAIL_CONSTRAINT    = "uq_accounts_email";
    public static final String USERNAME_CONSTRAINT = "uq_accounts_username";

    @Column(nullable = false, length = 255, updatable = false)
    private String email;

    @Column(nullable = false, length = 50, updatable = false)
    private String username;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private Role role = Role.USER;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "last_login_time")
    private LocalDateTime lastLoginTime;

    public boolean hasRole(Role required) {
        return role == required;
    }
}
