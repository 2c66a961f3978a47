package com.aboutblank.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * User entity identified solely by an opaque auth key hash.
 *
 * Rows are created implicitly the first time a key authenticates and are
 * never deleted by the application; deleting one cascades to every row the
 * user owns at the schema level.
 *
 * Database Table: users
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_last_active", columnList = "last_active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

    /**
     * 64-character hex digest supplied by the client. Not reversible to any
     * personal identifier.
     */
    @Id
    @Column(name = "auth_key_hash", updatable = false, nullable = false)
    private String authKeyHash;

    @Column(name = "created_at", nullable = false, updatable = false, insertable = false)
    private Instant createdAt;

    /**
     * Refreshed by every authenticated request.
     */
    @Column(name = "last_active", nullable = false, insertable = false, updatable = false)
    private Instant lastActive;
}
