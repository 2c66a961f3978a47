package com.aboutblank.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * CravingEvent entity for the append-only craving log.
 *
 * Each row records one craving the user logged on the device. Rows are
 * inserted once and never updated; there is no deduplication key, so the
 * same payload posted twice produces two rows.
 *
 * Database Table: cravings
 */
@Entity
@Table(name = "cravings", indexes = {
    @Index(name = "idx_cravings_auth", columnList = "auth_key_hash"),
    @Index(name = "idx_cravings_timestamp", columnList = "timestamp")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CravingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Owner of the event. Foreign key to users with cascade delete.
     */
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "auth_key_hash", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_craving_user"))
    private User user;

    /**
     * When the craving happened on the device, not when it was uploaded.
     */
    @Column(name = "timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "intensity", updatable = false)
    private Integer intensity;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "triggers", columnDefinition = "jsonb", nullable = false, updatable = false)
    private List<String> triggers = new ArrayList<>();

    @Column(name = "notes", columnDefinition = "TEXT", updatable = false)
    private String notes;

    @Column(name = "overcome", updatable = false)
    private Boolean overcome;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Constructor for logging a new craving.
     *
     * @param user the owning user
     * @param timestamp when the craving happened
     * @param intensity reported intensity
     * @param triggers trigger labels, never null
     * @param notes free-text notes
     * @param overcome whether the user resisted the craving
     */
    public CravingEvent(User user, Instant timestamp, Integer intensity, List<String> triggers,
                        String notes, Boolean overcome) {
        this.user = user;
        this.timestamp = timestamp;
        this.intensity = intensity;
        this.triggers = triggers;
        this.notes = notes;
        this.overcome = overcome;
    }
}
