package com.aboutblank.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Progress entity holding a user's recovery goal and check-in history.
 *
 * One row per user, keyed by the auth key hash. Writes go through the native
 * upsert in UpsertRepository and replace every column at once; this entity
 * is only used for reads.
 *
 * Database Table: progress
 */
@Entity
@Table(name = "progress")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Progress {

    @Id
    @Column(name = "auth_key_hash", updatable = false, nullable = false)
    private String authKeyHash;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "goal_days")
    private Integer goalDays;

    @Column(name = "goal_description", columnDefinition = "TEXT")
    private String goalDescription;

    /**
     * Ordered check-in records as sent by the client. Stored as JSONB and
     * never inspected server-side.
     *
     * Example structure:
     * [
     *   { "date": "2024-02-01", "mood": 4, "note": "Good day" },
     *   { "date": "2024-02-02", "mood": 3 }
     * ]
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "check_ins", columnDefinition = "jsonb", nullable = false)
    private List<Object> checkIns = new ArrayList<>();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
