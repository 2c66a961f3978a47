package com.aboutblank.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * ChallengeProgress entity for the gamified challenge track.
 *
 * Database Table: challenge_progress
 */
@Entity
@Table(name = "challenge_progress")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeProgress {

    @Id
    @Column(name = "auth_key_hash", updatable = false, nullable = false)
    private String authKeyHash;

    @Column(name = "xp_points")
    private Integer xpPoints;

    @Column(name = "current_challenge_index")
    private Integer currentChallengeIndex;

    @Column(name = "last_skip_time")
    private Instant lastSkipTime;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
