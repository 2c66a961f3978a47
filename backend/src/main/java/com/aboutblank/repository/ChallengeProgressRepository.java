package com.aboutblank.repository;

import com.aboutblank.entity.ChallengeProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read access to ChallengeProgress rows, keyed by auth key hash.
 */
@Repository
public interface ChallengeProgressRepository extends JpaRepository<ChallengeProgress, String> {
}
