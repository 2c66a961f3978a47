package com.aboutblank.repository;

import com.aboutblank.entity.Progress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read access to Progress rows, keyed by auth key hash.
 */
@Repository
public interface ProgressRepository extends JpaRepository<Progress, String> {
}
