package com.aboutblank.repository;

import com.aboutblank.entity.CravingEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for CravingEvent entity.
 *
 * Craving events are append-only, so besides the inherited save this
 * repository only exposes ordered reads for a single user.
 */
@Repository
public interface CravingEventRepository extends JpaRepository<CravingEvent, Long> {

    /**
     * Find a user's craving events, newest first.
     *
     * Events sharing a timestamp fall back to insertion order (newest first)
     * so the ordering is stable across calls.
     *
     * @param authKeyHash the owner's auth key hash
     * @param pageable page size caps the number of events returned
     * @return the user's events ordered by timestamp descending
     */
    List<CravingEvent> findByUserAuthKeyHashOrderByTimestampDescIdDesc(String authKeyHash, Pageable pageable);

    /**
     * Count craving events owned by a user.
     *
     * @param authKeyHash the owner's auth key hash
     * @return number of stored events
     */
    long countByUserAuthKeyHash(String authKeyHash);
}
