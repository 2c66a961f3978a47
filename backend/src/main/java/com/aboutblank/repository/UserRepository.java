package com.aboutblank.repository;

import com.aboutblank.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for User entity operations.
 *
 * Registration itself is an upsert and lives in UpsertRepository; this
 * interface covers lookups only.
 */
@Repository
public interface UserRepository extends JpaRepository<User, String> {
}
