package com.aboutblank.service;

import com.aboutblank.entity.User;
import com.aboutblank.exception.SyncOperationException;
import com.aboutblank.repository.UpsertRepository;
import com.aboutblank.security.AuthKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Service behind the authentication gate.
 *
 * There is no sign-up: the first request carrying a well-formed key creates
 * the user row, and every later request refreshes its last_active timestamp.
 * Both happen in the same single upsert statement, so two devices presenting
 * a new key at the same moment still end up with one row.
 *
 * @see com.aboutblank.security.AuthKeyAuthenticationFilter
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserService {

    private final UpsertRepository upsertRepository;

    /**
     * Get the user for an auth key, creating it if the key has never been seen.
     *
     * @param authKeyHash a key already validated by {@link AuthKeys#isValid(String)}
     * @return the stored user row
     * @throws SyncOperationException if the datastore cannot be reached or rejects the write
     */
    public User getOrCreate(String authKeyHash) {
        User user;
        try {
            user = upsertRepository.upsertUser(authKeyHash);
        } catch (DataAccessException ex) {
            log.error("Failed to get or create user {}: {}", AuthKeys.abbreviate(authKeyHash), ex.getMessage(), ex);
            throw new SyncOperationException("authenticate", "Authentication failed", ex);
        }

        // created_at and last_active share the statement's NOW() only on insert
        if (user.getCreatedAt() != null && user.getCreatedAt().equals(user.getLastActive())) {
            log.info("Registered new user {}", AuthKeys.abbreviate(authKeyHash));
        } else {
            log.debug("Refreshed last_active for user {}", AuthKeys.abbreviate(authKeyHash));
        }
        return user;
    }
}
