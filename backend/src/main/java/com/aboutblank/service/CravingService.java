package com.aboutblank.service;

import com.aboutblank.dto.request.CravingRequest;
import com.aboutblank.dto.response.CravingResponse;
import com.aboutblank.entity.CravingEvent;
import com.aboutblank.entity.User;
import com.aboutblank.exception.SyncOperationException;
import com.aboutblank.repository.CravingEventRepository;
import com.aboutblank.repository.UserRepository;
import com.aboutblank.security.AuthKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for the append-only craving log.
 *
 * Every save inserts a new row, so retrying a save that actually succeeded
 * produces a duplicate event. Reads return the newest events first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CravingService {

    private final CravingEventRepository cravingEventRepository;
    private final UserRepository userRepository;

    @Value("${app.sync.cravings.default-limit:1000}")
    private int defaultLimit;

    @Value("${app.sync.cravings.max-limit:1000}")
    private int maxLimit;

    /**
     * Append one craving event to the user's log.
     *
     * A missing timestamp is recorded as the current server time and missing
     * triggers as an empty list.
     *
     * @param authKeyHash the authenticated user
     * @param request the craving event
     * @throws SyncOperationException if the insert fails
     */
    public void saveCraving(String authKeyHash, CravingRequest request) {
        try {
            // The gate has already created the user row; a reference avoids a SELECT.
            User owner = userRepository.getReferenceById(authKeyHash);
            CravingEvent event = new CravingEvent(
                    owner,
                    request.getTimestamp() != null ? request.getTimestamp() : Instant.now(),
                    request.getIntensity(),
                    request.getTriggers() != null ? request.getTriggers() : new ArrayList<>(),
                    request.getNotes(),
                    request.getOvercome()
            );
            event = cravingEventRepository.save(event);
            log.info("Craving saved for user {}: id={}, intensity={}", AuthKeys.abbreviate(authKeyHash),
                    event.getId(), event.getIntensity());
        } catch (DataAccessException ex) {
            log.error("Failed to save craving for user {}: {}", AuthKeys.abbreviate(authKeyHash), ex.getMessage(), ex);
            throw new SyncOperationException("save-craving", "Failed to save craving", ex);
        }
    }

    /**
     * Load the user's most recent craving events, newest first.
     *
     * @param authKeyHash the authenticated user
     * @param limit requested maximum; null or non-positive means the default,
     *              values above the maximum are clamped to it
     * @return up to the effective limit of events
     * @throws SyncOperationException if the read fails
     */
    public List<CravingResponse> loadCravings(String authKeyHash, Integer limit) {
        int effectiveLimit = resolveLimit(limit);
        try {
            List<CravingResponse> cravings = cravingEventRepository
                    .findByUserAuthKeyHashOrderByTimestampDescIdDesc(authKeyHash, PageRequest.of(0, effectiveLimit))
                    .stream()
                    .map(CravingResponse::fromEntity)
                    .collect(Collectors.toList());
            log.debug("Loaded {} cravings for user {} (limit {})", cravings.size(),
                    AuthKeys.abbreviate(authKeyHash), effectiveLimit);
            return cravings;
        } catch (DataAccessException ex) {
            log.error("Failed to load cravings for user {}: {}", AuthKeys.abbreviate(authKeyHash), ex.getMessage(), ex);
            throw new SyncOperationException("load-cravings", "Failed to load cravings", ex);
        }
    }

    int resolveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return defaultLimit;
        }
        return Math.min(limit, maxLimit);
    }
}
