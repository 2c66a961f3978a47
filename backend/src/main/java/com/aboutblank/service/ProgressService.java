package com.aboutblank.service;

import com.aboutblank.dto.request.ProgressRequest;
import com.aboutblank.dto.response.ProgressResponse;
import com.aboutblank.exception.SyncOperationException;
import com.aboutblank.repository.ProgressRepository;
import com.aboutblank.repository.UpsertRepository;
import com.aboutblank.security.AuthKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Service for a user's recovery progress.
 *
 * Progress is one row per user and is replaced wholesale on every save; the
 * last save to commit wins.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProgressService {

    private final UpsertRepository upsertRepository;
    private final ProgressRepository progressRepository;

    /**
     * Replace the user's progress with the given payload.
     *
     * @param authKeyHash the authenticated user
     * @param request the full progress payload
     * @throws SyncOperationException if the datastore write fails
     */
    public void saveProgress(String authKeyHash, ProgressRequest request) {
        try {
            upsertRepository.upsertProgress(
                    authKeyHash,
                    request.getStartDate(),
                    request.getGoalDays(),
                    request.getGoalDescription(),
                    request.getCheckIns()
            );
        } catch (DataAccessException ex) {
            log.error("Failed to save progress for user {}: {}", AuthKeys.abbreviate(authKeyHash), ex.getMessage(), ex);
            throw new SyncOperationException("save-progress", "Failed to save progress", ex);
        }

        log.info("Progress saved for user {} (check-ins: {})", AuthKeys.abbreviate(authKeyHash),
                request.getCheckIns() != null ? request.getCheckIns().size() : 0);
    }

    /**
     * Load the user's progress.
     *
     * @param authKeyHash the authenticated user
     * @return the stored progress, or empty if the user never saved any
     * @throws SyncOperationException if the datastore read fails
     */
    public Optional<ProgressResponse> loadProgress(String authKeyHash) {
        try {
            Optional<ProgressResponse> progress = progressRepository.findById(authKeyHash)
                    .map(ProgressResponse::fromEntity);
            log.debug("Loaded progress for user {}: present={}", AuthKeys.abbreviate(authKeyHash), progress.isPresent());
            return progress;
        } catch (DataAccessException ex) {
            log.error("Failed to load progress for user {}: {}", AuthKeys.abbreviate(authKeyHash), ex.getMessage(), ex);
            throw new SyncOperationException("load-progress", "Failed to load progress", ex);
        }
    }
}
