package com.aboutblank.service;

import com.aboutblank.dto.request.ChallengeRequest;
import com.aboutblank.dto.response.ChallengeResponse;
import com.aboutblank.exception.SyncOperationException;
import com.aboutblank.repository.ChallengeProgressRepository;
import com.aboutblank.repository.UpsertRepository;
import com.aboutblank.security.AuthKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Service for gamified challenge state. Same replace-on-write rules as progress.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChallengeService {

    private final UpsertRepository upsertRepository;
    private final ChallengeProgressRepository challengeProgressRepository;

    public void saveChallenges(String authKeyHash, ChallengeRequest request) {
        try {
            upsertRepository.upsertChallengeProgress(
                    authKeyHash,
                    request.getXpPoints(),
                    request.getCurrentChallengeIndex(),
                    request.getLastSkipTime()
            );
        } catch (DataAccessException ex) {
            log.error("Failed to save challenges for user {}: {}", AuthKeys.abbreviate(authKeyHash), ex.getMessage(), ex);
            throw new SyncOperationException("save-challenges", "Failed to save challenges", ex);
        }

        log.info("Challenge progress saved for user {} (xp: {}, index: {})", AuthKeys.abbreviate(authKeyHash),
                request.getXpPoints(), request.getCurrentChallengeIndex());
    }

    public Optional<ChallengeResponse> loadChallenges(String authKeyHash) {
        try {
            Optional<ChallengeResponse> challenges = challengeProgressRepository.findById(authKeyHash)
                    .map(ChallengeResponse::fromEntity);
            log.debug("Loaded challenges for user {}: present={}", AuthKeys.abbreviate(authKeyHash),
                    challenges.isPresent());
            return challenges;
        } catch (DataAccessException ex) {
            log.error("Failed to load challenges for user {}: {}", AuthKeys.abbreviate(authKeyHash), ex.getMessage(), ex);
            throw new SyncOperationException("load-challenges", "Failed to load challenges", ex);
        }
    }
}
