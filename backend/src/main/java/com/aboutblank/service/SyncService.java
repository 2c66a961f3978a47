package com.aboutblank.service;

import com.aboutblank.dto.response.ChallengeResponse;
import com.aboutblank.dto.response.CravingResponse;
import com.aboutblank.dto.response.FullSyncResponse;
import com.aboutblank.dto.response.ProgressResponse;
import com.aboutblank.exception.SyncOperationException;
import com.aboutblank.security.AuthKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Service for the composite full sync read.
 *
 * The three reads run concurrently on the sync executor and are joined before
 * the response is built. They are independent statements, not one snapshot.
 * If any of them fails the whole sync fails; a partial result is never returned.
 */
@Service
@Slf4j
public class SyncService {

    private final ProgressService progressService;
    private final CravingService cravingService;
    private final ChallengeService challengeService;
    private final Executor syncExecutor;

    public SyncService(ProgressService progressService,
                       CravingService cravingService,
                       ChallengeService challengeService,
                       @Qualifier("syncExecutor") Executor syncExecutor) {
        this.progressService = progressService;
        this.cravingService = cravingService;
        this.challengeService = challengeService;
        this.syncExecutor = syncExecutor;
    }

    /**
     * Read everything stored for a user.
     *
     * Cravings use the default limit of the cravings endpoint.
     *
     * @param authKeyHash the authenticated user
     * @return progress and challenges (null when never saved), cravings newest first,
     *         and the server time of the sync
     * @throws SyncOperationException if any of the reads fails
     */
    public FullSyncResponse fullSync(String authKeyHash) {
        CompletableFuture<Optional<ProgressResponse>> progressFuture =
                CompletableFuture.supplyAsync(() -> progressService.loadProgress(authKeyHash), syncExecutor);
        CompletableFuture<List<CravingResponse>> cravingsFuture =
                CompletableFuture.supplyAsync(() -> cravingService.loadCravings(authKeyHash, null), syncExecutor);
        CompletableFuture<Optional<ChallengeResponse>> challengesFuture =
                CompletableFuture.supplyAsync(() -> challengeService.loadChallenges(authKeyHash), syncExecutor);

        try {
            CompletableFuture.allOf(progressFuture, cravingsFuture, challengesFuture).join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("Full sync failed for user {}: {}", AuthKeys.abbreviate(authKeyHash), cause.getMessage());
            throw new SyncOperationException("full-sync", "Sync failed", cause);
        }

        FullSyncResponse response = FullSyncResponse.builder()
                .progress(progressFuture.join().orElse(null))
                .cravings(cravingsFuture.join())
                .challenges(challengesFuture.join().orElse(null))
                .syncedAt(Instant.now())
                .build();

        log.info("Full sync completed for user {} (cravings: {})", AuthKeys.abbreviate(authKeyHash),
                response.getCravings().size());
        return response;
    }
}
