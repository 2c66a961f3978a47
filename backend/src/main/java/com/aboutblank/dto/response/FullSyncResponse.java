package com.aboutblank.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the composite full sync read.
 *
 * The three parts are read concurrently and independently; they are not a
 * consistent snapshot if the same user writes while the sync runs.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "progress": { "start_date": "...", "goal_days": 90, "goal_description": "...", "check_ins": [] },
 *   "cravings": [ { "timestamp": "...", "intensity": 5, "triggers": [], "notes": null, "overcome": true } ],
 *   "challenges": null,
 *   "synced_at": "2024-02-04T09:00:00Z"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FullSyncResponse {

    /**
     * Null when the user never saved progress.
     */
    private ProgressResponse progress;

    private List<CravingResponse> cravings;

    /**
     * Null when the user never saved challenge progress.
     */
    private ChallengeResponse challenges;

    private Instant syncedAt;
}
