package com.aboutblank.dto.response;

import com.aboutblank.entity.ChallengeProgress;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for a user's challenge progress.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChallengeResponse {

    private Integer xpPoints;

    private Integer currentChallengeIndex;

    private Instant lastSkipTime;

    public static ChallengeResponse fromEntity(ChallengeProgress challengeProgress) {
        return ChallengeResponse.builder()
                .xpPoints(challengeProgress.getXpPoints())
                .currentChallengeIndex(challengeProgress.getCurrentChallengeIndex())
                .lastSkipTime(challengeProgress.getLastSkipTime())
                .build();
    }
}
