package com.aboutblank.dto.response;

import com.aboutblank.entity.Progress;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for a user's stored progress.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProgressResponse {

    private Instant startDate;

    private Integer goalDays;

    private String goalDescription;

    private List<Object> checkIns;

    /**
     * Convert a Progress entity to its wire form.
     *
     * @param progress the stored row
     * @return the response DTO
     */
    public static ProgressResponse fromEntity(Progress progress) {
        return ProgressResponse.builder()
                .startDate(progress.getStartDate())
                .goalDays(progress.getGoalDays())
                .goalDescription(progress.getGoalDescription())
                .checkIns(progress.getCheckIns() != null ? progress.getCheckIns() : new ArrayList<>())
                .build();
    }
}
