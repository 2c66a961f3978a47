package com.aboutblank.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for saving a user's progress.
 *
 * The payload replaces the stored row wholesale: any field left out is stored
 * as null (check-ins as an empty array), not merged with the previous value.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "start_date": "2024-02-01T08:00:00Z",
 *   "goal_days": 90,
 *   "goal_description": "Ninety days free",
 *   "check_ins": [{ "date": "2024-02-02", "mood": 4 }]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProgressRequest {

    private Instant startDate;

    private Integer goalDays;

    private String goalDescription;

    /**
     * Opaque check-in records; stored verbatim, order preserved.
     */
    private List<Object> checkIns;
}
