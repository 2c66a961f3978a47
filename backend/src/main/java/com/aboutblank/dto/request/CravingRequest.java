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
 * Request DTO for logging one craving event.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "timestamp": "2024-02-03T21:15:00Z",
 *   "intensity": 7,
 *   "triggers": ["stress", "boredom"],
 *   "notes": "After work",
 *   "overcome": true
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CravingRequest {

    /**
     * When the craving happened on the device. Defaults to the server time when absent.
     */
    private Instant timestamp;

    private Integer intensity;

    private List<String> triggers;

    private String notes;

    private Boolean overcome;
}
