package com.aboutblank.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for posting an anonymous community message.
 *
 * Validation:
 * - Message must be present and non-empty
 * - Message must be at most 500 characters (UTF-16 code units)
 *
 * Example JSON request:
 * <pre>
 * {
 *   "message": "One week today. Keep going everyone.",
 *   "days_clean": 7,
 *   "emoji": "🌱"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CommunityMessageRequest {

    public static final int MAX_MESSAGE_LENGTH = 500;

    @NotEmpty(message = "Message is required")
    @Size(max = MAX_MESSAGE_LENGTH, message = "Message must be at most 500 characters")
    private String message;

    /**
     * Defaults to 0 when absent.
     */
    private Integer daysClean;

    /**
     * Defaults to 💪 when absent or empty.
     */
    private String emoji;
}
