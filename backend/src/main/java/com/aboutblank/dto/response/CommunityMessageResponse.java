package com.aboutblank.dto.response;

import com.aboutblank.entity.AnonymousMessage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for one community board message.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "id": 42,
 *   "message": "One week today.",
 *   "days_clean": 7,
 *   "emoji": "💪",
 *   "created_at": "2024-02-04T09:00:00Z",
 *   "reactions": { "support": 3, "strength": 0, "solidarity": 1 }
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CommunityMessageResponse {

    private Long id;

    private String message;

    private Integer daysClean;

    private String emoji;

    private Instant createdAt;

    /**
     * Reaction counts keyed by reaction type; every type is present.
     */
    private Map<String, Long> reactions;

    public static CommunityMessageResponse fromEntity(AnonymousMessage message, Map<String, Long> reactions) {
        return CommunityMessageResponse.builder()
                .id(message.getId())
                .message(message.getMessage())
                .daysClean(message.getDaysClean())
                .emoji(message.getEmoji())
                .createdAt(message.getCreatedAt())
                .reactions(reactions)
                .build();
    }
}
