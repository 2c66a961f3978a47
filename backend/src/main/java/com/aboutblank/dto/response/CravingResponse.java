package com.aboutblank.dto.response;

import com.aboutblank.entity.CravingEvent;
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
 * Response DTO for one logged craving event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CravingResponse {

    private Instant timestamp;

    private Integer intensity;

    private List<String> triggers;

    private String notes;

    private Boolean overcome;

    public static CravingResponse fromEntity(CravingEvent event) {
        return CravingResponse.builder()
                .timestamp(event.getTimestamp())
                .intensity(event.getIntensity())
                .triggers(event.getTriggers() != null ? event.getTriggers() : new ArrayList<>())
                .notes(event.getNotes())
                .overcome(event.getOvercome())
                .build();
    }
}
