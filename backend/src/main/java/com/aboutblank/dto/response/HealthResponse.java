package com.aboutblank.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for the liveness endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    private String status;

    private Instant timestamp;
}
