package com.aboutblank.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO acknowledging a successful write: {@code {"success": true}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SuccessResponse {

    private boolean success;

    public static SuccessResponse ok() {
        return new SuccessResponse(true);
    }
}
