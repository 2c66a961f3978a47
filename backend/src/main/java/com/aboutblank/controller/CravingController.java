package com.aboutblank.controller;

import com.aboutblank.dto.request.CravingRequest;
import com.aboutblank.dto.response.CravingResponse;
import com.aboutblank.dto.response.SuccessResponse;
import com.aboutblank.service.CravingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for the craving log.
 *
 * Endpoints:
 * - POST /api/cravings: append one event, returns {"success": true}
 * - GET /api/cravings?limit=N: newest events first, default 1000
 *
 * A limit without a leading number falls back to the default.
 *
 * @see com.aboutblank.service.CravingService
 */
@RestController
@RequestMapping("/api/cravings")
@RequiredArgsConstructor
public class CravingController {

    private final CravingService cravingService;

    @PostMapping
    public ResponseEntity<SuccessResponse> saveCraving(
            Authentication authentication,
            @RequestBody CravingRequest request
    ) {
        cravingService.saveCraving(authentication.getName(), request);
        return ResponseEntity.ok(SuccessResponse.ok());
    }

    @GetMapping
    public ResponseEntity<List<CravingResponse>> loadCravings(
            Authentication authentication,
            @RequestParam(required = false) String limit
    ) {
        return ResponseEntity.ok(cravingService.loadCravings(authentication.getName(), QueryParams.parseLimit(limit)));
    }
}
