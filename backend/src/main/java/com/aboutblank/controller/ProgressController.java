package com.aboutblank.controller;

import com.aboutblank.dto.request.ProgressRequest;
import com.aboutblank.dto.response.SuccessResponse;
import com.aboutblank.service.ProgressService;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for progress backup.
 *
 * Endpoints:
 * - POST /api/progress: replace the stored progress, returns {"success": true}
 * - GET /api/progress: the stored progress, or the JSON literal null if none
 *
 * Both require the X-Auth-Key header; the authenticated principal is the key.
 *
 * Error Responses:
 * - 400 Bad Request: malformed JSON body
 * - 401 Unauthorized: missing or malformed auth key
 * - 500 Internal Server Error: datastore failure ("Failed to save progress")
 *
 * @see com.aboutblank.service.ProgressService
 */
@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressService progressService;

    @PostMapping
    public ResponseEntity<SuccessResponse> saveProgress(
            Authentication authentication,
            @RequestBody ProgressRequest request
    ) {
        progressService.saveProgress(authentication.getName(), request);
        return ResponseEntity.ok(SuccessResponse.ok());
    }

    /**
     * A user who never saved progress gets 200 with a null body, not 404;
     * the client treats that as "nothing backed up yet".
     */
    @GetMapping
    public ResponseEntity<Object> loadProgress(Authentication authentication) {
        return progressService.loadProgress(authentication.getName())
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(NullNode.getInstance()));
    }
}
