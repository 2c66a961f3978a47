package com.aboutblank.controller;

import com.aboutblank.dto.response.FullSyncResponse;
import com.aboutblank.service.SyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for restoring a device in one round trip.
 *
 * Endpoint: GET /api/sync/full
 * Authentication: Required (X-Auth-Key)
 *
 * Returns progress, cravings and challenge state together with the server
 * time of the sync. Fails as a whole with 500 ("Sync failed") if any part
 * cannot be read.
 *
 * @see com.aboutblank.service.SyncService
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncService syncService;

    @GetMapping("/full")
    public ResponseEntity<FullSyncResponse> fullSync(Authentication authentication) {
        return ResponseEntity.ok(syncService.fullSync(authentication.getName()));
    }
}
