package com.aboutblank.controller;

import com.aboutblank.dto.request.ChallengeRequest;
import com.aboutblank.dto.response.SuccessResponse;
import com.aboutblank.service.ChallengeService;
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
 * REST Controller for challenge progress. Same contract as ProgressController.
 */
@RestController
@RequestMapping("/api/challenges")
@RequiredArgsConstructor
public class ChallengeController {

    private final ChallengeService challengeService;

    @PostMapping
    public ResponseEntity<SuccessResponse> saveChallenges(
            Authentication authentication,
            @RequestBody ChallengeRequest request
    ) {
        challengeService.saveChallenges(authentication.getName(), request);
        return ResponseEntity.ok(SuccessResponse.ok());
    }

    @GetMapping
    public ResponseEntity<Object> loadChallenges(Authentication authentication) {
        return challengeService.loadChallenges(authentication.getName())
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(NullNode.getInstance()));
    }
}
