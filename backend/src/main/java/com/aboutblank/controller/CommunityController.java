package com.aboutblank.controller;

import com.aboutblank.dto.request.CommunityMessageRequest;
import com.aboutblank.dto.request.ReactionRequest;
import com.aboutblank.dto.response.CommunityMessageResponse;
import com.aboutblank.dto.response.SuccessResponse;
import com.aboutblank.service.CommunityService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for the anonymous community board.
 *
 * Endpoints:
 * - POST /api/community/message: post anonymously (no auth key, strict rate limit)
 * - GET /api/community/messages?limit=N: newest messages first, default 50, public
 * - POST /api/community/messages/{id}/reactions: react to a message (auth key required)
 *
 * Error Responses:
 * - 400 Bad Request: empty or over-long message, unknown reaction type
 * - 401 Unauthorized: reacting without a valid auth key
 * - 404 Not Found: reacting to a message that does not exist
 * - 429 Too Many Requests: strict limit exhausted on posting
 *
 * @see com.aboutblank.service.CommunityService
 */
@RestController
@RequestMapping("/api/community")
@RequiredArgsConstructor
public class CommunityController {

    private final CommunityService communityService;

    @PostMapping("/message")
    public ResponseEntity<SuccessResponse> postMessage(@Valid @RequestBody CommunityMessageRequest request) {
        communityService.postMessage(request);
        return ResponseEntity.ok(SuccessResponse.ok());
    }

    @GetMapping("/messages")
    public ResponseEntity<List<CommunityMessageResponse>> listMessages(
            @RequestParam(required = false) String limit
    ) {
        return ResponseEntity.ok(communityService.listMessages(QueryParams.parseLimit(limit)));
    }

    @PostMapping("/messages/{id}/reactions")
    public ResponseEntity<SuccessResponse> react(
            Authentication authentication,
            @PathVariable("id") Long messageId,
            @Valid @RequestBody ReactionRequest request
    ) {
        communityService.react(messageId, authentication.getName(), request);
        return ResponseEntity.ok(SuccessResponse.ok());
    }
}
