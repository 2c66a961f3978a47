package com.aboutblank.service;

import com.aboutblank.dto.request.CommunityMessageRequest;
import com.aboutblank.dto.request.ReactionRequest;
import com.aboutblank.dto.response.CommunityMessageResponse;
import com.aboutblank.entity.AnonymousMessage;
import com.aboutblank.entity.MessageReaction.ReactionType;
import com.aboutblank.exception.ResourceNotFoundException;
import com.aboutblank.exception.SyncOperationException;
import com.aboutblank.repository.AnonymousMessageRepository;
import com.aboutblank.repository.MessageReactionRepository;
import com.aboutblank.repository.MessageReactionRepository.ReactionCount;
import com.aboutblank.repository.UpsertRepository;
import com.aboutblank.security.AuthKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for the anonymous community board.
 *
 * Messages carry no author identity at all; posting requires no auth key and
 * is only throttled by the strict rate limit. Reactions do require a key, and
 * each reader holds at most one reaction per message.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommunityService {

    private final AnonymousMessageRepository anonymousMessageRepository;
    private final MessageReactionRepository messageReactionRepository;
    private final UpsertRepository upsertRepository;

    @Value("${app.community.default-limit:50}")
    private int defaultLimit;

    @Value("${app.community.max-limit:200}")
    private int maxLimit;

    /**
     * Post a message to the board.
     *
     * Length and presence are validated on the request DTO. A missing
     * days_clean is stored as 0 and a missing or empty emoji as the default.
     *
     * @param request the validated message
     * @return the id of the new message
     * @throws SyncOperationException if the insert fails
     */
    public Long postMessage(CommunityMessageRequest request) {
        String emoji = request.getEmoji() != null && !request.getEmoji().isEmpty()
                ? request.getEmoji()
                : AnonymousMessage.DEFAULT_EMOJI;
        Integer daysClean = request.getDaysClean() != null ? request.getDaysClean() : 0;

        try {
            AnonymousMessage message = anonymousMessageRepository.save(
                    new AnonymousMessage(request.getMessage(), daysClean, emoji));
            log.info("Community message posted: id={}, length={}", message.getId(), request.getMessage().length());
            return message.getId();
        } catch (DataAccessException ex) {
            log.error("Failed to post community message: {}", ex.getMessage(), ex);
            throw new SyncOperationException("post-message", "Failed to post message", ex);
        }
    }

    /**
     * List the newest messages with their reaction counts.
     *
     * @param limit requested maximum; null or non-positive means the default,
     *              values above the maximum are clamped to it
     * @return messages newest first
     * @throws SyncOperationException if the read fails
     */
    public List<CommunityMessageResponse> listMessages(Integer limit) {
        int effectiveLimit = resolveLimit(limit);
        try {
            List<AnonymousMessage> messages =
                    anonymousMessageRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, effectiveLimit));
            if (messages.isEmpty()) {
                return List.of();
            }

            List<Long> messageIds = messages.stream().map(AnonymousMessage::getId).collect(Collectors.toList());
            Map<Long, Map<String, Long>> reactionsByMessage = new HashMap<>();
            for (ReactionCount count : messageReactionRepository.countByMessageIds(messageIds)) {
                reactionsByMessage
                        .computeIfAbsent(count.getMessageId(), id -> emptyReactionCounts())
                        .put(count.getReactionType().getValue(), count.getTotal());
            }

            log.debug("Listed {} community messages (limit {})", messages.size(), effectiveLimit);
            return messages.stream()
                    .map(message -> CommunityMessageResponse.fromEntity(message,
                            reactionsByMessage.getOrDefault(message.getId(), emptyReactionCounts())))
                    .collect(Collectors.toList());
        } catch (DataAccessException ex) {
            log.error("Failed to list community messages: {}", ex.getMessage(), ex);
            throw new SyncOperationException("list-messages", "Failed to fetch messages", ex);
        }
    }

    /**
     * Record a reader's reaction to a message, replacing any earlier reaction.
     *
     * @param messageId the message reacted to
     * @param reactorHash the authenticated reader
     * @param request the reaction
     * @throws IllegalArgumentException if the reaction type is unknown
     * @throws ResourceNotFoundException if the message does not exist
     * @throws SyncOperationException if the datastore fails
     */
    public void react(Long messageId, String reactorHash, ReactionRequest request) {
        ReactionType reactionType = ReactionType.fromValue(request.getReactionType());

        boolean exists;
        try {
            exists = anonymousMessageRepository.existsById(messageId);
            if (exists) {
                upsertRepository.upsertReaction(messageId, reactorHash, reactionType);
            }
        } catch (DataAccessException ex) {
            log.error("Failed to save reaction on message {}: {}", messageId, ex.getMessage(), ex);
            throw new SyncOperationException("react", "Failed to save reaction", ex);
        }

        if (!exists) {
            throw ResourceNotFoundException.communityMessage(messageId);
        }

        log.info("Reaction '{}' saved on message {} by {}", reactionType.getValue(), messageId,
                AuthKeys.abbreviate(reactorHash));
    }

    int resolveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return defaultLimit;
        }
        return Math.min(limit, maxLimit);
    }

    private Map<String, Long> emptyReactionCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ReactionType type : ReactionType.values()) {
            counts.put(type.getValue(), 0L);
        }
        return counts;
    }
}
