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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CommunityService.
 *
 * Tests the community board including:
 * - Defaults for days_clean and emoji
 * - Listing with reaction counts
 * - Reaction validation and replacement
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CommunityService Unit Tests")
class CommunityServiceTest {

    private static final String READER_KEY = "56".repeat(32);

    @Mock
    private AnonymousMessageRepository anonymousMessageRepository;

    @Mock
    private MessageReactionRepository messageReactionRepository;

    @Mock
    private UpsertRepository upsertRepository;

    @InjectMocks
    private CommunityService communityService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(communityService, "defaultLimit", 50);
        ReflectionTestUtils.setField(communityService, "maxLimit", 200);
    }

    @Test
    @DisplayName("postMessage should default days_clean to 0 and emoji to 💪")
    void testPostMessage_Defaults() {
        // Arrange
        CommunityMessageRequest request = CommunityMessageRequest.builder().message("Day one.").emoji("").build();
        when(anonymousMessageRepository.save(any(AnonymousMessage.class))).thenAnswer(invocation -> {
            AnonymousMessage message = invocation.getArgument(0);
            message.setId(42L);
            return message;
        });

        // Act
        Long id = communityService.postMessage(request);

        // Assert
        ArgumentCaptor<AnonymousMessage> captor = ArgumentCaptor.forClass(AnonymousMessage.class);
        verify(anonymousMessageRepository).save(captor.capture());
        assertEquals(42L, id);
        assertEquals("Day one.", captor.getValue().getMessage());
        assertEquals(0, captor.getValue().getDaysClean());
        assertEquals("💪", captor.getValue().getEmoji());
    }

    @Test
    @DisplayName("postMessage should keep supplied days_clean and emoji")
    void testPostMessage_SuppliedValues() {
        // Arrange
        CommunityMessageRequest request = new CommunityMessageRequest("A week!", 7, "🌱");
        when(anonymousMessageRepository.save(any(AnonymousMessage.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        communityService.postMessage(request);

        // Assert
        ArgumentCaptor<AnonymousMessage> captor = ArgumentCaptor.forClass(AnonymousMessage.class);
        verify(anonymousMessageRepository).save(captor.capture());
        assertEquals(7, captor.getValue().getDaysClean());
        assertEquals("🌱", captor.getValue().getEmoji());
    }

    @Test
    @DisplayName("postMessage should surface datastore errors as 'Failed to post message'")
    void testPostMessage_DatastoreFailure() {
        // Arrange
        when(anonymousMessageRepository.save(any(AnonymousMessage.class)))
                .thenThrow(new DataAccessResourceFailureException("down"));

        // Act
        SyncOperationException ex = assertThrows(SyncOperationException.class,
                () -> communityService.postMessage(new CommunityMessageRequest("hi", null, null)));

        // Assert
        assertEquals("Failed to post message", ex.getMessage());
    }

    @Test
    @DisplayName("listMessages should attach reaction counts with every type present")
    void testListMessages_WithReactions() {
        // Arrange
        AnonymousMessage newer = message(2L, "second");
        AnonymousMessage older = message(1L, "first");
        when(anonymousMessageRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, 50)))
                .thenReturn(List.of(newer, older));
        when(messageReactionRepository.countByMessageIds(List.of(2L, 1L))).thenReturn(List.of(
                reactionCount(2L, ReactionType.SUPPORT, 3L),
                reactionCount(2L, ReactionType.SOLIDARITY, 1L)
        ));

        // Act
        List<CommunityMessageResponse> result = communityService.listMessages(null);

        // Assert
        assertEquals(2, result.size());
        assertEquals(2L, result.get(0).getId());
        assertEquals(Map.of("support", 3L, "strength", 0L, "solidarity", 1L), result.get(0).getReactions());
        assertEquals(Map.of("support", 0L, "strength", 0L, "solidarity", 0L), result.get(1).getReactions());
    }

    @Test
    @DisplayName("listMessages should skip the count query for an empty board")
    void testListMessages_Empty() {
        // Arrange
        when(anonymousMessageRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, 200)))
                .thenReturn(List.of());

        // Act
        List<CommunityMessageResponse> result = communityService.listMessages(1000);

        // Assert
        assertTrue(result.isEmpty());
        verifyNoInteractions(messageReactionRepository);
    }

    @Test
    @DisplayName("resolveLimit should default non-positive values and clamp large ones")
    void testResolveLimit() {
        assertEquals(50, communityService.resolveLimit(null));
        assertEquals(50, communityService.resolveLimit(0));
        assertEquals(10, communityService.resolveLimit(10));
        assertEquals(200, communityService.resolveLimit(201));
    }

    @Test
    @DisplayName("react should upsert the parsed reaction type")
    void testReact() {
        // Arrange
        when(anonymousMessageRepository.existsById(9L)).thenReturn(true);

        // Act
        communityService.react(9L, READER_KEY, new ReactionRequest("Strength"));

        // Assert
        verify(upsertRepository).upsertReaction(9L, READER_KEY, ReactionType.STRENGTH);
    }

    @Test
    @DisplayName("react should reject unknown reaction types before touching the datastore")
    void testReact_UnknownType() {
        // Act
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> communityService.react(9L, READER_KEY, new ReactionRequest("applause")));

        // Assert
        assertTrue(ex.getMessage().contains("applause"));
        verifyNoInteractions(anonymousMessageRepository, upsertRepository);
    }

    @Test
    @DisplayName("react should answer not found for a missing message")
    void testReact_MissingMessage() {
        // Arrange
        when(anonymousMessageRepository.existsById(404L)).thenReturn(false);

        // Act & Assert
        assertThrows(ResourceNotFoundException.class,
                () -> communityService.react(404L, READER_KEY, new ReactionRequest("support")));
        verifyNoInteractions(upsertRepository);
    }

    private AnonymousMessage message(Long id, String text) {
        AnonymousMessage message = new AnonymousMessage(text, 1, "💪");
        message.setId(id);
        message.setCreatedAt(Instant.now());
        return message;
    }

    private ReactionCount reactionCount(Long messageId, ReactionType type, Long total) {
        return new ReactionCount() {
            @Override
            public Long getMessageId() {
                return messageId;
            }

            @Override
            public ReactionType getReactionType() {
                return type;
            }

            @Override
            public Long getTotal() {
                return total;
            }
        };
    }
}
