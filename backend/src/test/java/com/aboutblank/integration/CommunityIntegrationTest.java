package com.aboutblank.integration;

import com.aboutblank.dto.request.CommunityMessageRequest;
import com.aboutblank.dto.request.ReactionRequest;
import com.aboutblank.dto.response.CommunityMessageResponse;
import com.aboutblank.entity.MessageReaction;
import com.aboutblank.entity.MessageReaction.ReactionType;
import com.aboutblank.repository.AnonymousMessageRepository;
import com.aboutblank.repository.MessageReactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.http.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-End Integration Test for the community board.
 *
 * Verifies:
 * - Message length validation at the 500 character boundary
 * - Defaults for days_clean and emoji
 * - The strict limit counts only failed posts
 * - One reaction per reader per message, replaced on repeat
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers
@DisplayName("Community Board Integration Tests")
class CommunityIntegrationTest {

    private static final String READER_KEY = "b".repeat(64);

    @Container
    static PostgreSQLContainer<?> postgresContainer = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("aboutblank_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    @SuppressWarnings("rawtypes")
    static GenericContainer redisContainer = new GenericContainer("redis:7-alpine")
            .withExposedPorts(6379);

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private AnonymousMessageRepository anonymousMessageRepository;

    @Autowired
    private MessageReactionRepository messageReactionRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private RedisTemplate<String, String> redisStringTemplate;

    private String baseUrl;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgresContainer::getJdbcUrl);
        registry.add("spring.datasource.username", postgresContainer::getUsername);
        registry.add("spring.datasource.password", postgresContainer::getPassword);
        registry.add("spring.data.redis.host", redisContainer::getHost);
        registry.add("spring.data.redis.port", () -> redisContainer.getMappedPort(6379));
    }

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port;

        jdbcTemplate.execute("TRUNCATE users, anonymous_messages RESTART IDENTITY CASCADE");

        Set<String> counters = redisStringTemplate.keys("ratelimit:*");
        if (counters != null && !counters.isEmpty()) {
            redisStringTemplate.delete(counters);
        }
    }

    @Test
    @DisplayName("500-character message is accepted; 501 characters and empty are rejected")
    void testMessageLengthBoundary() {
        // Act
        ResponseEntity<String> atLimit = post("/api/community/message", message("x".repeat(500)), null);
        ResponseEntity<String> overLimit = post("/api/community/message", message("x".repeat(501)), null);
        ResponseEntity<String> empty = post("/api/community/message", message(""), null);
        ResponseEntity<String> missing = post("/api/community/message", new CommunityMessageRequest(), null);

        // Assert
        assertEquals(HttpStatus.OK, atLimit.getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, overLimit.getStatusCode());
        assertTrue(overLimit.getBody().contains("validation-failed"));
        assertEquals(HttpStatus.BAD_REQUEST, empty.getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, missing.getStatusCode());
        assertEquals(1, anonymousMessageRepository.count());
    }

    @Test
    @DisplayName("posted message is listed newest first with defaults applied")
    void testPostAndList() {
        // Arrange
        post("/api/community/message", message("first"), null);
        post("/api/community/message", new CommunityMessageRequest("second", 12, "🌱"), null);

        // Act
        ResponseEntity<CommunityMessageResponse[]> response = restTemplate.getForEntity(
                baseUrl + "/api/community/messages", CommunityMessageResponse[].class);

        // Assert
        assertEquals(HttpStatus.OK, response.getStatusCode());
        CommunityMessageResponse[] messages = response.getBody();
        assertNotNull(messages);
        assertEquals(2, messages.length);
        assertEquals("second", messages[0].getMessage());
        assertEquals(12, messages[0].getDaysClean());
        assertEquals("🌱", messages[0].getEmoji());
        assertEquals("first", messages[1].getMessage());
        assertEquals(0, messages[1].getDaysClean());
        assertEquals("💪", messages[1].getEmoji());
        assertNotNull(messages[1].getCreatedAt());
        assertEquals(0L, messages[1].getReactions().get("support"));
    }

    @Test
    @DisplayName("successful posts do not count toward the strict limit")
    void testStrictLimit_SuccessesNotCounted() {
        // Act & Assert
        for (int i = 0; i < 7; i++) {
            ResponseEntity<String> response = post("/api/community/message", message("post " + i), null);
            assertEquals(HttpStatus.OK, response.getStatusCode(), "post " + i);
        }
        assertEquals(7, anonymousMessageRepository.count());
    }

    @Test
    @DisplayName("after five failed posts the sixth is rejected with 429")
    void testStrictLimit_FailuresCounted() {
        // Arrange
        for (int i = 0; i < 5; i++) {
            ResponseEntity<String> rejected = post("/api/community/message", message(""), null);
            assertEquals(HttpStatus.BAD_REQUEST, rejected.getStatusCode());
        }

        // Act
        ResponseEntity<String> response = post("/api/community/message", message("valid now"), null);

        // Assert
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
        assertTrue(response.getBody().contains("Too many authentication attempts"));
        assertNotNull(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        assertEquals("5", response.getHeaders().getFirst("RateLimit-Limit"));
        assertEquals(0, anonymousMessageRepository.count());
    }

    @Test
    @DisplayName("a reader's second reaction replaces the first")
    void testReaction_Replaced() {
        // Arrange
        post("/api/community/message", message("hang in there"), null);
        Long messageId = anonymousMessageRepository.findAll().get(0).getId();
        String path = "/api/community/messages/" + messageId + "/reactions";

        // Act
        ResponseEntity<String> first = post(path, new ReactionRequest("support"), READER_KEY);
        ResponseEntity<String> second = post(path, new ReactionRequest("strength"), READER_KEY);
        ResponseEntity<CommunityMessageResponse[]> listed = restTemplate.getForEntity(
                baseUrl + "/api/community/messages", CommunityMessageResponse[].class);

        // Assert
        assertEquals(HttpStatus.OK, first.getStatusCode());
        assertEquals(HttpStatus.OK, second.getStatusCode());
        assertEquals(1, messageReactionRepository.count());
        Optional<MessageReaction> reaction =
                messageReactionRepository.findByMessageIdAndReactorHash(messageId, READER_KEY);
        assertTrue(reaction.isPresent());
        assertEquals(ReactionType.STRENGTH, reaction.get().getReactionType());
        assertEquals(0L, listed.getBody()[0].getReactions().get("support"));
        assertEquals(1L, listed.getBody()[0].getReactions().get("strength"));
    }

    @Test
    @DisplayName("reacting to a missing message is 404; an unknown type is 400")
    void testReaction_Errors() {
        // Arrange
        post("/api/community/message", message("still here"), null);
        Long messageId = anonymousMessageRepository.findAll().get(0).getId();

        // Act
        ResponseEntity<String> missing = post("/api/community/messages/999999/reactions",
                new ReactionRequest("support"), READER_KEY);
        ResponseEntity<String> unknownType = post("/api/community/messages/" + messageId + "/reactions",
                new ReactionRequest("applause"), READER_KEY);

        // Assert
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertTrue(missing.getBody().contains("resource-not-found"));
        assertEquals(HttpStatus.BAD_REQUEST, unknownType.getStatusCode());
        assertEquals(0, messageReactionRepository.count());
    }

    private CommunityMessageRequest message(String text) {
        return CommunityMessageRequest.builder().message(text).build();
    }

    private ResponseEntity<String> post(String path, Object body, String authKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (authKey != null) {
            headers.set("X-Auth-Key", authKey);
        }
        return restTemplate.exchange(baseUrl + path, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
    }
}
