package com.aboutblank.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * AnonymousMessage entity for the community board.
 *
 * Deliberately carries no reference to a user: once inserted a message has
 * no owner and cannot be revoked by its author.
 *
 * Database Table: anonymous_messages
 */
@Entity
@Table(name = "anonymous_messages", indexes = {
    @Index(name = "idx_messages_created", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnonymousMessage {

    public static final String DEFAULT_EMOJI = "💪";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "days_clean", nullable = false)
    private Integer daysClean = 0;

    @Column(name = "emoji", nullable = false, columnDefinition = "TEXT")
    private String emoji = DEFAULT_EMOJI;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Constructor for posting a new message.
     *
     * @param message the message text
     * @param daysClean author's streak at posting time
     * @param emoji display emoji
     */
    public AnonymousMessage(String message, Integer daysClean, String emoji) {
        this.message = message;
        this.daysClean = daysClean;
        this.emoji = emoji;
    }
}
