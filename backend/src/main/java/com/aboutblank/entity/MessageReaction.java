package com.aboutblank.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;

/**
 * MessageReaction entity for supportive reactions on community messages.
 *
 * A reader holds at most one reaction per message (unique on message and
 * reactor); reacting again replaces the type. Rows are written through the
 * native upsert in UpsertRepository.
 *
 * Database Table: message_reactions
 */
@Entity
@Table(name = "message_reactions",
    uniqueConstraints = @UniqueConstraint(name = "uq_reaction_message_reactor",
            columnNames = {"message_id", "reactor_hash"}),
    indexes = @Index(name = "idx_reactions_message", columnList = "message_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageReaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "message_id", nullable = false, updatable = false)
    private Long messageId;

    /**
     * Auth key hash of the reader who reacted. Never linked to the message author.
     */
    @Column(name = "reactor_hash", nullable = false, updatable = false)
    private String reactorHash;

    @Convert(converter = ReactionTypeConverter.class)
    @Column(name = "reaction_type", nullable = false)
    private ReactionType reactionType;

    @Column(name = "created_at", nullable = false, insertable = false, updatable = false)
    private Instant createdAt;

    /**
     * Reaction kinds accepted on the board.
     */
    public enum ReactionType {
        SUPPORT("support"),
        STRENGTH("strength"),
        SOLIDARITY("solidarity");

        private final String value;

        ReactionType(String value) {
            this.value = value;
        }

        /**
         * @return the lower-case value stored in the database and used on the wire
         */
        public String getValue() {
            return value;
        }

        /**
         * Parse a client-supplied reaction type, ignoring case.
         *
         * @param value raw value from the request
         * @return the matching reaction type
         * @throws IllegalArgumentException if the value names no reaction type
         */
        public static ReactionType fromValue(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Reaction type is required");
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(type -> type.value.equals(normalized))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(String.format(
                            "Unknown reaction type '%s'. Expected one of: support, strength, solidarity.", value)));
        }
    }

    /**
     * Maps ReactionType to the lower-case values the column check constraint allows.
     */
    @Converter
    public static class ReactionTypeConverter implements AttributeConverter<ReactionType, String> {

        @Override
        public String convertToDatabaseColumn(ReactionType attribute) {
            return attribute != null ? attribute.getValue() : null;
        }

        @Override
        public ReactionType convertToEntityAttribute(String dbData) {
            return dbData != null ? ReactionType.fromValue(dbData) : null;
        }
    }
}
