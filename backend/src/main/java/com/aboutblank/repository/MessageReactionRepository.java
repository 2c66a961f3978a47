package com.aboutblank.repository;

import com.aboutblank.entity.MessageReaction;
import com.aboutblank.entity.MessageReaction.ReactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for MessageReaction entity.
 *
 * Writes go through UpsertRepository so that a reader's repeated reaction
 * replaces the previous one instead of failing on the unique constraint.
 */
@Repository
public interface MessageReactionRepository extends JpaRepository<MessageReaction, Long> {

    /**
     * Aggregate reaction counts for a batch of messages.
     *
     * @param messageIds ids of the messages being listed
     * @return one row per message and reaction type that has at least one reaction
     */
    @Query("SELECT r.messageId AS messageId, r.reactionType AS reactionType, COUNT(r) AS total " +
           "FROM MessageReaction r " +
           "WHERE r.messageId IN :messageIds " +
           "GROUP BY r.messageId, r.reactionType")
    List<ReactionCount> countByMessageIds(@Param("messageIds") Collection<Long> messageIds);

    /**
     * Find the reaction a reader left on a message.
     *
     * @param messageId the message id
     * @param reactorHash the reader's auth key hash
     * @return the reaction if the reader has reacted
     */
    Optional<MessageReaction> findByMessageIdAndReactorHash(Long messageId, String reactorHash);

    /**
     * Projection for reaction count aggregates.
     */
    interface ReactionCount {
        Long getMessageId();

        ReactionType getReactionType();

        Long getTotal();
    }
}
