package com.aboutblank.repository;

import com.aboutblank.entity.MessageReaction.ReactionType;
import com.aboutblank.entity.User;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/**
 * Single-statement upserts keyed by a unique identity column.
 *
 * Each method issues one {@code INSERT ... ON CONFLICT ... DO UPDATE}, so
 * concurrent first writes for the same key never fail on the primary key and
 * the last statement to commit wins. There is no version column and no merge
 * with previously stored values.
 *
 * These run through NamedParameterJdbcTemplate rather than JPA native queries
 * so that null timestamps bind with the column's type.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class UpsertRepository {

    private static final String UPSERT_USER =
            "INSERT INTO users (auth_key_hash) VALUES (:authKeyHash) " +
            "ON CONFLICT (auth_key_hash) DO UPDATE SET last_active = NOW() " +
            "RETURNING auth_key_hash, created_at, last_active";

    private static final String UPSERT_PROGRESS =
            "INSERT INTO progress (auth_key_hash, start_date, goal_days, goal_description, check_ins, updated_at) " +
            "VALUES (:authKeyHash, :startDate, :goalDays, :goalDescription, CAST(:checkIns AS jsonb), NOW()) " +
            "ON CONFLICT (auth_key_hash) DO UPDATE SET " +
            "start_date = EXCLUDED.start_date, " +
            "goal_days = EXCLUDED.goal_days, " +
            "goal_description = EXCLUDED.goal_description, " +
            "check_ins = EXCLUDED.check_ins, " +
            "updated_at = NOW()";

    private static final String UPSERT_CHALLENGE_PROGRESS =
            "INSERT INTO challenge_progress (auth_key_hash, xp_points, current_challenge_index, last_skip_time, updated_at) " +
            "VALUES (:authKeyHash, :xpPoints, :currentChallengeIndex, :lastSkipTime, NOW()) " +
            "ON CONFLICT (auth_key_hash) DO UPDATE SET " +
            "xp_points = EXCLUDED.xp_points, " +
            "current_challenge_index = EXCLUDED.current_challenge_index, " +
            "last_skip_time = EXCLUDED.last_skip_time, " +
            "updated_at = NOW()";

    private static final String UPSERT_REACTION =
            "INSERT INTO message_reactions (message_id, reactor_hash, reaction_type) " +
            "VALUES (:messageId, :reactorHash, :reactionType) " +
            "ON CONFLICT (message_id, reactor_hash) DO UPDATE SET " +
            "reaction_type = EXCLUDED.reaction_type, " +
            "created_at = NOW()";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Insert a user row for an unseen key, or refresh last_active for a known one.
     *
     * @param authKeyHash the user's auth key hash
     * @return the user row as stored after the upsert
     */
    public User upsertUser(String authKeyHash) {
        return jdbcTemplate.queryForObject(UPSERT_USER, new MapSqlParameterSource("authKeyHash", authKeyHash),
                (rs, rowNum) -> new User(
                        rs.getString("auth_key_hash"),
                        toInstant(rs.getTimestamp("created_at")),
                        toInstant(rs.getTimestamp("last_active"))));
    }

    /**
     * Replace a user's progress row wholesale.
     *
     * @param authKeyHash owner of the row
     * @param startDate recovery start
     * @param goalDays target duration in days
     * @param goalDescription free-text goal
     * @param checkIns check-in records, stored verbatim as JSONB
     * @return number of affected rows (always 1)
     */
    public int upsertProgress(String authKeyHash, Instant startDate, Integer goalDays,
                              String goalDescription, List<Object> checkIns) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("authKeyHash", authKeyHash)
                .addValue("startDate", toTimestamp(startDate), Types.TIMESTAMP)
                .addValue("goalDays", goalDays)
                .addValue("goalDescription", goalDescription)
                .addValue("checkIns", toJson(checkIns));
        return jdbcTemplate.update(UPSERT_PROGRESS, params);
    }

    /**
     * Replace a user's challenge progress row wholesale.
     *
     * @param authKeyHash owner of the row
     * @param xpPoints experience points
     * @param currentChallengeIndex index of the active challenge
     * @param lastSkipTime when the user last skipped a challenge
     * @return number of affected rows (always 1)
     */
    public int upsertChallengeProgress(String authKeyHash, Integer xpPoints, Integer currentChallengeIndex,
                                       Instant lastSkipTime) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("authKeyHash", authKeyHash)
                .addValue("xpPoints", xpPoints)
                .addValue("currentChallengeIndex", currentChallengeIndex)
                .addValue("lastSkipTime", toTimestamp(lastSkipTime), Types.TIMESTAMP);
        return jdbcTemplate.update(UPSERT_CHALLENGE_PROGRESS, params);
    }

    /**
     * Record a reader's reaction to a message, replacing any earlier one.
     *
     * @param messageId the message being reacted to
     * @param reactorHash the reader's auth key hash
     * @param reactionType the reaction
     * @return number of affected rows (always 1)
     */
    public int upsertReaction(Long messageId, String reactorHash, ReactionType reactionType) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("messageId", messageId)
                .addValue("reactorHash", reactorHash)
                .addValue("reactionType", reactionType.getValue());
        return jdbcTemplate.update(UPSERT_REACTION, params);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private String toJson(List<Object> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : List.of());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize JSONB column value: {}", e.getMessage());
            throw new IllegalArgumentException("Payload contains values that cannot be stored as JSON", e);
        }
    }
}
