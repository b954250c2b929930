/*
 * Where: handoff data access
 * What: inserts, claims and settles outbox_events rows
 * Why: realtime events leave the database in commit order per aggregate through the outbox
 */
package com.tickety.handoff.repository;

import static com.tickety.common.JdbcTimestampUtils.toTimestamp;

import com.tickety.handoff.model.OutboxEventRecord;
import com.tickety.handoff.model.OutboxStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OutboxEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OutboxEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs EI_EXPOSE_REP2: keep our own wrapper instead of the injected reference
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(
      UUID eventId,
      String eventType,
      String aggregateKey,
      long sequence,
      String subject,
      String payloadJson,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO outbox_events (
          event_id,
          event_type,
          aggregate_key,
          sequence,
          subject,
          payload,
          status,
          attempt_count,
          next_retry_at,
          created_at
        ) VALUES (
          :eventId,
          :eventType,
          :aggregateKey,
          :sequence,
          :subject,
          :payload::jsonb,
          'PENDING',
          0,
          NULL,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("aggregateKey", aggregateKey)
            .addValue("sequence", sequence)
            .addValue("subject", subject)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Claims publishable rows: PENDING rows past their retry time and IN_FLIGHT rows whose lease
   * ran out. A row is only eligible while no lower sequence of the same aggregate is still
   * unpublished, so one aggregate never has two events in flight.
   */
  public List<OutboxEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT e.event_id
          FROM outbox_events e
          WHERE (
            (
              e.status = 'PENDING'
              AND (e.next_retry_at IS NULL OR e.next_retry_at <= :now)
            )
            OR (
              e.status = 'IN_FLIGHT'
              AND (e.lease_until IS NULL OR e.lease_until <= :now)
            )
          )
          AND NOT EXISTS (
            SELECT 1
            FROM outbox_events earlier
            WHERE earlier.aggregate_key = e.aggregate_key
              AND earlier.sequence < e.sequence
              AND earlier.status IN ('PENDING', 'IN_FLIGHT')
          )
          ORDER BY e.created_at, e.sequence
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE outbox_events e
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            last_error = NULL
        FROM cte
        WHERE e.event_id = cte.event_id
        RETURNING e.event_id, e.event_type, e.aggregate_key, e.sequence, e.subject,
                  e.payload::text AS payload_text, e.attempt_count, e.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("publishedAt", toTimestamp(publishedAt))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailure(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE outbox_events
        SET attempt_count = :attemptCount,
            status = :status,
            next_retry_at = :nextRetryAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            last_error = :lastError
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("status", status.name())
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int deletePublishedOlderThan(Instant threshold) {
    // Unsent and failed rows stay for inspection.
    final String sql =
        """
        DELETE FROM outbox_events
        WHERE status = 'PUBLISHED'
          AND published_at <= :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countFailed() {
    final String sql = "SELECT COUNT(*) FROM outbox_events WHERE status = 'FAILED'";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public List<Long> findSequences(String aggregateKey) {
    final String sql =
        """
        SELECT sequence
        FROM outbox_events
        WHERE aggregate_key = :aggregateKey
        ORDER BY sequence
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("aggregateKey", aggregateKey);
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }

  private OutboxEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        UUID.fromString(rs.getString("event_id")),
        rs.getString("event_type"),
        rs.getString("aggregate_key"),
        rs.getLong("sequence"),
        rs.getString("subject"),
        rs.getString("payload_text"),
        rs.getInt("attempt_count"),
        rs.getTimestamp("created_at").toInstant());
  }
}
