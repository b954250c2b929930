/*
 * Where: handoff data access
 * What: persists transfer tokens and performs their single-exit status changes
 * Why: each update only matches ACTIVE rows, so a token leaves ACTIVE at most once
 */
package com.tickety.handoff.repository;

import static com.tickety.common.JdbcTimestampUtils.toInstant;
import static com.tickety.common.JdbcTimestampUtils.toTimestamp;

import com.tickety.handoff.model.TokenStatus;
import com.tickety.handoff.model.TransferTokenRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TransferTokenRepository {

  private static final String COLUMNS =
      "token_id, ticket_id, holder_actor_id, status, issued_at, expires_at, redeemed_by,"
          + " redeemed_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(TransferTokenRecord token) {
    final String sql =
        """
        INSERT INTO transfer_tokens (
          token_id,
          ticket_id,
          holder_actor_id,
          status,
          issued_at,
          expires_at
        ) VALUES (
          :tokenId,
          :ticketId,
          :holderActorId,
          :status,
          :issuedAt,
          :expiresAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tokenId", token.tokenId())
            .addValue("ticketId", token.ticketId())
            .addValue("holderActorId", token.holderActorId())
            .addValue("status", token.status().name())
            .addValue("issuedAt", toTimestamp(token.issuedAt()))
            .addValue("expiresAt", toTimestamp(token.expiresAt()));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<TransferTokenRecord> findById(String tokenId) {
    final String sql = "SELECT " + COLUMNS + " FROM transfer_tokens WHERE token_id = :tokenId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("tokenId", tokenId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<TransferTokenRecord> findActiveByTicket(String ticketId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM transfer_tokens WHERE ticket_id = :ticketId AND status = 'ACTIVE'";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ticketId", ticketId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Expires an ACTIVE token of the ticket whose window has already closed. */
  public int expireStaleForTicket(String ticketId, Instant now) {
    final String sql =
        """
        UPDATE transfer_tokens
        SET status = 'EXPIRED',
            closed_at = :now
        WHERE ticket_id = :ticketId
          AND status = 'ACTIVE'
          AND expires_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ticketId", ticketId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * The redemption compare-and-swap: matches only a live token, so at most one caller gets a row
   * back.
   */
  public Optional<TransferTokenRecord> redeemIfActive(
      String tokenId, String claimantActorId, Instant now) {
    final String sql =
        """
        UPDATE transfer_tokens
        SET status = 'REDEEMED',
            redeemed_by = :claimant,
            redeemed_at = :now,
            closed_at = :now
        WHERE token_id = :tokenId
          AND status = 'ACTIVE'
          AND expires_at > :now
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tokenId", tokenId)
            .addValue("claimant", claimantActorId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean revokeIfActive(String tokenId, Instant now) {
    return closeIfActive(tokenId, TokenStatus.REVOKED, now) == 1;
  }

  public boolean expireIfActive(String tokenId, Instant now) {
    return closeIfActive(tokenId, TokenStatus.EXPIRED, now) == 1;
  }

  private int closeIfActive(String tokenId, TokenStatus target, Instant now) {
    final String sql =
        """
        UPDATE transfer_tokens
        SET status = :status,
            closed_at = :now
        WHERE token_id = :tokenId
          AND status = 'ACTIVE'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tokenId", tokenId)
            .addValue("status", target.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** Expires a batch of due ACTIVE tokens; rows locked by another sweeper are skipped. */
  public List<TransferTokenRecord> expireDue(Instant now, int limit) {
    final String sql =
        """
        WITH due AS (
          SELECT token_id
          FROM transfer_tokens
          WHERE status = 'ACTIVE'
            AND expires_at <= :now
          ORDER BY expires_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE transfer_tokens t
        SET status = 'EXPIRED',
            closed_at = :now
        FROM due
        WHERE t.token_id = due.token_id
        RETURNING t.token_id, t.ticket_id, t.holder_actor_id, t.status, t.issued_at, t.expires_at,
                  t.redeemed_by, t.redeemed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private TransferTokenRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TransferTokenRecord(
        rs.getString("token_id"),
        rs.getString("ticket_id"),
        rs.getString("holder_actor_id"),
        TokenStatus.valueOf(rs.getString("status")),
        rs.getTimestamp("issued_at").toInstant(),
        rs.getTimestamp("expires_at").toInstant(),
        rs.getString("redeemed_by"),
        toInstant(rs.getTimestamp("redeemed_at")));
  }
}
