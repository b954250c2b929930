/*
 * Where: handoff data access
 * What: records tickets handed to unregistered emails and binds them on first login
 * Why: the recipient has no account yet when the holder hands the ticket over
 */
package com.tickety.handoff.repository;

import static com.tickety.common.JdbcTimestampUtils.toInstant;
import static com.tickety.common.JdbcTimestampUtils.toTimestamp;

import com.tickety.handoff.model.DeferredDeliveryRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeferredDeliveryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(DeferredDeliveryRecord delivery) {
    final String sql =
        """
        INSERT INTO deferred_deliveries (
          delivery_id, ticket_id, email, initiator_actor_id, created_at
        ) VALUES (
          :deliveryId, :ticketId, :email, :initiator, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", delivery.deliveryId())
            .addValue("ticketId", delivery.ticketId())
            .addValue("email", delivery.email())
            .addValue("initiator", delivery.initiatorActorId())
            .addValue("createdAt", toTimestamp(delivery.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<DeferredDeliveryRecord> bindUnbound(String email, String actorId, Instant now) {
    final String sql =
        """
        UPDATE deferred_deliveries
        SET bound_actor_id = :actorId,
            bound_at = :now
        WHERE email = :email
          AND bound_actor_id IS NULL
        RETURNING delivery_id, ticket_id, email, initiator_actor_id, created_at, bound_actor_id,
                  bound_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("email", email)
            .addValue("actorId", actorId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<DeferredDeliveryRecord> findByEmail(String email) {
    final String sql =
        """
        SELECT delivery_id, ticket_id, email, initiator_actor_id, created_at, bound_actor_id,
               bound_at
        FROM deferred_deliveries
        WHERE email = :email
        ORDER BY created_at
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("email", email);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private DeferredDeliveryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeferredDeliveryRecord(
        rs.getObject("delivery_id", UUID.class),
        rs.getString("ticket_id"),
        rs.getString("email"),
        rs.getString("initiator_actor_id"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getString("bound_actor_id"),
        toInstant(rs.getTimestamp("bound_at")));
  }
}
