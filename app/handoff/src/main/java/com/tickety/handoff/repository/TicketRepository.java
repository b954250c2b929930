/*
 * Where: handoff data access
 * What: reads, locks and reassigns ticket ownership in the ledger
 * Why: every ownership move goes through a row lock plus an owner compare-and-swap
 */
package com.tickety.handoff.repository;

import static com.tickety.common.JdbcTimestampUtils.toTimestamp;

import com.tickety.handoff.model.TicketRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class TicketRepository {

  private static final String COLUMNS =
      "ticket_id, event_id, ticket_number, owner_actor_id, owner_email, version, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<TicketRecord> findById(String ticketId) {
    final String sql = "SELECT " + COLUMNS + " FROM tickets WHERE ticket_id = :ticketId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ticketId", ticketId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<TicketRecord> lockById(String ticketId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM tickets WHERE ticket_id = :ticketId FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ticketId", ticketId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Moves ownership only while {@code expectedOwner} still owns the ticket. */
  public Optional<TicketRecord> transferOwnership(
      String ticketId, String expectedOwner, String newOwner, Instant now) {
    final String sql =
        """
        UPDATE tickets
        SET owner_actor_id = :newOwner,
            owner_email = NULL,
            version = version + 1,
            updated_at = :now
        WHERE ticket_id = :ticketId
          AND owner_actor_id = :expectedOwner
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ticketId", ticketId)
            .addValue("expectedOwner", expectedOwner)
            .addValue("newOwner", newOwner)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Parks the ticket on an email address with no actor behind it yet. */
  public Optional<TicketRecord> assignToEmail(
      String ticketId, String expectedOwner, String email, Instant now) {
    final String sql =
        """
        UPDATE tickets
        SET owner_actor_id = NULL,
            owner_email = :email,
            version = version + 1,
            updated_at = :now
        WHERE ticket_id = :ticketId
          AND owner_actor_id = :expectedOwner
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ticketId", ticketId)
            .addValue("expectedOwner", expectedOwner)
            .addValue("email", email)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Attaches every ticket parked on {@code email} to the actor that now owns the address. */
  public List<TicketRecord> bindEmailOwnership(String email, String actorId, Instant now) {
    final String sql =
        """
        UPDATE tickets
        SET owner_actor_id = :actorId,
            owner_email = NULL,
            version = version + 1,
            updated_at = :now
        WHERE owner_actor_id IS NULL
          AND owner_email = :email
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("email", email)
            .addValue("actorId", actorId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int insert(TicketRecord ticket) {
    final String sql =
        """
        INSERT INTO tickets (
          ticket_id, event_id, ticket_number, owner_actor_id, owner_email, version, updated_at
        ) VALUES (
          :ticketId, :eventId, :ticketNumber, :ownerActorId, :ownerEmail, :version, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ticketId", ticket.ticketId())
            .addValue("eventId", ticket.eventId())
            .addValue("ticketNumber", ticket.ticketNumber())
            .addValue("ownerActorId", ticket.ownerActorId())
            .addValue("ownerEmail", ticket.ownerEmail())
            .addValue("version", ticket.version())
            .addValue("updatedAt", toTimestamp(ticket.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  private TicketRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TicketRecord(
        rs.getString("ticket_id"),
        rs.getString("event_id"),
        rs.getString("ticket_number"),
        rs.getString("owner_actor_id"),
        rs.getString("owner_email"),
        rs.getLong("version"),
        rs.getTimestamp("updated_at").toInstant());
  }
}
