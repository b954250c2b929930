/*
 * Where: handoff data access
 * What: persists pending operations and applies their state transitions
 * Why: every transition is a compare-and-swap on (state, version) so each operation has one total order
 */
package com.tickety.handoff.repository;

import static com.tickety.common.JdbcTimestampUtils.toTimestamp;

import com.tickety.handoff.model.OperationKind;
import com.tickety.handoff.model.OperationState;
import com.tickety.handoff.model.OperationTerms;
import com.tickety.handoff.model.PendingOperationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class PendingOperationRepository {

  private static final String COLUMNS =
      """
      operation_id, kind, initiator_actor_id, counterparty_actor_id, subject_ref, amount_cents,
      currency, token_id, state, terminal_reason, charge_ref, created_at, updated_at, expires_at,
      version
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(PendingOperationRecord operation) {
    final String sql =
        """
        INSERT INTO pending_operations (
          operation_id,
          kind,
          initiator_actor_id,
          counterparty_actor_id,
          subject_ref,
          amount_cents,
          currency,
          token_id,
          state,
          created_at,
          updated_at,
          expires_at,
          version
        ) VALUES (
          :operationId,
          :kind,
          :initiator,
          :counterparty,
          :subjectRef,
          :amountCents,
          :currency,
          :tokenId,
          :state,
          :createdAt,
          :updatedAt,
          :expiresAt,
          :version
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("operationId", operation.operationId())
            .addValue("kind", operation.kind().name())
            .addValue("initiator", operation.initiatorActorId())
            .addValue("counterparty", operation.counterpartyActorId())
            .addValue("subjectRef", operation.subjectRef())
            .addValue("amountCents", null)
            .addValue("currency", null)
            .addValue("tokenId", null)
            .addValue("state", operation.state().name())
            .addValue("createdAt", toTimestamp(operation.createdAt()))
            .addValue("updatedAt", toTimestamp(operation.updatedAt()))
            .addValue("expiresAt", toTimestamp(operation.expiresAt()))
            .addValue("version", operation.version());
    if (operation.terms() instanceof OperationTerms.Payment payment) {
      params
          .addValue("amountCents", payment.amountCents())
          .addValue("currency", payment.currency());
    } else if (operation.terms() instanceof OperationTerms.Transfer transfer) {
      params.addValue("tokenId", transfer.tokenId());
    }
    return jdbcTemplate.update(sql, params);
  }

  public Optional<PendingOperationRecord> findById(UUID operationId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM pending_operations WHERE operation_id = :operationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("operationId", operationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<PendingOperationRecord> lockById(UUID operationId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM pending_operations WHERE operation_id = :operationId FOR UPDATE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("operationId", operationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<PendingOperationRecord> lockByTokenId(String tokenId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM pending_operations WHERE token_id = :tokenId FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("tokenId", tokenId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** True when a non-terminal transfer still inside its window references the ticket. */
  public boolean hasOpenTransferForTicket(String ticketId, Instant now) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM pending_operations
          WHERE kind = 'TRANSFER'
            AND subject_ref = :ticketId
            AND state IN ('PENDING', 'PROCESSING')
            AND expires_at > :now
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ticketId", ticketId)
            .addValue("now", toTimestamp(now));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public List<PendingOperationRecord> findIncoming(String counterpartyActorId, Instant now) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM pending_operations
            WHERE counterparty_actor_id = :counterparty
              AND state IN ('PENDING', 'PROCESSING')
              AND expires_at > :now
            ORDER BY created_at
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("counterparty", counterpartyActorId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Compare-and-swap transition. Returns the updated row, or empty when another writer moved the
   * operation first. {@code counterpartyActorId} and {@code chargeRef} only fill empty columns.
   */
  public Optional<PendingOperationRecord> transition(
      UUID operationId,
      OperationState expectedState,
      long expectedVersion,
      OperationState target,
      String terminalReason,
      String counterpartyActorId,
      String chargeRef,
      Instant now) {
    final String sql =
        """
        UPDATE pending_operations
        SET state = :target,
            terminal_reason = :terminalReason,
            counterparty_actor_id = COALESCE(counterparty_actor_id, :counterparty),
            charge_ref = COALESCE(charge_ref, :chargeRef),
            version = version + 1,
            updated_at = :now
        WHERE operation_id = :operationId
          AND state = :expectedState
          AND version = :expectedVersion
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("operationId", operationId)
            .addValue("expectedState", expectedState.name())
            .addValue("expectedVersion", expectedVersion)
            .addValue("target", target.name())
            .addValue("terminalReason", terminalReason)
            .addValue("counterparty", counterpartyActorId)
            .addValue("chargeRef", chargeRef)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Expires a batch of due open operations; rows locked by another sweeper are skipped. */
  public List<PendingOperationRecord> expireDue(Instant now, String reason, int limit) {
    final String sql =
        """
        WITH due AS (
          SELECT operation_id
          FROM pending_operations
          WHERE state IN ('PENDING', 'PROCESSING')
            AND expires_at <= :now
          ORDER BY expires_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE pending_operations p
        SET state = 'EXPIRED',
            terminal_reason = :reason,
            version = p.version + 1,
            updated_at = :now
        FROM due
        WHERE p.operation_id = due.operation_id
        RETURNING p.operation_id, p.kind, p.initiator_actor_id, p.counterparty_actor_id,
                  p.subject_ref, p.amount_cents, p.currency, p.token_id, p.state,
                  p.terminal_reason, p.charge_ref, p.created_at, p.updated_at, p.expires_at,
                  p.version
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("reason", reason)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private PendingOperationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long amount = rs.getLong("amount_cents");
    final Long amountCents = rs.wasNull() ? null : amount;
    return new PendingOperationRecord(
        rs.getObject("operation_id", UUID.class),
        OperationTerms.of(
            OperationKind.valueOf(rs.getString("kind")),
            amountCents,
            rs.getString("currency"),
            rs.getString("token_id")),
        rs.getString("initiator_actor_id"),
        rs.getString("counterparty_actor_id"),
        rs.getString("subject_ref"),
        OperationState.valueOf(rs.getString("state")),
        rs.getString("terminal_reason"),
        rs.getString("charge_ref"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant(),
        rs.getTimestamp("expires_at").toInstant(),
        rs.getLong("version"));
  }
}
