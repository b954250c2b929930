/*
 * Where: handoff data access
 * What: looks up registered actors by email
 * Why: an email handoff branches on whether the address already has an account
 */
package com.tickety.handoff.repository;

import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ActorRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }

  public Optional<String> findActorIdByEmail(String email) {
    final String sql = "SELECT actor_id FROM actors WHERE email = :email";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("email", normalizeEmail(email));
    return jdbcTemplate.queryForList(sql, params, String.class).stream().findFirst();
  }

  public int insert(String actorId, String email) {
    final String sql =
        """
        INSERT INTO actors (actor_id, email)
        VALUES (:actorId, :email)
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("actorId", actorId)
            .addValue("email", email == null ? null : normalizeEmail(email));
    return jdbcTemplate.update(sql, params);
  }
}
