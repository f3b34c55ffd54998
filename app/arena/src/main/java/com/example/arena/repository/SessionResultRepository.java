package com.example.arena.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.arena.model.FinishReason;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SessionResultRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 終了記録を登録する。先に書いた側だけが true を受け取る。 */
  public boolean insertIfAbsent(
      String sessionId,
      String gameType,
      FinishReason reason,
      String standingsJson,
      Instant settledAt) {
    final String sql =
        """
        INSERT INTO session_results (session_id, game_type, finish_reason, standings, settled_at)
        VALUES (:sessionId, :gameType, :finishReason, :standings::jsonb, :settledAt)
        ON CONFLICT (session_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("gameType", gameType)
            .addValue("finishReason", reason.name())
            .addValue("standings", standingsJson)
            .addValue("settledAt", toTimestamp(settledAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public boolean exists(String sessionId) {
    final String sql = "SELECT COUNT(*) FROM session_results WHERE session_id = :sessionId";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("sessionId", sessionId), Integer.class);
    return count != null && count > 0;
  }
}
