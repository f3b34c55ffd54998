/*
 * どこで: Arena データアクセス
 * 何を: leaderboard / leaderboard_game_type_scores / stats_credits の加算と参照を行う
 * なぜ: 通算成績を 1 文の UPSERT で更新し、同時加算でも値を取りこぼさないため
 */
package com.example.arena.repository;

import static com.example.common.JdbcTimestampUtils.instantOrNull;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.arena.model.GameCredit;
import com.example.arena.model.GameResult;
import com.example.arena.model.GameTypeScore;
import com.example.arena.model.LeaderboardRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LeaderboardRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 加算マーカーを登録する。既に同じ (sessionId, userId) が加算済みなら false。 */
  public boolean insertCreditMarker(GameCredit credit, Instant creditedAt) {
    final String sql =
        """
        INSERT INTO stats_credits (session_id, user_id, result, score, credited_at)
        VALUES (:sessionId, :userId, :result, :score, :creditedAt)
        ON CONFLICT (session_id, user_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", credit.sessionId())
            .addValue("userId", credit.userId())
            .addValue("result", credit.result().value())
            .addValue("score", credit.score())
            .addValue("creditedAt", toTimestamp(creditedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public void applyGameResult(GameCredit credit, Instant updatedAt) {
    // DO UPDATE 側の leaderboard.* は更新前の値を指す
    final String sql =
        """
        INSERT INTO leaderboard (
          user_id,
          username,
          total_score,
          games_played,
          wins,
          losses,
          draws,
          current_win_streak,
          best_win_streak,
          perfect_games,
          average_score,
          last_played_at,
          updated_at
        ) VALUES (
          :userId,
          :username,
          :score,
          1,
          :win,
          :loss,
          :draw,
          :win,
          :win,
          :perfect,
          ROUND(CAST(:score AS NUMERIC), 2),
          :playedAt,
          :updatedAt
        )
        ON CONFLICT (user_id)
        DO UPDATE SET
          username = COALESCE(EXCLUDED.username, leaderboard.username),
          total_score = leaderboard.total_score + EXCLUDED.total_score,
          games_played = leaderboard.games_played + 1,
          wins = leaderboard.wins + EXCLUDED.wins,
          losses = leaderboard.losses + EXCLUDED.losses,
          draws = leaderboard.draws + EXCLUDED.draws,
          current_win_streak = CASE
            WHEN EXCLUDED.wins = 1 THEN leaderboard.current_win_streak + 1
            WHEN EXCLUDED.losses = 1 THEN 0
            ELSE leaderboard.current_win_streak
          END,
          best_win_streak = CASE
            WHEN EXCLUDED.wins = 1
              THEN GREATEST(leaderboard.best_win_streak, leaderboard.current_win_streak + 1)
            ELSE leaderboard.best_win_streak
          END,
          perfect_games = leaderboard.perfect_games + EXCLUDED.perfect_games,
          average_score = ROUND(
            CAST(leaderboard.total_score + EXCLUDED.total_score AS NUMERIC)
              / (leaderboard.games_played + 1),
            2),
          last_played_at = EXCLUDED.last_played_at,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", credit.userId())
            .addValue("username", credit.username())
            .addValue("score", credit.score())
            .addValue("win", credit.result() == GameResult.WIN ? 1 : 0)
            .addValue("loss", credit.result() == GameResult.LOSS ? 1 : 0)
            .addValue("draw", credit.result() == GameResult.DRAW ? 1 : 0)
            .addValue("perfect", credit.perfect() ? 1 : 0)
            .addValue("playedAt", toTimestamp(credit.playedAt()))
            .addValue("updatedAt", toTimestamp(updatedAt));
    jdbcTemplate.update(sql, params);
  }

  public void addGameTypeScore(String userId, String gameType, long score) {
    final String sql =
        """
        INSERT INTO leaderboard_game_type_scores (user_id, game_type, score, games_played)
        VALUES (:userId, :gameType, :score, 1)
        ON CONFLICT (user_id, game_type)
        DO UPDATE SET
          score = leaderboard_game_type_scores.score + EXCLUDED.score,
          games_played = leaderboard_game_type_scores.games_played + 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("gameType", gameType)
            .addValue("score", score);
    jdbcTemplate.update(sql, params);
  }

  public void updateDailyStreak(String userId, int dailyStreak, Instant updatedAt) {
    upsertReportedValue("daily_streak", userId, dailyStreak, updatedAt);
  }

  public void updateFriendCount(String userId, int friendCount, Instant updatedAt) {
    upsertReportedValue("friend_count", userId, friendCount, updatedAt);
  }

  public Optional<LeaderboardRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, username, total_score, games_played, wins, losses, draws,
               current_win_streak, best_win_streak, perfect_games, average_score,
               daily_streak, friend_count, last_played_at
        FROM leaderboard
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    final Map<String, GameTypeScore> gameTypeScores = findGameTypeScores(userId);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> mapRow(rs, gameTypeScores))
        .stream()
        .findFirst();
  }

  private Map<String, GameTypeScore> findGameTypeScores(String userId) {
    final String sql =
        """
        SELECT game_type, score, games_played
        FROM leaderboard_game_type_scores
        WHERE user_id = :userId
        ORDER BY game_type
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    final Map<String, GameTypeScore> scores = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          scores.put(
              rs.getString("game_type"),
              new GameTypeScore(rs.getLong("score"), rs.getInt("games_played")));
        });
    return scores;
  }

  private void upsertReportedValue(String column, String userId, int value, Instant updatedAt) {
    // column は内部定数のみ。外部入力を連結しない
    final String sql =
        """
        INSERT INTO leaderboard (user_id, %1$s, updated_at)
        VALUES (:userId, :value, :updatedAt)
        ON CONFLICT (user_id)
        DO UPDATE SET %1$s = EXCLUDED.%1$s, updated_at = EXCLUDED.updated_at
        """
            .formatted(column);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("value", value)
            .addValue("updatedAt", toTimestamp(updatedAt));
    jdbcTemplate.update(sql, params);
  }

  private LeaderboardRecord mapRow(ResultSet rs, Map<String, GameTypeScore> gameTypeScores)
      throws SQLException {
    return new LeaderboardRecord(
        rs.getString("user_id"),
        rs.getString("username"),
        rs.getLong("total_score"),
        rs.getInt("games_played"),
        rs.getInt("wins"),
        rs.getInt("losses"),
        rs.getInt("draws"),
        rs.getInt("current_win_streak"),
        rs.getInt("best_win_streak"),
        rs.getInt("perfect_games"),
        rs.getBigDecimal("average_score"),
        rs.getInt("daily_streak"),
        rs.getInt("friend_count"),
        gameTypeScores,
        instantOrNull(rs, "last_played_at"));
  }
}
