/*
 * どこで: Arena データアクセス
 * 何を: 実績定義・ユーザー別進捗・獲得ポイント合計を読み書きする
 * なぜ: unlocked_at の set-once を SQL の条件付き更新で保証するため
 */
package com.example.arena.repository;

import static com.example.common.JdbcTimestampUtils.instantOrNull;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.arena.model.AchievementDefinition;
import com.example.arena.model.AchievementTotals;
import com.example.arena.model.CriteriaType;
import com.example.arena.model.UserAchievementProgress;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AchievementRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public AchievementRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public List<AchievementDefinition> findAllDefinitions() {
    final String sql =
        """
        SELECT achievement_id, name, description, category, criteria_type,
               criteria_target, criteria_metric, points
        FROM achievements
        ORDER BY category, achievement_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapDefinition);
  }

  public List<UserAchievementProgress> findProgress(String userId) {
    final String sql =
        """
        SELECT user_id, achievement_id, progress, unlocked_at
        FROM user_achievements
        WHERE user_id = :userId
        ORDER BY achievement_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapProgress);
  }

  /**
   * 未解除の場合だけ unlocked_at を設定する。
   *
   * @return この呼び出しで解除した場合 true。既に解除済みなら false
   */
  public boolean unlock(String userId, String achievementId, Instant unlockedAt) {
    final String sql =
        """
        INSERT INTO user_achievements (user_id, achievement_id, progress, unlocked_at, updated_at)
        VALUES (:userId, :achievementId, 100, :unlockedAt, :unlockedAt)
        ON CONFLICT (user_id, achievement_id)
        DO UPDATE SET
          progress = 100,
          unlocked_at = EXCLUDED.unlocked_at,
          updated_at = EXCLUDED.updated_at
        WHERE user_achievements.unlocked_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("achievementId", achievementId)
            .addValue("unlockedAt", toTimestamp(unlockedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  /** 解除前の進捗だけを更新する。解除済みの行には触れない。 */
  public int saveProgress(
      String userId, String achievementId, BigDecimal progress, Instant updatedAt) {
    final String sql =
        """
        INSERT INTO user_achievements (user_id, achievement_id, progress, unlocked_at, updated_at)
        VALUES (:userId, :achievementId, :progress, NULL, :updatedAt)
        ON CONFLICT (user_id, achievement_id)
        DO UPDATE SET
          progress = EXCLUDED.progress,
          updated_at = EXCLUDED.updated_at
        WHERE user_achievements.unlocked_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("achievementId", achievementId)
            .addValue("progress", progress)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public AchievementTotals findTotals(String userId) {
    final String sql =
        """
        SELECT user_id, achievement_points, unlocked_count
        FROM user_achievement_totals
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new AchievementTotals(
                    rs.getString("user_id"),
                    rs.getLong("achievement_points"),
                    rs.getInt("unlocked_count")))
        .stream()
        .findFirst()
        .orElseGet(() -> AchievementTotals.empty(userId));
  }

  public void addUnlocked(String userId, int points, Instant unlockedAt) {
    final String sql =
        """
        INSERT INTO user_achievement_totals (user_id, achievement_points, unlocked_count, last_unlocked_at)
        VALUES (:userId, :points, 1, :unlockedAt)
        ON CONFLICT (user_id)
        DO UPDATE SET
          achievement_points = user_achievement_totals.achievement_points + EXCLUDED.achievement_points,
          unlocked_count = user_achievement_totals.unlocked_count + 1,
          last_unlocked_at = EXCLUDED.last_unlocked_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("points", points)
            .addValue("unlockedAt", toTimestamp(unlockedAt));
    jdbcTemplate.update(sql, params);
  }

  private AchievementDefinition mapDefinition(ResultSet rs, int rowNum) throws SQLException {
    return new AchievementDefinition(
        rs.getString("achievement_id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("category"),
        CriteriaType.fromValue(rs.getString("criteria_type")),
        rs.getLong("criteria_target"),
        rs.getString("criteria_metric"),
        rs.getInt("points"));
  }

  private UserAchievementProgress mapProgress(ResultSet rs, int rowNum) throws SQLException {
    return new UserAchievementProgress(
        rs.getString("user_id"),
        rs.getString("achievement_id"),
        rs.getBigDecimal("progress"),
        instantOrNull(rs, "unlocked_at"));
  }
}
