/*
 * どこで: AchievementRepository の統合テスト
 * 何を: シード定義の読み込みと unlocked_at の set-once、解除後の進捗固定を検証する
 * なぜ: 並行評価でも実績が二重に解除されずポイントが重複しないことを保証するため
 */
package com.example.arena.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.arena.AbstractPostgresContainerTest;
import com.example.arena.model.AchievementDefinition;
import com.example.arena.model.AchievementTotals;
import com.example.arena.model.CriteriaType;
import com.example.arena.model.UserAchievementProgress;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AchievementRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private AchievementRepository achievementRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM user_achievements", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM user_achievement_totals", new MapSqlParameterSource());
  }

  @Test
  void seededCatalogIsReadable() {
    final List<AchievementDefinition> definitions = achievementRepository.findAllDefinitions();

    assertThat(definitions).hasSize(14);
    assertThat(definitions)
        .filteredOn(definition -> definition.achievementId().equals("quick_master"))
        .singleElement()
        .satisfies(
            definition -> {
              assertThat(definition.criteriaType()).isEqualTo(CriteriaType.GAME_TYPE_MASTERY);
              assertThat(definition.metric()).isEqualTo("quick");
              assertThat(definition.target()).isEqualTo(500);
            });
  }

  @Test
  void unlockIsSetOnce() {
    assertThat(achievementRepository.unlock("u1", "first_win", BASE_TIME)).isTrue();
    assertThat(achievementRepository.unlock("u1", "first_win", BASE_TIME.plusSeconds(30)))
        .isFalse();

    final UserAchievementProgress progress = achievementRepository.findProgress("u1").get(0);
    assertThat(progress.unlockedAt()).isEqualTo(BASE_TIME);
    assertThat(progress.progress()).isEqualByComparingTo(new BigDecimal("100"));
  }

  @Test
  void progressIsFrozenAfterUnlock() {
    assertThat(
            achievementRepository.saveProgress(
                "u1", "score_1000", new BigDecimal("42.50"), BASE_TIME))
        .isEqualTo(1);
    achievementRepository.unlock("u1", "score_1000", BASE_TIME.plusSeconds(10));

    final int updated =
        achievementRepository.saveProgress(
            "u1", "score_1000", new BigDecimal("10.00"), BASE_TIME.plusSeconds(20));

    assertThat(updated).isZero();
    assertThat(achievementRepository.findProgress("u1").get(0).progress())
        .isEqualByComparingTo(new BigDecimal("100"));
  }

  @Test
  void totalsAccumulatePointsAndCount() {
    assertThat(achievementRepository.findTotals("u1")).isEqualTo(AchievementTotals.empty("u1"));

    achievementRepository.addUnlocked("u1", 10, BASE_TIME);
    achievementRepository.addUnlocked("u1", 25, BASE_TIME.plusSeconds(5));

    assertThat(achievementRepository.findTotals("u1"))
        .isEqualTo(new AchievementTotals("u1", 35, 2));
  }
}
