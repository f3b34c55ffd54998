/*
 * どこで: Arena サービス層
 * 何を: 成績スナップショットから実績の進捗を計算し、達成したものを 1 回だけ解除する
 * なぜ: 並行した評価でもポイント付与と解除通知が二重にならないようにするため
 */
package com.example.arena.service;

import com.example.arena.model.AchievementDefinition;
import com.example.arena.model.AchievementEvaluation;
import com.example.arena.model.AchievementTotals;
import com.example.arena.model.CriteriaType;
import com.example.arena.model.LeaderboardRecord;
import com.example.arena.model.UserAchievementProgress;
import com.example.arena.repository.AchievementRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AchievementEngine {

  private static final Logger logger = LoggerFactory.getLogger(AchievementEngine.class);
  private static final BigDecimal HUNDRED = new BigDecimal("100.00");
  private static final BigDecimal PROGRESS_CAP = new BigDecimal("99.00");

  private final AchievementRepository achievementRepository;
  private final AchievementCatalog catalog;
  private final SessionMetrics metrics;
  private final Clock clock;

  public AchievementEngine(
      AchievementRepository achievementRepository,
      AchievementCatalog catalog,
      SessionMetrics metrics,
      Clock clock) {
    this.achievementRepository = achievementRepository;
    this.catalog = catalog;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 未解除の全実績を 1 回ずつ評価する。
   *
   * <p>achievements_unlocked は評価開始時点の解除数で判定し、この評価中に解除したものは次回の評価で数える。
   */
  @Transactional
  public List<AchievementEvaluation> evaluate(String userId, LeaderboardRecord snapshot) {
    final Instant now = Instant.now(clock);
    final Map<String, UserAchievementProgress> progressById =
        achievementRepository.findProgress(userId).stream()
            .collect(
                Collectors.toMap(UserAchievementProgress::achievementId, Function.identity()));
    final int unlockedBefore = achievementRepository.findTotals(userId).unlockedCount();

    final List<AchievementEvaluation> evaluations = new ArrayList<>();
    for (AchievementDefinition definition : catalog.definitions()) {
      final UserAchievementProgress existing = progressById.get(definition.achievementId());
      if (existing != null && existing.unlocked()) {
        continue;
      }
      final BigDecimal previous = existing == null ? BigDecimal.ZERO : existing.progress();
      final long observed =
          definition.criteriaType().observe(snapshot, definition.metric(), unlockedBefore);
      if (observed >= definition.target()) {
        evaluations.add(unlock(userId, definition, previous, now));
        continue;
      }
      final BigDecimal progress = progressFor(definition, observed);
      if (progress.compareTo(previous) != 0) {
        achievementRepository.saveProgress(userId, definition.achievementId(), progress, now);
      }
      evaluations.add(
          new AchievementEvaluation(
              definition.achievementId(), definition.name(), false, false, progress, previous, 0));
    }
    return evaluations;
  }

  public List<AchievementDefinition> listDefinitions() {
    return catalog.definitions();
  }

  public List<UserAchievementProgress> listProgress(String userId) {
    return achievementRepository.findProgress(userId);
  }

  public AchievementTotals totals(String userId) {
    return achievementRepository.findTotals(userId);
  }

  static BigDecimal progressFor(AchievementDefinition definition, long observed) {
    final BigDecimal ratio =
        BigDecimal.valueOf(Math.max(0, observed)).multiply(BigDecimal.valueOf(100));
    final BigDecimal target = BigDecimal.valueOf(definition.target());
    if (definition.criteriaType() == CriteriaType.ACHIEVEMENTS_UNLOCKED) {
      return ratio.divide(target, 0, RoundingMode.FLOOR).min(HUNDRED).setScale(2);
    }
    return ratio.divide(target, 2, RoundingMode.HALF_UP).min(PROGRESS_CAP);
  }

  private AchievementEvaluation unlock(
      String userId, AchievementDefinition definition, BigDecimal previous, Instant now) {
    if (!achievementRepository.unlock(userId, definition.achievementId(), now)) {
      // 並行評価が先に解除した
      return new AchievementEvaluation(
          definition.achievementId(), definition.name(), false, true, HUNDRED, previous, 0);
    }
    achievementRepository.addUnlocked(userId, definition.points(), now);
    metrics.recordAchievementUnlocked();
    logger.info(
        "achievement unlocked userId={} achievementId={} points={}",
        userId,
        definition.achievementId(),
        definition.points());
    return new AchievementEvaluation(
        definition.achievementId(),
        definition.name(),
        true,
        false,
        HUNDRED,
        previous,
        definition.points());
  }
}
