package com.example.arena.service;

import com.example.arena.model.AchievementEvaluation;
import com.example.arena.model.LeaderboardRecord;
import com.example.arena.model.PlayerAchievements;
import com.example.arena.model.PlayerProgressReport;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** 外部から報告される成績値（連続ログイン日数・フレンド数）の反映と、プレイヤー成績の参照。 */
@Service
@RequiredArgsConstructor
public class PlayerProgressService {

  private final StatsLedger statsLedger;
  private final AchievementEngine achievementEngine;
  private final ResultEventRecorder resultEventRecorder;

  @Transactional
  public PlayerProgressReport recordDailyStreak(String userId, int dailyStreak) {
    return evaluate(userId, statsLedger.recordDailyStreak(userId, dailyStreak));
  }

  @Transactional
  public PlayerProgressReport recordFriendCount(String userId, int friendCount) {
    return evaluate(userId, statsLedger.recordFriendCount(userId, friendCount));
  }

  public LeaderboardRecord stats(String userId) {
    return statsLedger.get(userId);
  }

  public PlayerAchievements achievements(String userId) {
    return new PlayerAchievements(
        achievementEngine.totals(userId),
        achievementEngine.listDefinitions(),
        achievementEngine.listProgress(userId));
  }

  private PlayerProgressReport evaluate(String userId, LeaderboardRecord snapshot) {
    final List<AchievementEvaluation> evaluations = achievementEngine.evaluate(userId, snapshot);
    resultEventRecorder.achievementChanges(null, userId, evaluations);
    return new PlayerProgressReport(snapshot, evaluations);
  }
}
