/*
 * どこで: Arena API レスポンス DTO
 * 何を: プレイヤーの実績一覧（未着手を含む）と合計ポイントを定義する
 * なぜ: 定義と進捗を突き合わせた結果をクライアントで再計算させないため
 */
package com.example.arena.api.response;

import com.example.arena.model.AchievementDefinition;
import com.example.arena.model.PlayerAchievements;
import com.example.arena.model.UserAchievementProgress;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerAchievementsResponse(
    String userId,
    long achievementPoints,
    int unlockedCount,
    List<PlayerAchievementResponse> achievements) {

  public static PlayerAchievementsResponse from(String userId, PlayerAchievements source) {
    final Map<String, UserAchievementProgress> progressById = new HashMap<>();
    for (UserAchievementProgress progress : source.progress()) {
      progressById.put(progress.achievementId(), progress);
    }
    final List<PlayerAchievementResponse> items = new ArrayList<>(source.definitions().size());
    for (AchievementDefinition definition : source.definitions()) {
      final UserAchievementProgress progress = progressById.get(definition.achievementId());
      items.add(
          new PlayerAchievementResponse(
              definition.achievementId(),
              definition.name(),
              definition.category(),
              definition.points(),
              progress != null && progress.unlocked(),
              progress == null ? null : Instants.format(progress.unlockedAt()),
              progress == null ? BigDecimal.ZERO : progress.progress()));
    }
    return new PlayerAchievementsResponse(
        userId, source.totals().achievementPoints(), source.totals().unlockedCount(), items);
  }
}
