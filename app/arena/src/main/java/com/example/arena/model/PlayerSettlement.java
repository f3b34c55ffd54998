package com.example.arena.model;

import java.util.List;

/** 1 参加者ぶんの確定結果。credited=false は同じセッションで加算済みだったことを表す。 */
public record PlayerSettlement(
    String userId,
    boolean credited,
    LeaderboardRecord stats,
    List<AchievementEvaluation> achievements) {

  public PlayerSettlement {
    achievements = achievements == null ? List.of() : List.copyOf(achievements);
  }

  public static PlayerSettlement alreadyCredited(String userId) {
    return new PlayerSettlement(userId, false, null, List.of());
  }
}
