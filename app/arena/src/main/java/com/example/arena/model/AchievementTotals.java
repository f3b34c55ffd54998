package com.example.arena.model;

public record AchievementTotals(String userId, long achievementPoints, int unlockedCount) {

  public static AchievementTotals empty(String userId) {
    return new AchievementTotals(userId, 0, 0);
  }
}
