package com.example.arena.model;

import java.util.List;

public record PlayerProgressReport(LeaderboardRecord stats, List<AchievementEvaluation> achievements) {

  public PlayerProgressReport {
    achievements = achievements == null ? List.of() : List.copyOf(achievements);
  }
}
