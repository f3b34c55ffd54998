package com.example.arena.model;

import java.util.List;

public record PlayerAchievements(
    AchievementTotals totals,
    List<AchievementDefinition> definitions,
    List<UserAchievementProgress> progress) {

  public PlayerAchievements {
    definitions = definitions == null ? List.of() : List.copyOf(definitions);
    progress = progress == null ? List.of() : List.copyOf(progress);
  }
}
