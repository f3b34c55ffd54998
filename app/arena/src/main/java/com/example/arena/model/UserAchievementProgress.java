package com.example.arena.model;

import java.math.BigDecimal;
import java.time.Instant;

public record UserAchievementProgress(
    String userId, String achievementId, BigDecimal progress, Instant unlockedAt) {

  public boolean unlocked() {
    return unlockedAt != null;
  }
}
