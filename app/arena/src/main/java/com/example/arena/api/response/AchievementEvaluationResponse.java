package com.example.arena.api.response;

import com.example.arena.model.AchievementEvaluation;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AchievementEvaluationResponse(
    String achievementId,
    boolean unlocked,
    boolean alreadyUnlocked,
    BigDecimal progress,
    int pointsAwarded) {

  public static AchievementEvaluationResponse from(AchievementEvaluation evaluation) {
    return new AchievementEvaluationResponse(
        evaluation.achievementId(),
        evaluation.unlocked(),
        evaluation.alreadyUnlocked(),
        evaluation.progress(),
        evaluation.pointsAwarded());
  }
}
