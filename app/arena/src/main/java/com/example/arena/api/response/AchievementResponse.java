package com.example.arena.api.response;

import com.example.arena.model.AchievementDefinition;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AchievementResponse(
    String achievementId,
    String name,
    String description,
    String category,
    String criteriaType,
    long target,
    String metric,
    int points) {

  public static AchievementResponse from(AchievementDefinition definition) {
    return new AchievementResponse(
        definition.achievementId(),
        definition.name(),
        definition.description(),
        definition.category(),
        definition.criteriaType().value(),
        definition.target(),
        definition.metric(),
        definition.points());
  }
}
