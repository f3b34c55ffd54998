package com.example.arena.api.response;

import com.example.arena.model.PlayerProgressReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerProgressResponse(
    PlayerStatsResponse stats, List<AchievementEvaluationResponse> achievements) {

  public static PlayerProgressResponse from(PlayerProgressReport report) {
    return new PlayerProgressResponse(
        PlayerStatsResponse.from(report.stats()),
        report.achievements().stream().map(AchievementEvaluationResponse::from).toList());
  }
}
