package com.example.arena.api.response;

import com.example.arena.model.QueueStatistics;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueStatisticsResponse(
    long totalPlayers, double averageSkill, long averageWaitSeconds, long longestWaitSeconds) {

  public static QueueStatisticsResponse from(QueueStatistics statistics) {
    return new QueueStatisticsResponse(
        statistics.totalPlayers(),
        Math.round(statistics.averageSkill() * 100) / 100.0,
        statistics.averageWaitSeconds(),
        statistics.longestWaitSeconds());
  }
}
