package com.example.arena.api.response;

import com.example.arena.model.GameTypeScore;
import com.example.arena.model.LeaderboardRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerStatsResponse(
    String userId,
    String username,
    long totalScore,
    int gamesPlayed,
    int wins,
    int losses,
    int draws,
    int currentWinStreak,
    int bestWinStreak,
    int perfectGames,
    BigDecimal averageScore,
    int dailyStreak,
    int friendCount,
    Map<String, Long> gameTypeScores,
    String lastPlayedAt) {

  public static PlayerStatsResponse from(LeaderboardRecord record) {
    final Map<String, Long> scores = new TreeMap<>();
    for (Map.Entry<String, GameTypeScore> entry : record.gameTypeScores().entrySet()) {
      scores.put(entry.getKey(), entry.getValue().score());
    }
    return new PlayerStatsResponse(
        record.userId(),
        record.username(),
        record.totalScore(),
        record.gamesPlayed(),
        record.wins(),
        record.losses(),
        record.draws(),
        record.currentWinStreak(),
        record.bestWinStreak(),
        record.perfectGames(),
        record.averageScore(),
        record.dailyStreak(),
        record.friendCount(),
        scores,
        Instants.format(record.lastPlayedAt()));
  }
}
