package com.example.arena.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record LeaderboardRecord(
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
    Map<String, GameTypeScore> gameTypeScores,
    Instant lastPlayedAt) {

  public LeaderboardRecord {
    gameTypeScores = gameTypeScores == null ? Map.of() : Map.copyOf(gameTypeScores);
    averageScore = averageScore == null ? BigDecimal.ZERO : averageScore;
  }

  public static LeaderboardRecord empty(String userId) {
    return new LeaderboardRecord(
        userId, null, 0, 0, 0, 0, 0, 0, 0, 0, BigDecimal.ZERO, 0, 0, Map.of(), null);
  }

  public long gameTypeScore(String gameType) {
    final GameTypeScore score = gameTypeScores.get(gameType);
    return score == null ? 0 : score.score();
  }
}
