package com.example.arena.model;

import java.time.Instant;

public record GameCredit(
    String sessionId,
    String userId,
    String username,
    GameResult result,
    long score,
    String gameType,
    Long perfectScore,
    Instant playedAt) {

  public boolean perfect() {
    return perfectScore != null && perfectScore > 0 && score == perfectScore;
  }
}
