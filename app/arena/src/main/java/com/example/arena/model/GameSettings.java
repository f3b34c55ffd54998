package com.example.arena.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameSettings(
    String mode,
    Integer timeLimitSeconds,
    String difficulty,
    Long perfectScore,
    boolean rankAffected) {

  public static final String DEFAULT_GAME_TYPE = "general";

  public static GameSettings empty() {
    return new GameSettings(null, null, null, null, false);
  }

  /** 統計上のゲーム種別。mode が未指定なら general に集計する。 */
  public String gameType() {
    return mode == null || mode.isBlank() ? DEFAULT_GAME_TYPE : mode;
  }
}
