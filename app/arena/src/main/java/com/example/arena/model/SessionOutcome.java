package com.example.arena.model;

import java.time.Instant;
import java.util.List;

/** セッション終了の確定記録。StatsLedger と AchievementEngine はこれだけを入力にする。 */
public record SessionOutcome(
    String sessionId,
    String gameType,
    Long perfectScore,
    FinishReason reason,
    Instant finishedAt,
    List<PlayerStanding> standings) {

  public SessionOutcome {
    standings = standings == null ? List.of() : List.copyOf(standings);
  }
}
