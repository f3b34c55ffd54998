package com.example.arena.model;

import java.util.List;

/**
 * @param firstSettlement 終了記録をこの呼び出しで登録した
 */
public record SettlementReport(
    String sessionId, boolean firstSettlement, List<PlayerSettlement> players) {

  public SettlementReport {
    players = players == null ? List.of() : List.copyOf(players);
  }
}
