package com.example.arena.model;

import java.util.List;

public record PairingResult(Outcome outcome, Room room, List<String> opponentIds, QueueStatus queueStatus) {

  public enum Outcome {
    /** この呼び出しで対戦相手を確保しルームを作成した。 */
    MATCHED,
    /** 並行する別のマッチングで既に確保されていた。 */
    ALREADY_MATCHED,
    /** 相手が見つからずキューに残っている。 */
    QUEUED
  }

  public PairingResult {
    opponentIds = opponentIds == null ? List.of() : List.copyOf(opponentIds);
  }

  public static PairingResult matched(Room room, List<String> opponentIds) {
    return new PairingResult(Outcome.MATCHED, room, opponentIds, null);
  }

  public static PairingResult alreadyMatched(QueueStatus status) {
    return new PairingResult(Outcome.ALREADY_MATCHED, null, List.of(), status);
  }

  public static PairingResult queued(QueueStatus status) {
    return new PairingResult(Outcome.QUEUED, null, List.of(), status);
  }
}
