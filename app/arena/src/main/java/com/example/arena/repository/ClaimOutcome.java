package com.example.arena.repository;

public enum ClaimOutcome {
  CLAIMED,
  /** 要求者自身が既にキューにいない（別のマッチングに確保された、または取消/期限切れ）。 */
  SELF_MISSING,
  OPPONENT_MISSING
}
