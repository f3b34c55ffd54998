package com.example.arena.model.event;

import com.example.arena.model.ScoreMode;

/** mode 未指定は ADD として扱う。reason は "challenge-completed" などの表示用ラベル。 */
public record ScoreEvent(long points, ScoreMode mode, String reason) implements GameEvent {

  public ScoreEvent {
    mode = mode == null ? ScoreMode.ADD : mode;
  }

  @Override
  public GameEventKind kind() {
    return GameEventKind.SCORE;
  }
}
