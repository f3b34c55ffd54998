package com.example.arena.model.event;

public record FinishEvent() implements GameEvent {

  @Override
  public GameEventKind kind() {
    return GameEventKind.FINISH;
  }
}
