package com.example.arena.model.event;

public record SurrenderEvent() implements GameEvent {

  @Override
  public GameEventKind kind() {
    return GameEventKind.SURRENDER;
  }
}
