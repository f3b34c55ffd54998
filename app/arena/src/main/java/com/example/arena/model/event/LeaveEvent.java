package com.example.arena.model.event;

public record LeaveEvent() implements GameEvent {

  @Override
  public GameEventKind kind() {
    return GameEventKind.LEAVE;
  }
}
