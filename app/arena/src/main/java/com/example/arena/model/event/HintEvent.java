package com.example.arena.model.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HintEvent(String hintType) implements GameEvent {

  @Override
  public GameEventKind kind() {
    return GameEventKind.HINT;
  }
}
