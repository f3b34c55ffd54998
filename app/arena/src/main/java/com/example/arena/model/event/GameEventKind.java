package com.example.arena.model.event;

public enum GameEventKind {
  SCORE("score"),
  TIMER("timer"),
  HINT("hint"),
  SURRENDER("surrender"),
  LEAVE("leave"),
  FINISH("finish");

  private final String value;

  GameEventKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
