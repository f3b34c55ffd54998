package com.example.arena.model;

public enum GameResult {
  WIN("win"),
  LOSS("loss"),
  DRAW("draw");

  private final String value;

  GameResult(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
