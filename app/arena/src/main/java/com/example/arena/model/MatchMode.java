package com.example.arena.model;

public enum MatchMode {
  QUICK("quick"),
  RANKED("ranked");

  private final String value;

  MatchMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static MatchMode fromValue(String value) {
    for (MatchMode mode : values()) {
      if (mode.value.equals(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("unsupported mode: " + value);
  }
}
