package com.example.arena.model;

public enum FinishReason {
  EXPLICIT,
  FORFEIT
}
