package com.example.arena.model;

public record QueueStatus(
    State state,
    long position,
    long totalInQueue,
    long waitSeconds,
    int skillLevel,
    String sessionId) {

  public enum State {
    QUEUED,
    MATCHED,
    NOT_QUEUED
  }

  public static QueueStatus notQueued(long totalInQueue) {
    return new QueueStatus(State.NOT_QUEUED, 0, totalInQueue, 0, 0, null);
  }

  public static QueueStatus matched(String sessionId) {
    return new QueueStatus(State.MATCHED, 0, 0, 0, 0, sessionId);
  }
}
