package com.example.arena.model;

public record QueueStatistics(
    long totalPlayers, double averageSkill, long averageWaitSeconds, long longestWaitSeconds) {

  public static QueueStatistics empty() {
    return new QueueStatistics(0, 0, 0, 0);
  }
}
