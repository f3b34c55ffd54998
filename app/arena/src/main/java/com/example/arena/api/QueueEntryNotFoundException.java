package com.example.arena.api;

public class QueueEntryNotFoundException extends RuntimeException {

  public QueueEntryNotFoundException(String userId) {
    super("queue entry not found for user: " + userId);
  }
}
