package com.example.arena.api;

public class SessionNotFoundException extends RuntimeException {

  private final String sessionId;

  public SessionNotFoundException(String sessionId) {
    super("session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public String sessionId() {
    return sessionId;
  }
}
