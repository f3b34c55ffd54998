package com.example.arena.api;

public class SessionAccessDeniedException extends RuntimeException {

  private final ApiErrorCode code;

  public SessionAccessDeniedException(ApiErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public static SessionAccessDeniedException notParticipant(String sessionId) {
    return new SessionAccessDeniedException(
        ApiErrorCode.NOT_A_PARTICIPANT, "user is not a participant of session " + sessionId);
  }

  public ApiErrorCode code() {
    return code;
  }
}
