package com.example.arena.api;

/** 満員・二重参加・状態不一致など、状態を変えずに拒否した要求。 */
public class SessionConflictException extends RuntimeException {

  private final ApiErrorCode code;

  public SessionConflictException(ApiErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ApiErrorCode code() {
    return code;
  }
}
