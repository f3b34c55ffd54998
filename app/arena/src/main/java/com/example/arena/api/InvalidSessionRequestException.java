package com.example.arena.api;

public class InvalidSessionRequestException extends RuntimeException {

  public InvalidSessionRequestException(String message) {
    super(message);
  }
}
