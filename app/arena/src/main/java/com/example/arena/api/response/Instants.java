package com.example.arena.api.response;

import java.time.Instant;

final class Instants {

  private Instants() {}

  static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
