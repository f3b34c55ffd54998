package com.example.arena.api.response;

import com.example.arena.model.QueueStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueStatusResponse(
    String state,
    long position,
    long totalInQueue,
    long waitSeconds,
    int skillLevel,
    String sessionId) {

  public static QueueStatusResponse from(QueueStatus status) {
    return new QueueStatusResponse(
        status.state().name().toLowerCase(Locale.ROOT),
        status.position(),
        status.totalInQueue(),
        status.waitSeconds(),
        status.skillLevel(),
        status.sessionId());
  }
}
