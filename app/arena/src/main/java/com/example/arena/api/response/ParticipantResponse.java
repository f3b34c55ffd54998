package com.example.arena.api.response;

import com.example.arena.model.RoomParticipant;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParticipantResponse(
    String userId,
    String username,
    int skillLevel,
    String joinedAt,
    boolean ready,
    long score,
    boolean active) {

  public static ParticipantResponse from(RoomParticipant participant) {
    return new ParticipantResponse(
        participant.userId(),
        participant.username(),
        participant.skillLevel(),
        Instants.format(participant.joinedAt()),
        participant.ready(),
        participant.score(),
        participant.active());
  }
}
