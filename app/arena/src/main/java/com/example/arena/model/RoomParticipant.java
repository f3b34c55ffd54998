package com.example.arena.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.With;

@With
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RoomParticipant(
    String userId,
    String username,
    int skillLevel,
    Instant joinedAt,
    boolean ready,
    long score,
    boolean active) {

  public static RoomParticipant joining(TeamMember member, Instant joinedAt, boolean ready) {
    return new RoomParticipant(
        member.userId(), member.username(), member.skillLevel(), joinedAt, ready, 0L, true);
  }
}
