/*
 * どこで: Arena API レスポンス DTO
 * 何を: ルーム 1 件の応答を定義する
 * なぜ: キャッシュ上の内部表現（version 以外のキー構造）を応答に出さないため
 */
package com.example.arena.api.response;

import com.example.arena.model.GameSettings;
import com.example.arena.model.Room;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionResponse(
    String id,
    String name,
    String type,
    String status,
    int maxPlayers,
    int currentPlayers,
    String creatorId,
    GameSettings gameSettings,
    List<ParticipantResponse> participants,
    boolean countdownRunning,
    String countdownStartedAt,
    String createdAt,
    String startedAt,
    String finishedAt,
    String finishReason,
    long version) {

  public static SessionResponse from(Room room) {
    return new SessionResponse(
        room.id(),
        room.name(),
        room.type(),
        room.status().value(),
        room.maxPlayers(),
        room.currentPlayers(),
        room.creatorId(),
        room.gameSettings(),
        room.participants().stream().map(ParticipantResponse::from).toList(),
        room.countdownRunning(),
        Instants.format(room.countdownStartedAt()),
        Instants.format(room.createdAt()),
        Instants.format(room.startedAt()),
        Instants.format(room.finishedAt()),
        room.finishReason() == null ? null : room.finishReason().name().toLowerCase(Locale.ROOT),
        room.version());
  }
}
