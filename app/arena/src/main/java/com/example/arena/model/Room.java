/*
 * どこで: Arena ドメインモデル
 * 何を: キャッシュ上のセッション（ルーム）1件を不変値として表す
 * なぜ: 変更を「読み取り→新しい値の計算→CAS 書き込み」に限定するため
 */
package com.example.arena.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Builder;

@Builder(toBuilder = true)
public record Room(
    String id,
    String name,
    String type,
    RoomStatus status,
    int maxPlayers,
    String creatorId,
    GameSettings gameSettings,
    List<RoomParticipant> participants,
    Instant createdAt,
    Instant lastActivity,
    Instant countdownStartedAt,
    Instant startedAt,
    Instant finishedAt,
    FinishReason finishReason,
    long version) {

  public Room {
    participants = participants == null ? List.of() : List.copyOf(participants);
    gameSettings = gameSettings == null ? GameSettings.empty() : gameSettings;
  }

  // participants から導出するため currentPlayers と常に一致する
  public int currentPlayers() {
    return participants.size();
  }

  public boolean isFull() {
    return participants.size() >= maxPlayers;
  }

  public boolean countdownRunning() {
    return countdownStartedAt != null;
  }

  public boolean hasParticipant(String userId) {
    return participant(userId).isPresent();
  }

  public Optional<RoomParticipant> participant(String userId) {
    return participants.stream().filter(p -> p.userId().equals(userId)).findFirst();
  }

  public boolean allReady() {
    return participants.size() >= 2 && participants.stream().allMatch(RoomParticipant::ready);
  }

  public List<RoomParticipant> activeParticipants() {
    return participants.stream().filter(RoomParticipant::active).toList();
  }

  public Room withParticipantReplaced(RoomParticipant updated) {
    final List<RoomParticipant> next = new ArrayList<>(participants.size());
    for (RoomParticipant p : participants) {
      next.add(p.userId().equals(updated.userId()) ? updated : p);
    }
    return toBuilder().participants(next).build();
  }

  public Room withParticipantAdded(RoomParticipant added) {
    final List<RoomParticipant> next = new ArrayList<>(participants);
    next.add(added);
    return toBuilder().participants(next).build();
  }

  /** 参加者を外し、作成者が抜けた場合は参加順で次の参加者へ所有権を移す。 */
  public Room withParticipantRemoved(String userId) {
    final List<RoomParticipant> next =
        participants.stream().filter(p -> !p.userId().equals(userId)).toList();
    String nextCreator = creatorId;
    if (userId.equals(creatorId) && !next.isEmpty()) {
      nextCreator = next.get(0).userId();
    }
    return toBuilder().participants(next).creatorId(nextCreator).build();
  }

  public Room touched(Instant now) {
    if (lastActivity != null && lastActivity.isAfter(now)) {
      return this;
    }
    return toBuilder().lastActivity(now).build();
  }
}
