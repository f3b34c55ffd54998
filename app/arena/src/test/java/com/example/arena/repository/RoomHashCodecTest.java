package com.example.arena.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.arena.model.FinishReason;
import com.example.arena.model.GameSettings;
import com.example.arena.model.Room;
import com.example.arena.model.RoomParticipant;
import com.example.arena.model.RoomStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RoomHashCodecTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-17T00:00:00Z");

  private final RoomHashCodec codec =
      new RoomHashCodec(new ObjectMapper().registerModule(new JavaTimeModule()));

  @Test
  void absentOptionalFieldsAreStoredAsEmptyStrings() {
    final Map<String, String> fields = codec.encode(room().build());

    assertThat(fields)
        .containsEntry("status", "waiting")
        .containsEntry("current_players", "2")
        .containsEntry("countdown_started_at", "")
        .containsEntry("finish_reason", "")
        .doesNotContainKey("version");
    assertThat(fields.get("game_settings")).contains("\"perfect_score\":100");
  }

  @Test
  void decodeRestoresFinishedRoomWithVersion() {
    final Room finished =
        room()
            .status(RoomStatus.FINISHED)
            .startedAt(CREATED_AT.plusSeconds(10))
            .finishedAt(CREATED_AT.plusSeconds(70))
            .finishReason(FinishReason.FORFEIT)
            .build();
    final Map<Object, Object> raw = new HashMap<>(codec.encode(finished));
    raw.put("version", "7");

    final Room decoded = codec.decode(raw);

    assertThat(decoded.status()).isEqualTo(RoomStatus.FINISHED);
    assertThat(decoded.finishReason()).isEqualTo(FinishReason.FORFEIT);
    assertThat(decoded.finishedAt()).isEqualTo(CREATED_AT.plusSeconds(70));
    assertThat(decoded.countdownStartedAt()).isNull();
    assertThat(decoded.version()).isEqualTo(7);
    assertThat(decoded.participants()).isEqualTo(finished.participants());
    assertThat(decoded.gameSettings().perfectScore()).isEqualTo(100L);
  }

  @Test
  void corruptedParticipantsAreReported() {
    final Map<Object, Object> raw = new HashMap<>(codec.encode(room().build()));
    raw.put("participants", "[{");

    assertThatThrownBy(() -> codec.decode(raw))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("participants");
  }

  private static Room.RoomBuilder room() {
    return Room.builder()
        .id("room-1")
        .name("quiz night")
        .type("custom")
        .status(RoomStatus.WAITING)
        .maxPlayers(4)
        .creatorId("u1")
        .gameSettings(new GameSettings("quiz", 300, "hard", 100L, true))
        .participants(
            List.of(
                new RoomParticipant("u1", "alice", 1200, CREATED_AT, true, 40, true),
                new RoomParticipant("u2", null, 900, CREATED_AT.plusSeconds(3), false, 0, true)))
        .createdAt(CREATED_AT)
        .lastActivity(CREATED_AT.plusSeconds(3))
        .version(1);
  }
}
