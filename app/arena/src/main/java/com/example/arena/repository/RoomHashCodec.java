package com.example.arena.repository;

import com.example.arena.model.FinishReason;
import com.example.arena.model.GameSettings;
import com.example.arena.model.Room;
import com.example.arena.model.RoomParticipant;
import com.example.arena.model.RoomStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Room と room:&lt;id&gt; hash のフィールドを相互変換する。null は空文字で保存する。 */
@Component
public class RoomHashCodec {

  static final String FIELD_ID = "id";
  static final String FIELD_NAME = "name";
  static final String FIELD_TYPE = "type";
  static final String FIELD_STATUS = "status";
  static final String FIELD_MAX_PLAYERS = "max_players";
  static final String FIELD_CURRENT_PLAYERS = "current_players";
  static final String FIELD_CREATOR = "creator";
  static final String FIELD_GAME_SETTINGS = "game_settings";
  static final String FIELD_PARTICIPANTS = "participants";
  static final String FIELD_CREATED_AT = "created_at";
  static final String FIELD_LAST_ACTIVITY = "last_activity";
  static final String FIELD_COUNTDOWN_STARTED_AT = "countdown_started_at";
  static final String FIELD_STARTED_AT = "started_at";
  static final String FIELD_FINISHED_AT = "finished_at";
  static final String FIELD_FINISH_REASON = "finish_reason";
  static final String FIELD_VERSION = "version";

  private static final TypeReference<List<RoomParticipant>> PARTICIPANTS_TYPE =
      new TypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public RoomHashCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** version を除いた書き込み対象フィールド。順序は固定。 */
  public Map<String, String> encode(Room room) {
    final Map<String, String> fields = new LinkedHashMap<>();
    fields.put(FIELD_ID, room.id());
    fields.put(FIELD_NAME, nullToEmpty(room.name()));
    fields.put(FIELD_TYPE, nullToEmpty(room.type()));
    fields.put(FIELD_STATUS, room.status().value());
    fields.put(FIELD_MAX_PLAYERS, Integer.toString(room.maxPlayers()));
    fields.put(FIELD_CURRENT_PLAYERS, Integer.toString(room.currentPlayers()));
    fields.put(FIELD_CREATOR, nullToEmpty(room.creatorId()));
    fields.put(FIELD_GAME_SETTINGS, writeJson(room.gameSettings()));
    fields.put(FIELD_PARTICIPANTS, writeJson(room.participants()));
    fields.put(FIELD_CREATED_AT, instantToString(room.createdAt()));
    fields.put(FIELD_LAST_ACTIVITY, instantToString(room.lastActivity()));
    fields.put(FIELD_COUNTDOWN_STARTED_AT, instantToString(room.countdownStartedAt()));
    fields.put(FIELD_STARTED_AT, instantToString(room.startedAt()));
    fields.put(FIELD_FINISHED_AT, instantToString(room.finishedAt()));
    fields.put(
        FIELD_FINISH_REASON, room.finishReason() == null ? "" : room.finishReason().name());
    return fields;
  }

  public Room decode(Map<Object, Object> raw) {
    final Map<String, String> fields = normalizeFields(raw);
    return Room.builder()
        .id(fields.get(FIELD_ID))
        .name(emptyToNull(fields.get(FIELD_NAME)))
        .type(emptyToNull(fields.get(FIELD_TYPE)))
        .status(RoomStatus.fromValue(fields.get(FIELD_STATUS)))
        .maxPlayers(parseInt(fields.get(FIELD_MAX_PLAYERS)))
        .creatorId(emptyToNull(fields.get(FIELD_CREATOR)))
        .gameSettings(readJson(fields.get(FIELD_GAME_SETTINGS), GameSettings.class))
        .participants(readParticipants(fields.get(FIELD_PARTICIPANTS)))
        .createdAt(parseInstant(fields.get(FIELD_CREATED_AT)))
        .lastActivity(parseInstant(fields.get(FIELD_LAST_ACTIVITY)))
        .countdownStartedAt(parseInstant(fields.get(FIELD_COUNTDOWN_STARTED_AT)))
        .startedAt(parseInstant(fields.get(FIELD_STARTED_AT)))
        .finishedAt(parseInstant(fields.get(FIELD_FINISHED_AT)))
        .finishReason(parseFinishReason(fields.get(FIELD_FINISH_REASON)))
        .version(parseLong(fields.get(FIELD_VERSION)))
        .build();
  }

  private List<RoomParticipant> readParticipants(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, PARTICIPANTS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("room participants are corrupted", ex);
    }
  }

  private <T> T readJson(String json, Class<T> type) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("room field is corrupted type=" + type.getSimpleName(), ex);
    }
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("room serialization failed", ex);
    }
  }

  private Map<String, String> normalizeFields(Map<Object, Object> raw) {
    final Map<String, String> map = new HashMap<>();
    for (Map.Entry<Object, Object> e : raw.entrySet()) {
      map.put(
          String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
    }
    return map;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  private static String instantToString(Instant value) {
    return value == null ? "" : value.toString();
  }

  private static Instant parseInstant(String value) {
    return value == null || value.isBlank() ? null : Instant.parse(value);
  }

  private static FinishReason parseFinishReason(String value) {
    return value == null || value.isBlank() ? null : FinishReason.valueOf(value);
  }

  private static int parseInt(String value) {
    return value == null || value.isBlank() ? 0 : Integer.parseInt(value);
  }

  private static long parseLong(String value) {
    return value == null || value.isBlank() ? 0L : Long.parseLong(value);
  }
}
