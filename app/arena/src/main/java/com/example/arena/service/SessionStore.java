/*
 * どこで: Arena サービス層
 * 何を: キャッシュ上のルームを作成・更新・参加/退出・一覧する
 * なぜ: すべての変更を version 付き CAS で行い、並行リクエストで更新を失わないため
 */
package com.example.arena.service;

import com.example.arena.api.ApiErrorCode;
import com.example.arena.api.InvalidSessionRequestException;
import com.example.arena.api.SessionAccessDeniedException;
import com.example.arena.api.SessionConflictException;
import com.example.arena.api.SessionNotFoundException;
import com.example.arena.config.SessionProperties;
import com.example.arena.model.CreateRoomCommand;
import com.example.arena.model.LeaveResult;
import com.example.arena.model.ReadyResult;
import com.example.arena.model.Room;
import com.example.arena.model.RoomMutation;
import com.example.arena.model.RoomParticipant;
import com.example.arena.model.RoomStatus;
import com.example.arena.model.RoomUpdate;
import com.example.arena.model.TeamMember;
import com.example.arena.repository.CasOutcome;
import com.example.arena.repository.RoomRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SessionStore {

  private static final Logger logger = LoggerFactory.getLogger(SessionStore.class);
  private static final String DEFAULT_TYPE = "custom";

  private final RoomRepository roomRepository;
  private final SessionProperties properties;
  private final SessionMetrics metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final Clock clock;

  public SessionStore(
      RoomRepository roomRepository,
      SessionProperties properties,
      SessionMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock) {
    this.roomRepository = roomRepository;
    this.properties = properties;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public Room create(CreateRoomCommand command) {
    final String name = validateName(command.name());
    final int maxPlayers = resolveMaxPlayers(command.maxPlayers());
    final List<TeamMember> members = validateMembers(command.members(), maxPlayers);
    final Instant now = Instant.now(clock);

    final List<RoomParticipant> participants = new ArrayList<>(members.size());
    for (TeamMember member : members) {
      participants.add(RoomParticipant.joining(member, now, command.readyAll()));
    }
    final boolean countdown = command.readyAll() && participants.size() >= 2;
    final Room room =
        Room.builder()
            .id(command.roomId() == null ? UUID.randomUUID().toString() : command.roomId())
            .name(name)
            .type(command.type() == null || command.type().isBlank() ? DEFAULT_TYPE : command.type())
            .status(RoomStatus.WAITING)
            .maxPlayers(maxPlayers)
            .creatorId(members.get(0).userId())
            .gameSettings(command.gameSettings())
            .participants(participants)
            .createdAt(now)
            .lastActivity(now)
            .countdownStartedAt(countdown ? now : null)
            .version(1)
            .build();
    if (!roomRepository.create(room, ttlFor(RoomStatus.WAITING))) {
      throw new IllegalStateException("room id collision: " + room.id());
    }
    logger.info(
        "session created sessionId={} creator={} players={} countdown={}",
        room.id(),
        room.creatorId(),
        room.currentPlayers(),
        countdown);
    return room;
  }

  public Optional<Room> find(String roomId) {
    return roomRepository.findById(roomId);
  }

  public Room get(String roomId) {
    return roomRepository.findById(roomId).orElseThrow(() -> new SessionNotFoundException(roomId));
  }

  /**
   * 最新値に change を適用して CAS で書き込む。version 不一致なら読み直して再試行する。
   *
   * <p>change が引数と同じインスタンスを返した場合は書き込まない。change 内で投げた例外はそのまま伝播する。
   */
  public RoomMutation mutate(String roomId, UnaryOperator<Room> change) {
    for (int attempt = 0; attempt < properties.casMaxAttempts(); attempt++) {
      final Room current = get(roomId);
      final Room next = change.apply(current);
      if (next == current) {
        return new RoomMutation(current, current);
      }
      final Optional<Room> written = tryWrite(current, next);
      if (written.isPresent()) {
        return new RoomMutation(current, written.get());
      }
    }
    throw concurrentModification(roomId);
  }

  public Room update(String roomId, String userId, RoomUpdate update) {
    if (update == null || update.isEmpty()) {
      throw new InvalidSessionRequestException("no updatable field is given");
    }
    final String name = update.name() == null ? null : validateName(update.name());
    if (update.maxPlayers() != null) {
      resolveMaxPlayers(update.maxPlayers());
    }
    return mutate(
            roomId,
            room -> {
              requireCreator(room, userId);
              if (room.status() != RoomStatus.WAITING) {
                throw new SessionConflictException(
                    ApiErrorCode.SESSION_STATE_CONFLICT, "session can be edited only while waiting");
              }
              final Room.RoomBuilder builder = room.toBuilder();
              if (name != null) {
                builder.name(name);
              }
              if (update.type() != null && !update.type().isBlank()) {
                builder.type(update.type());
              }
              if (update.maxPlayers() != null) {
                if (update.maxPlayers() < room.currentPlayers()) {
                  throw new InvalidSessionRequestException(
                      "max_players must not be below current players");
                }
                builder.maxPlayers(update.maxPlayers());
              }
              if (update.gameSettings() != null) {
                builder.gameSettings(update.gameSettings());
              }
              return builder.build();
            })
        .after();
  }

  /** 作成者による明示削除。 */
  public Room delete(String roomId, String userId) {
    final Room room = get(roomId);
    requireCreator(room, userId);
    if (!roomRepository.delete(roomId, room.version())) {
      throw concurrentModification(roomId);
    }
    logger.info("session deleted by creator sessionId={} userId={}", roomId, userId);
    return room;
  }

  /** 後片付け用の無条件削除。ルーム hash・インデックス・イベントログをまとめて消す。 */
  public void remove(String roomId) {
    roomRepository.delete(roomId, null);
  }

  public Room addParticipant(String roomId, TeamMember member) {
    if (member == null || member.userId() == null || member.userId().isBlank()) {
      throw new InvalidSessionRequestException("userId is required");
    }
    return mutate(
            roomId,
            room -> {
              if (room.status() != RoomStatus.WAITING || room.countdownRunning()) {
                throw new SessionConflictException(
                    ApiErrorCode.SESSION_NOT_JOINABLE, "session is not accepting players");
              }
              if (room.hasParticipant(member.userId())) {
                throw new SessionConflictException(
                    ApiErrorCode.ALREADY_JOINED, "user already joined the session");
              }
              if (room.isFull()) {
                throw new SessionConflictException(ApiErrorCode.SESSION_FULL, "session is full");
              }
              return room.withParticipantAdded(
                  RoomParticipant.joining(member, Instant.now(clock), false));
            })
        .after();
  }

  /**
   * 待機中のルームから参加者を外す。最後の 1 名が抜けたらルームごと削除する。
   *
   * <p>読み取った時点で待機中でなければ何も書かずに {@link LeaveResult#notWaiting} を返す。
   * 書き込みは version の CAS なので、読み取り後に開始されたルームから外すことはない。
   */
  public LeaveResult removeParticipant(String roomId, String userId) {
    for (int attempt = 0; attempt < properties.casMaxAttempts(); attempt++) {
      final Room current = get(roomId);
      if (!current.hasParticipant(userId)) {
        throw SessionAccessDeniedException.notParticipant(roomId);
      }
      if (current.status() != RoomStatus.WAITING) {
        return LeaveResult.notWaiting(current);
      }
      Room next = current.withParticipantRemoved(userId);
      if (next.participants().isEmpty()) {
        if (roomRepository.delete(roomId, current.version())) {
          logger.info("last participant left; session deleted sessionId={}", roomId);
          return new LeaveResult(current, true, true, false);
        }
        metrics.recordCasConflict();
        continue;
      }
      if (next.countdownRunning() && !next.allReady()) {
        next = next.toBuilder().countdownStartedAt(null).build();
      }
      final Optional<Room> written = tryWrite(current, next);
      if (written.isPresent()) {
        final boolean creatorChanged = !current.creatorId().equals(written.get().creatorId());
        return new LeaveResult(written.get(), true, false, creatorChanged);
      }
    }
    throw concurrentModification(roomId);
  }

  /** 参加受付中（待機中・空きあり・カウントダウン前）のルームを新しい順に返す。 */
  public List<Room> listAvailable(String type, int limit) {
    final int capped = Math.max(1, Math.min(limit, properties.listLimitMax()));
    final List<Room> rooms = new ArrayList<>(capped);
    final Set<String> seen = new HashSet<>();
    long offset = 0;
    while (rooms.size() < capped) {
      final List<String> ids = roomRepository.findWaitingRoomIds(offset, capped);
      if (ids.isEmpty()) {
        break;
      }
      offset += ids.size();
      for (String id : ids) {
        if (!seen.add(id) || rooms.size() >= capped) {
          continue;
        }
        final Optional<Room> room = roomRepository.findById(id);
        if (room.isEmpty()) {
          roomRepository.removeFromIndexes(id);
          continue;
        }
        if (isAvailable(room.get(), type)) {
          rooms.add(room.get());
        }
      }
    }
    return rooms;
  }

  public ReadyResult updatePlayerReady(String roomId, String userId, boolean ready) {
    final RoomMutation mutation =
        mutate(
            roomId,
            room -> {
              final RoomParticipant participant =
                  room.participant(userId)
                      .orElseThrow(() -> SessionAccessDeniedException.notParticipant(roomId));
              if (room.status() != RoomStatus.WAITING) {
                throw new SessionConflictException(
                    ApiErrorCode.SESSION_STATE_CONFLICT, "ready can be changed only while waiting");
              }
              Room next = room;
              if (participant.ready() != ready) {
                next = room.withParticipantReplaced(participant.withReady(ready));
              }
              if (next.allReady() && !next.countdownRunning()) {
                next = next.toBuilder().countdownStartedAt(Instant.now(clock)).build();
              } else if (!next.allReady() && next.countdownRunning()) {
                next = next.toBuilder().countdownStartedAt(null).build();
              }
              return next;
            });
    final Room before = mutation.before();
    final Room after = mutation.after();
    final boolean started = !before.countdownRunning() && after.countdownRunning();
    final boolean cancelled = before.countdownRunning() && !after.countdownRunning();
    return new ReadyResult(after, after.allReady(), started, cancelled);
  }

  public void appendEvent(String roomId, Map<String, Object> event) {
    final String json;
    try {
      json = objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("game event serialization failed", ex);
    }
    if (!roomRepository.appendEvent(
        roomId, json, properties.eventLogSize(), ttlFor(RoomStatus.PLAYING))) {
      logger.debug("event log skipped for removed room roomId={}", roomId);
    }
  }

  public List<JsonNode> recentEvents(String roomId, int limit) {
    final int capped = Math.max(1, Math.min(limit, properties.eventLogSize()));
    final List<JsonNode> events = new ArrayList<>();
    for (String json : roomRepository.findRecentEvents(roomId, capped)) {
      try {
        events.add(objectMapper.readTree(json));
      } catch (JsonProcessingException ex) {
        logger.warn("skipping unreadable game event sessionId={}", roomId, ex);
      }
    }
    return events;
  }

  public Set<String> activeRoomIds() {
    return roomRepository.findActiveRoomIds();
  }

  public void dropIndexEntries(String roomId) {
    roomRepository.removeFromIndexes(roomId);
  }

  public Duration ttlFor(RoomStatus status) {
    return switch (status) {
      case WAITING -> properties.waitingTtl();
      case PLAYING -> properties.playingTtl();
      case FINISHED -> properties.finishedTtl();
    };
  }

  private Optional<Room> tryWrite(Room current, Room next) {
    if (!current.status().canTransitionTo(next.status())) {
      throw new SessionConflictException(
          ApiErrorCode.SESSION_STATE_CONFLICT,
          "session cannot move from " + current.status().value() + " to " + next.status().value());
    }
    final Room touched = next.touched(Instant.now(clock));
    final CasOutcome outcome =
        roomRepository.compareAndSet(touched, current.version(), ttlFor(touched.status()));
    if (outcome == CasOutcome.APPLIED) {
      return Optional.of(touched.toBuilder().version(current.version() + 1).build());
    }
    if (outcome == CasOutcome.NOT_FOUND) {
      throw new SessionNotFoundException(current.id());
    }
    metrics.recordCasConflict();
    logger.debug(
        "room version conflict sessionId={} version={}", current.id(), current.version());
    return Optional.empty();
  }

  private boolean isAvailable(Room room, String type) {
    if (room.status() != RoomStatus.WAITING || room.isFull() || room.countdownRunning()) {
      return false;
    }
    return type == null || type.isBlank() || type.equals(room.type());
  }

  private void requireCreator(Room room, String userId) {
    if (!room.creatorId().equals(userId)) {
      throw new SessionAccessDeniedException(
          ApiErrorCode.FORBIDDEN, "only the session creator can do this");
    }
  }

  private String validateName(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidSessionRequestException("name is required");
    }
    final String trimmed = name.trim();
    if (trimmed.length() > properties.nameMaxLength()) {
      throw new InvalidSessionRequestException(
          "name must be at most " + properties.nameMaxLength() + " characters");
    }
    return trimmed;
  }

  private int resolveMaxPlayers(Integer maxPlayers) {
    if (maxPlayers == null) {
      return properties.defaultMaxPlayers();
    }
    if (maxPlayers < 2 || maxPlayers > properties.maxPlayersLimit()) {
      throw new InvalidSessionRequestException(
          "max_players must be between 2 and " + properties.maxPlayersLimit());
    }
    return maxPlayers;
  }

  private List<TeamMember> validateMembers(List<TeamMember> members, int maxPlayers) {
    if (members.isEmpty()) {
      throw new InvalidSessionRequestException("session needs at least one participant");
    }
    if (members.size() > maxPlayers) {
      throw new InvalidSessionRequestException("participants exceed max_players");
    }
    final Set<String> ids = new HashSet<>();
    for (TeamMember member : members) {
      if (member.userId() == null || member.userId().isBlank()) {
        throw new InvalidSessionRequestException("userId is required");
      }
      if (!ids.add(member.userId())) {
        throw new InvalidSessionRequestException("duplicate participant " + member.userId());
      }
    }
    return members;
  }

  private SessionConflictException concurrentModification(String roomId) {
    logger.warn("room update gave up after retries sessionId={}", roomId);
    return new SessionConflictException(
        ApiErrorCode.CONCURRENT_MODIFICATION, "session was modified concurrently, retry");
  }
}
