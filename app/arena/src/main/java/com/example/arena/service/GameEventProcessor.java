/*
 * どこで: Arena サービス層
 * 何を: ルーム内ゲームイベントを解釈し、カウントダウン→開始→終了→後片付けの状態遷移を進める
 * なぜ: スコア更新・棄権・終了判定を 1 箇所に集め、終了時の精算を必ず 1 回の結果にまとめるため
 */
package com.example.arena.service;

import com.example.arena.api.ApiErrorCode;
import com.example.arena.api.InvalidSessionRequestException;
import com.example.arena.api.SessionAccessDeniedException;
import com.example.arena.api.SessionConflictException;
import com.example.arena.api.SessionNotFoundException;
import com.example.arena.config.SessionProperties;
import com.example.arena.model.FinishReason;
import com.example.arena.model.LeaveResult;
import com.example.arena.model.Room;
import com.example.arena.model.RoomMutation;
import com.example.arena.model.RoomParticipant;
import com.example.arena.model.RoomStatus;
import com.example.arena.model.ScoreMode;
import com.example.arena.model.SessionOutcome;
import com.example.arena.model.SettlementReport;
import com.example.arena.model.event.FinishEvent;
import com.example.arena.model.event.GameEvent;
import com.example.arena.model.event.HintEvent;
import com.example.arena.model.event.LeaveEvent;
import com.example.arena.model.event.ScoreEvent;
import com.example.arena.model.event.SurrenderEvent;
import com.example.arena.model.event.TimerEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

@Service
public class GameEventProcessor {

  private static final Logger logger = LoggerFactory.getLogger(GameEventProcessor.class);
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final SessionStore sessionStore;
  private final SessionSettlementService settlementService;
  private final StandingsCalculator standingsCalculator;
  private final SessionEventPublisher eventPublisher;
  private final TaskScheduler taskScheduler;
  private final SessionProperties properties;
  private final SessionMetrics metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final Clock clock;

  public GameEventProcessor(
      SessionStore sessionStore,
      SessionSettlementService settlementService,
      StandingsCalculator standingsCalculator,
      SessionEventPublisher eventPublisher,
      TaskScheduler taskScheduler,
      SessionProperties properties,
      SessionMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock) {
    this.sessionStore = sessionStore;
    this.settlementService = settlementService;
    this.standingsCalculator = standingsCalculator;
    this.eventPublisher = eventPublisher;
    this.taskScheduler = taskScheduler;
    this.properties = properties;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * 参加者からのゲームイベントを 1 件処理し、処理後のルームを返す。
   *
   * <p>退出でルームが消えた場合は削除直前のルームを返す。
   */
  public Room handle(String sessionId, String userId, GameEvent event) {
    if (event == null) {
      throw new InvalidSessionRequestException("event is required");
    }
    final Room room = sessionStore.get(sessionId);
    if (!room.hasParticipant(userId)) {
      throw SessionAccessDeniedException.notParticipant(sessionId);
    }
    final Room result;
    if (event instanceof ScoreEvent score) {
      result = applyScore(sessionId, userId, score);
    } else if (event instanceof TimerEvent timer) {
      result = broadcastTimer(room, userId, timer);
    } else if (event instanceof HintEvent hint) {
      result = broadcastHint(room, userId, hint);
    } else if (event instanceof SurrenderEvent) {
      result = surrender(sessionId, userId);
    } else if (event instanceof LeaveEvent) {
      result = leave(sessionId, userId).room();
    } else if (event instanceof FinishEvent) {
      result = finish(sessionId, FinishReason.EXPLICIT);
    } else {
      throw new InvalidSessionRequestException("unsupported event type");
    }
    appendToLog(sessionId, userId, event);
    return result;
  }

  /** カウントダウン開始を通知し、終了時刻に開始処理を予約する。CAS でカウントダウンを立てた呼び出し元だけが呼ぶ。 */
  public void scheduleStart(Room room) {
    if (room.countdownStartedAt() == null) {
      return;
    }
    final Instant startAt = room.countdownStartedAt().plus(properties.countdown());
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("countdown_seconds", properties.countdown().toSeconds());
    data.put("starts_at", startAt.toString());
    eventPublisher.publish("session-countdown", room.id(), null, data);
    taskScheduler.schedule(() -> runSafely("start", room.id(), () -> startGame(room.id())), startAt);
  }

  /**
   * カウントダウンが満了していれば PLAYING に進める。既に開始済み・取り消し済みなら何もしない。
   *
   * @return この呼び出しで開始した場合 true
   */
  public boolean startGame(String sessionId) {
    final Instant now = Instant.now(clock);
    final RoomMutation mutation =
        sessionStore.mutate(
            sessionId,
            room -> {
              if (room.status() != RoomStatus.WAITING
                  || !room.countdownRunning()
                  || !room.allReady()
                  || now.isBefore(room.countdownStartedAt().plus(properties.countdown()))) {
                return room;
              }
              return room.toBuilder().status(RoomStatus.PLAYING).startedAt(now).build();
            });
    if (!mutation.changed()) {
      return false;
    }
    final Room started = mutation.after();
    logger.info("session started sessionId={} players={}", sessionId, started.currentPlayers());
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("started_at", now.toString());
    data.put("players", started.currentPlayers());
    eventPublisher.publish("session-started", sessionId, null, data);
    return true;
  }

  /**
   * ルームを終了させて精算する。既に終了済みなら保存済みの状態から精算をやり直す（加算済みの参加者は二重加算しない）。
   */
  public Room finish(String sessionId, FinishReason reason) {
    final Instant now = Instant.now(clock);
    final RoomMutation mutation =
        sessionStore.mutate(
            sessionId,
            room -> {
              if (room.status() == RoomStatus.FINISHED) {
                return room;
              }
              if (room.status() != RoomStatus.PLAYING) {
                throw new SessionConflictException(
                    ApiErrorCode.SESSION_STATE_CONFLICT, "session has not started");
              }
              return room.toBuilder()
                  .status(RoomStatus.FINISHED)
                  .finishedAt(now)
                  .finishReason(reason)
                  .build();
            });
    final Room finished = mutation.after();
    if (mutation.changed()) {
      metrics.recordSessionFinished(finished.finishReason().name().toLowerCase(Locale.ROOT));
      logger.info(
          "session finished sessionId={} reason={} players={}",
          sessionId,
          finished.finishReason(),
          finished.currentPlayers());
    } else {
      logger.info("finish replayed for finished session sessionId={}", sessionId);
    }
    final SettlementReport report = settle(finished);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("status", finished.status().value());
    data.put("finish_reason", finished.finishReason().name().toLowerCase(Locale.ROOT));
    data.put("first_settlement", report.firstSettlement());
    eventPublisher.publish("session-updated", sessionId, null, data);
    scheduleCleanup(sessionId);
    return finished;
  }

  /** 終了済みルームを削除する。未精算なら先に精算する。 */
  public boolean cleanupFinished(String sessionId) {
    final Optional<Room> room = sessionStore.find(sessionId);
    if (room.isEmpty() || room.get().status() != RoomStatus.FINISHED) {
      return false;
    }
    if (!settlementService.isSettled(sessionId)) {
      settle(room.get());
    }
    sessionStore.remove(sessionId);
    logger.info("finished session cleaned up sessionId={}", sessionId);
    eventPublisher.publish("session-deleted", sessionId, null, Map.of("reason", "finished"));
    return true;
  }

  /**
   * 退出。プレイ中なら参加者を非アクティブにして棄権扱いとし、待機中ならルームから外す。
   */
  public LeaveResult leave(String sessionId, String userId) {
    final Room room = sessionStore.get(sessionId);
    if (!room.hasParticipant(userId)) {
      throw SessionAccessDeniedException.notParticipant(sessionId);
    }
    if (room.status() != RoomStatus.WAITING) {
      return leaveStarted(room, sessionId, userId);
    }
    final LeaveResult result = sessionStore.removeParticipant(sessionId, userId);
    if (!result.removed()) {
      // 読み取り後にカウントダウンが満了して開始された
      return leaveStarted(result.room(), sessionId, userId);
    }
    if (result.deleted()) {
      eventPublisher.publish("session-deleted", sessionId, userId, Map.of("reason", "empty"));
      return result;
    }
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("players", result.room().currentPlayers());
    data.put("creator", result.room().creatorId());
    data.put("creator_changed", result.creatorChanged());
    eventPublisher.publish("session-left", sessionId, userId, data);
    return result;
  }

  private LeaveResult leaveStarted(Room room, String sessionId, String userId) {
    if (room.status() == RoomStatus.FINISHED) {
      throw new SessionConflictException(
          ApiErrorCode.SESSION_STATE_CONFLICT, "session has already finished");
    }
    return new LeaveResult(deactivate(sessionId, userId, "session-left"), false, false, false);
  }

  public SettlementReport settle(Room finished) {
    final SessionOutcome outcome = standingsCalculator.outcome(finished);
    return settlementService.settle(outcome);
  }

  private Room surrender(String sessionId, String userId) {
    final Room room = sessionStore.get(sessionId);
    if (room.status() != RoomStatus.PLAYING) {
      throw new SessionConflictException(
          ApiErrorCode.SESSION_STATE_CONFLICT, "surrender is allowed only while playing");
    }
    return deactivate(sessionId, userId, "participant-surrendered");
  }

  private Room deactivate(String sessionId, String userId, String eventType) {
    final RoomMutation mutation =
        sessionStore.mutate(
            sessionId,
            room -> {
              if (room.status() != RoomStatus.PLAYING) {
                throw new SessionConflictException(
                    ApiErrorCode.SESSION_STATE_CONFLICT, "session is not playing");
              }
              final RoomParticipant participant =
                  room.participant(userId)
                      .orElseThrow(() -> SessionAccessDeniedException.notParticipant(sessionId));
              if (!participant.active()) {
                return room;
              }
              return room.withParticipantReplaced(participant.withActive(false));
            });
    final Room after = mutation.after();
    if (mutation.changed()) {
      final Map<String, Object> data = new LinkedHashMap<>();
      data.put("active_players", after.activeParticipants().size());
      eventPublisher.publish(eventType, sessionId, userId, data);
    }
    if (after.activeParticipants().size() <= 1) {
      return finish(sessionId, FinishReason.FORFEIT);
    }
    return after;
  }

  private Room applyScore(String sessionId, String userId, ScoreEvent event) {
    if (event.points() < 0) {
      throw new InvalidSessionRequestException("points must be >= 0");
    }
    final RoomMutation mutation =
        sessionStore.mutate(
            sessionId,
            room -> {
              if (room.status() != RoomStatus.PLAYING) {
                throw new SessionConflictException(
                    ApiErrorCode.SESSION_STATE_CONFLICT, "score is accepted only while playing");
              }
              final RoomParticipant participant =
                  room.participant(userId)
                      .orElseThrow(() -> SessionAccessDeniedException.notParticipant(sessionId));
              if (!participant.active()) {
                throw new SessionConflictException(
                    ApiErrorCode.SESSION_STATE_CONFLICT, "participant is no longer active");
              }
              final long next =
                  event.mode() == ScoreMode.SET_MAX
                      ? Math.max(participant.score(), event.points())
                      : participant.score() + event.points();
              if (next == participant.score()) {
                return room;
              }
              return room.withParticipantReplaced(participant.withScore(next));
            });
    final Room after = mutation.after();
    final long score = after.participant(userId).map(RoomParticipant::score).orElse(0L);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("score", score);
    data.put("points", event.points());
    data.put("mode", event.mode().name());
    data.put("changed", mutation.changed());
    if (event.reason() != null) {
      data.put("reason", event.reason());
    }
    eventPublisher.publish("score-updated", sessionId, userId, data);
    return after;
  }

  private Room broadcastTimer(Room room, String userId, TimerEvent event) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("time_remaining", event.timeRemaining());
    data.put("total_time", event.totalTime());
    eventPublisher.publish("timer-updated", room.id(), userId, data);
    return room;
  }

  private Room broadcastHint(Room room, String userId, HintEvent event) {
    final String hintType =
        event.hintType() == null || event.hintType().isBlank() ? "general" : event.hintType();
    eventPublisher.publish("hint-used", room.id(), userId, Map.of("hint_type", hintType));
    return room;
  }

  private void appendToLog(String sessionId, String userId, GameEvent event) {
    final Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("type", event.kind().value());
    entry.put("user_id", userId);
    entry.put("occurred_at", Instant.now(clock).toString());
    entry.put("data", objectMapper.convertValue(event, MAP_TYPE));
    try {
      sessionStore.appendEvent(sessionId, entry);
    } catch (RuntimeException ex) {
      // ログは補助情報のため、追記失敗でイベント処理自体は失敗させない
      logger.warn("game event log append failed sessionId={}", sessionId, ex);
      metrics.recordDependencyError("event_log");
    }
  }

  private void scheduleCleanup(String sessionId) {
    final Instant at = Instant.now(clock).plus(properties.finishCleanupDelay());
    taskScheduler.schedule(
        () -> runSafely("cleanup", sessionId, () -> cleanupFinished(sessionId)), at);
  }

  private void runSafely(String task, String sessionId, Runnable action) {
    try {
      action.run();
    } catch (SessionNotFoundException ex) {
      logger.debug("scheduled {} skipped; session is gone sessionId={}", task, sessionId);
    } catch (RuntimeException ex) {
      // 取りこぼしは RoomSweepWorker が拾い直す
      logger.warn("scheduled {} failed sessionId={}", task, sessionId, ex);
      metrics.recordDependencyError("scheduled_" + task);
    }
  }
}
