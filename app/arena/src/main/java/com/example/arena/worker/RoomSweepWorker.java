/*
 * どこで: Arena ワーカー
 * 何を: 期限切れルームのインデックス掃除、取りこぼしたカウントダウンの開始、終了済みルームの削除を行う
 * なぜ: インプロセスのタイマーは再起動で失われるため、キャッシュの状態から定期的に追いつかせる
 */
package com.example.arena.worker;

import com.example.arena.config.SessionProperties;
import com.example.arena.model.Room;
import com.example.arena.model.RoomStatus;
import com.example.arena.service.GameEventProcessor;
import com.example.arena.service.SessionMetrics;
import com.example.arena.service.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "arena.session.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RoomSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(RoomSweepWorker.class);

  private final SessionStore sessionStore;
  private final GameEventProcessor gameEventProcessor;
  private final SessionProperties properties;
  private final SessionMetrics metrics;
  private final Clock clock;

  public RoomSweepWorker(
      SessionStore sessionStore,
      GameEventProcessor gameEventProcessor,
      SessionProperties properties,
      SessionMetrics metrics,
      Clock clock) {
    this.sessionStore = sessionStore;
    this.gameEventProcessor = gameEventProcessor;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${arena.session.sweep-interval}")
  public void run() {
    try {
      final SweepResult result = sweep();
      if (result.total() > 0) {
        logger.info(
            "room sweep done dropped={} started={} cleaned={}",
            result.dropped(),
            result.started(),
            result.cleaned());
      }
    } catch (RuntimeException ex) {
      logger.warn("room sweep loop failed", ex);
      metrics.recordDependencyError("sweep_loop");
    }
  }

  SweepResult sweep() {
    final Instant now = Instant.now(clock);
    int dropped = 0;
    int started = 0;
    int cleaned = 0;
    for (String roomId : sessionStore.activeRoomIds()) {
      try {
        final Optional<Room> room = sessionStore.find(roomId);
        if (room.isEmpty()) {
          sessionStore.dropIndexEntries(roomId);
          dropped++;
        } else if (isCountdownOverdue(room.get(), now)) {
          if (gameEventProcessor.startGame(roomId)) {
            started++;
          }
        } else if (isCleanupOverdue(room.get(), now)) {
          if (gameEventProcessor.cleanupFinished(roomId)) {
            cleaned++;
          }
        }
      } catch (RuntimeException ex) {
        logger.warn("room sweep failed sessionId={}", roomId, ex);
        metrics.recordDependencyError("sweep_room");
      }
    }
    return new SweepResult(dropped, started, cleaned);
  }

  private boolean isCountdownOverdue(Room room, Instant now) {
    return room.status() == RoomStatus.WAITING
        && room.countdownRunning()
        && !now.isBefore(room.countdownStartedAt().plus(properties.countdown()));
  }

  private boolean isCleanupOverdue(Room room, Instant now) {
    return room.status() == RoomStatus.FINISHED
        && room.finishedAt() != null
        && !now.isBefore(room.finishedAt().plus(properties.finishCleanupDelay()));
  }

  record SweepResult(int dropped, int started, int cleaned) {

    int total() {
      return dropped + started + cleaned;
    }
  }
}
