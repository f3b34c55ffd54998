package com.example.arena.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.arena.config.SessionProperties;
import com.example.arena.model.FinishReason;
import com.example.arena.model.Room;
import com.example.arena.model.RoomStatus;
import com.example.arena.service.GameEventProcessor;
import com.example.arena.service.SessionMetrics;
import com.example.arena.service.SessionStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class RoomSweepWorkerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  private SessionStore sessionStore;
  private GameEventProcessor gameEventProcessor;
  private SessionMetrics metrics;
  private RoomSweepWorker worker;

  @BeforeEach
  void setUp() {
    sessionStore = Mockito.mock(SessionStore.class);
    gameEventProcessor = Mockito.mock(GameEventProcessor.class);
    metrics = Mockito.mock(SessionMetrics.class);
    final SessionProperties properties =
        new SessionProperties(
            Duration.ofMinutes(30),
            Duration.ofMinutes(60),
            Duration.ofMinutes(5),
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            3,
            5,
            10,
            50,
            100,
            10,
            100,
            Duration.ofSeconds(5),
            true);
    worker =
        new RoomSweepWorker(
            sessionStore,
            gameEventProcessor,
            properties,
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void dropsStaleIndexStartsOverdueCountdownAndCleansFinished() {
    when(sessionStore.activeRoomIds()).thenReturn(Set.of("gone", "counting", "done", "fresh"));
    when(sessionStore.find("gone")).thenReturn(Optional.empty());
    when(sessionStore.find("counting"))
        .thenReturn(
            Optional.of(
                room("counting", RoomStatus.WAITING)
                    .countdownStartedAt(FIXED_NOW.minusSeconds(6))
                    .build()));
    when(sessionStore.find("done"))
        .thenReturn(
            Optional.of(
                room("done", RoomStatus.FINISHED)
                    .finishedAt(FIXED_NOW.minusSeconds(5))
                    .finishReason(FinishReason.EXPLICIT)
                    .build()));
    when(sessionStore.find("fresh"))
        .thenReturn(
            Optional.of(
                room("fresh", RoomStatus.WAITING)
                    .countdownStartedAt(FIXED_NOW.minusSeconds(2))
                    .build()));
    when(gameEventProcessor.startGame("counting")).thenReturn(true);
    when(gameEventProcessor.cleanupFinished("done")).thenReturn(true);

    final RoomSweepWorker.SweepResult result = worker.sweep();

    assertThat(result).isEqualTo(new RoomSweepWorker.SweepResult(1, 1, 1));
    verify(sessionStore).dropIndexEntries("gone");
    verify(gameEventProcessor, never()).startGame("fresh");
  }

  @Test
  void failingRoomDoesNotStopSweep() {
    when(sessionStore.activeRoomIds()).thenReturn(new LinkedHashSet<>(List.of("broken", "gone")));
    when(sessionStore.find("broken")).thenThrow(new IllegalStateException("decode failed"));
    when(sessionStore.find("gone")).thenReturn(Optional.empty());

    final RoomSweepWorker.SweepResult result = worker.sweep();

    assertThat(result.dropped()).isEqualTo(1);
    verify(metrics).recordDependencyError("sweep_room");
  }

  @Test
  void listingFailureIsCounted() {
    when(sessionStore.activeRoomIds()).thenThrow(new IllegalStateException("redis down"));

    worker.run();

    verify(metrics).recordDependencyError("sweep_loop");
  }

  private static Room.RoomBuilder room(String id, RoomStatus status) {
    return Room.builder()
        .id(id)
        .name(id)
        .type("custom")
        .status(status)
        .maxPlayers(4)
        .creatorId("u1")
        .createdAt(FIXED_NOW.minusSeconds(60))
        .lastActivity(FIXED_NOW.minusSeconds(60))
        .version(1);
  }
}
