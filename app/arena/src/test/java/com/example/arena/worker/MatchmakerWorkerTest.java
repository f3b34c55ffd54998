package com.example.arena.worker;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.arena.config.MatchmakingProperties;
import com.example.arena.model.QueueStatistics;
import com.example.arena.service.MatchQueue;
import com.example.arena.service.SessionMetrics;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

class MatchmakerWorkerTest {

  private static final MatchmakingProperties PROPERTIES =
      new MatchmakingProperties(
          Duration.ofMinutes(10),
          Duration.ofMinutes(5),
          Duration.ofMinutes(2),
          300,
          100,
          1000,
          5000,
          3,
          5,
          100,
          Duration.ofSeconds(600),
          Duration.ofSeconds(2),
          true);

  private MatchQueue matchQueue;
  private SessionMetrics metrics;
  private MatchmakerWorker worker;

  @BeforeEach
  void setUp() {
    matchQueue = Mockito.mock(MatchQueue.class);
    metrics = Mockito.mock(SessionMetrics.class);
    worker = new MatchmakerWorker(matchQueue, PROPERTIES, metrics);
  }

  @Test
  void expiresThenPublishesGaugesThenPairs() {
    when(matchQueue.cleanupExpired(Duration.ofMinutes(5))).thenReturn(1);
    when(matchQueue.statistics()).thenReturn(new QueueStatistics(3, 1100.0, 20, 45));
    when(matchQueue.matchWaiting()).thenReturn(1);

    worker.run();

    final InOrder order = inOrder(matchQueue, metrics);
    order.verify(matchQueue).cleanupExpired(Duration.ofMinutes(5));
    order.verify(matchQueue).statistics();
    order.verify(metrics).updateQueueDepth(3);
    order.verify(metrics).updateOldestWait(45);
    order.verify(matchQueue).matchWaiting();
  }

  @Test
  void singleWaitingPlayerSkipsPairing() {
    when(matchQueue.statistics()).thenReturn(new QueueStatistics(1, 1000.0, 5, 5));

    worker.run();

    verify(metrics).updateQueueDepth(1);
    verify(matchQueue, never()).matchWaiting();
  }

  @Test
  void loopFailureIsCountedAndNotRethrown() {
    when(matchQueue.cleanupExpired(Duration.ofMinutes(5)))
        .thenThrow(new IllegalStateException("redis down"));

    worker.run();

    verify(metrics).recordDependencyError("worker_loop");
    verify(matchQueue, never()).matchWaiting();
  }
}
