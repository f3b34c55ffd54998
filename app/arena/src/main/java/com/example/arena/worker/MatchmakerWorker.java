package com.example.arena.worker;

import com.example.arena.config.MatchmakingProperties;
import com.example.arena.model.QueueStatistics;
import com.example.arena.service.MatchQueue;
import com.example.arena.service.SessionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 期限切れの待機を外し、残った待機者同士のペアリングを定期的にやり直す。 */
@Component
@ConditionalOnProperty(
    name = "arena.matchmaking.worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MatchmakerWorker {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakerWorker.class);

  private final MatchQueue matchQueue;
  private final MatchmakingProperties properties;
  private final SessionMetrics metrics;

  public MatchmakerWorker(
      MatchQueue matchQueue, MatchmakingProperties properties, SessionMetrics metrics) {
    this.matchQueue = matchQueue;
    this.properties = properties;
    this.metrics = metrics;
  }

  @Scheduled(fixedDelayString = "${arena.matchmaking.worker-poll-interval}")
  public void run() {
    try {
      final int expired = matchQueue.cleanupExpired(properties.maxWait());
      if (expired > 0) {
        logger.info("expired queue entries removed count={}", expired);
      }
      final QueueStatistics statistics = matchQueue.statistics();
      metrics.updateQueueDepth(statistics.totalPlayers());
      metrics.updateOldestWait(statistics.longestWaitSeconds());
      if (statistics.totalPlayers() < 2) {
        return;
      }
      final int matched = matchQueue.matchWaiting();
      if (matched > 0) {
        logger.info("background pairing created sessions count={}", matched);
      }
    } catch (RuntimeException ex) {
      logger.warn("matchmaker worker loop failed", ex);
      metrics.recordDependencyError("worker_loop");
    }
  }
}
