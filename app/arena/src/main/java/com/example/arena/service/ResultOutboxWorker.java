package com.example.arena.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnExpression("${arena.outbox.enabled:true} and ${nats.enabled:true}")
@RequiredArgsConstructor
public class ResultOutboxWorker {

  private static final Logger logger = LoggerFactory.getLogger(ResultOutboxWorker.class);

  private final ResultOutboxPublisher publisher;
  private final SessionMetrics metrics;

  @Scheduled(fixedDelayString = "${arena.outbox.poll-interval}")
  public void run() {
    try {
      publisher.publishPendingBatch();
    } catch (RuntimeException ex) {
      logger.warn("outbox worker loop failed", ex);
      metrics.recordDependencyError("outbox_loop");
    }
  }
}
