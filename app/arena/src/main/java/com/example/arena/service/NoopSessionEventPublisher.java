/*
 * どこで: Arena サービス層
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカルやテストで NATS なしでもサービスを起動できるようにするため
 */
package com.example.arena.service;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopSessionEventPublisher implements SessionEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopSessionEventPublisher.class);

  @Override
  public void publish(String eventType, String sessionId, String userId, Map<String, Object> data) {
    logger.debug("nats disabled; dropping eventType={} sessionId={}", eventType, sessionId);
  }
}
