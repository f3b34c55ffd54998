package com.example.arena.service;

import com.example.arena.config.SessionNatsProperties;
import com.example.common.TraceIds;
import com.example.common.event.ArenaEventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsSessionEventPublisher implements SessionEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NatsSessionEventPublisher.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final JetStream jetStream;

  private final SessionNatsProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final SessionMetrics metrics;
  private final Clock clock;

  public NatsSessionEventPublisher(
      JetStream jetStream,
      SessionNatsProperties properties,
      ObjectMapper objectMapper,
      SessionMetrics metrics,
      Clock clock) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public void publish(String eventType, String sessionId, String userId, Map<String, Object> data) {
    final String eventId = UUID.randomUUID().toString();
    final ArenaEventEnvelope envelope =
        new ArenaEventEnvelope(
            eventId,
            eventType,
            Instant.now(clock).toString(),
            sessionId,
            userId,
            TraceIds.currentOrNew(),
            data);
    final Headers headers = new Headers();
    headers.add(HEADER_MESSAGE_ID, eventId);
    headers.add(HEADER_EVENT_TYPE, eventType);
    try {
      jetStream.publish(
          properties.sessionSubject(), headers, objectMapper.writeValueAsBytes(envelope));
    } catch (IOException | JetStreamApiException ex) {
      // ルーム状態は確定済みのため、配信失敗は記録だけして処理を続ける
      logger.warn(
          "session event publish failed eventType={} sessionId={}", eventType, sessionId, ex);
      metrics.recordDependencyError("nats_publish");
    }
  }
}
