/*
 * どこで: Arena outbox publish サービス
 * 何を: result_outbox を claim して結果イベントを NATS JetStream へ publish する
 * なぜ: 成績確定トランザクションとイベント配信の整合性を保つため
 */
package com.example.arena.service;

import com.example.arena.config.OutboxProperties;
import com.example.arena.config.SessionNatsProperties;
import com.example.arena.model.ResultOutboxEntry;
import com.example.arena.repository.ResultOutboxRepository;
import com.example.common.event.ArenaEventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnExpression("${arena.outbox.enabled:true} and ${nats.enabled:true}")
public class ResultOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(ResultOutboxPublisher.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_SESSION_ID = "session_id";
  private static final String HEADER_USER_ID = "user_id";
  private static final String HEADER_OCCURRED_AT = "occurred_at";
  private static final String HEADER_TRACE_ID = "trace_id";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final JetStream jetStream;

  private final ResultOutboxRepository outboxRepository;
  private final OutboxProperties properties;
  private final SessionNatsProperties natsProperties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final SessionMetrics metrics;
  private final Clock clock;

  public ResultOutboxPublisher(
      JetStream jetStream,
      ResultOutboxRepository outboxRepository,
      OutboxProperties properties,
      SessionNatsProperties natsProperties,
      ObjectMapper objectMapper,
      SessionMetrics metrics,
      Clock clock) {
    this.jetStream = jetStream;
    this.outboxRepository = outboxRepository;
    this.properties = properties;
    this.natsProperties = natsProperties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  public void publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String workerId = resolveWorkerId();
    final List<ResultOutboxEntry> due =
        outboxRepository.claimDue(workerId, now, properties.lease(), properties.batchSize());
    for (ResultOutboxEntry entry : due) {
      try {
        final ArenaEventEnvelope envelope = parsePayload(entry);
        final PublishAck ack =
            jetStream.publish(
                natsProperties.resultSubject(),
                buildHeaders(entry, envelope),
                entry.payloadJson().getBytes(StandardCharsets.UTF_8));
        if (ack == null) {
          throw new IllegalStateException("puback is missing");
        }
        if (!outboxRepository.markSent(entry.eventId(), workerId, now)) {
          logger.warn("outbox publish succeeded but claim was lost eventId={}", entry.eventId());
        } else {
          logger.debug(
              "outbox event published eventId={} kind={} sessionId={} stream={} seq={}",
              entry.eventId(),
              entry.kind(),
              entry.sessionId(),
              ack.getStream(),
              ack.getSeqno());
        }
      } catch (JetStreamApiException | IOException ex) {
        handleFailure(entry, ex, now, workerId);
      } catch (RuntimeException ex) {
        handleFailure(entry, ex, now, workerId);
      }
    }
    metrics.updateOutboxDeadCurrent(outboxRepository.countDead());
  }

  private ArenaEventEnvelope parsePayload(ResultOutboxEntry entry) {
    try {
      return objectMapper.readValue(entry.payloadJson(), ArenaEventEnvelope.class);
    } catch (JsonProcessingException ex) {
      // 壊れた payload は再試行しても直らないので即 DEAD にする
      throw new OutboxPayloadParseException("outbox payload parse failure", ex);
    }
  }

  private Headers buildHeaders(ResultOutboxEntry entry, ArenaEventEnvelope envelope) {
    final Headers headers = new Headers();
    headers.add(HEADER_MESSAGE_ID, envelope.eventId());
    headers.add(HEADER_EVENT_TYPE, envelope.eventType());
    headers.add(HEADER_SESSION_ID, entry.sessionId());
    if (entry.userId() != null) {
      headers.add(HEADER_USER_ID, entry.userId());
    }
    headers.add(HEADER_OCCURRED_AT, envelope.occurredAt());
    if (envelope.traceId() != null) {
      headers.add(HEADER_TRACE_ID, envelope.traceId());
    }
    return headers;
  }

  private void handleFailure(ResultOutboxEntry entry, Exception ex, Instant now, String workerId) {
    final boolean nonRetryable = ex instanceof OutboxPayloadParseException;
    final int attempts = nonRetryable ? properties.maxAttempts() : entry.attempts() + 1;
    final String error = truncateError(ex.getMessage());
    final boolean released;
    if (nonRetryable || attempts >= properties.maxAttempts()) {
      released = outboxRepository.markDead(entry.eventId(), workerId, attempts, error);
      if (nonRetryable) {
        logger.error("outbox payload unreadable, moved to DEAD eventId={}", entry.eventId(), ex);
      } else {
        logger.warn(
            "outbox publish gave up eventId={} attempts={}", entry.eventId(), attempts, ex);
      }
    } else {
      final Instant dueAt = now.plus(backoff(attempts));
      released =
          outboxRepository.scheduleRetry(entry.eventId(), workerId, attempts, dueAt, error);
      logger.warn(
          "outbox publish retry scheduled eventId={} attempts={} dueAt={}",
          entry.eventId(),
          attempts,
          dueAt,
          ex);
    }
    if (!released) {
      logger.warn(
          "outbox failure not recorded because claim was lost eventId={}", entry.eventId());
    }
    metrics.recordDependencyError(nonRetryable ? "outbox_payload" : "outbox_publish");
  }

  /** base * 2^(attempt-1) を backoffMax で頭打ちにする。 */
  Duration backoff(int attempt) {
    final long baseMillis = properties.backoffBase().toMillis();
    final long maxMillis = properties.backoffMax().toMillis();
    final int shift = Math.min(Math.max(attempt - 1, 0), 30);
    final long millis = baseMillis << shift;
    return Duration.ofMillis(millis <= 0 || millis > maxMillis ? maxMillis : millis);
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private String resolveWorkerId() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  private static final class OutboxPayloadParseException extends RuntimeException {
    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
