/*
 * どこで: Arena NATS 初期化
 * 何を: live 配信用と結果配信用の subject をまとめた JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.example.arena.nats;

import com.example.arena.config.SessionNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class SessionJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(SessionJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final SessionNatsProperties properties;

  @PostConstruct
  public void start() {
    ensureSettings();
    try {
      final StreamConfiguration streamConfiguration =
          StreamConfiguration.builder()
              .name(properties.stream())
              .subjects(properties.sessionSubject(), properties.resultSubject())
              .duplicateWindow(properties.duplicateWindow())
              .build();
      upsertStream(connection.jetStreamManagement(), streamConfiguration);
      logger.info(
          "arena stream ensured stream={} subjects=[{}, {}] duplicateWindow={}",
          properties.stream(),
          properties.sessionSubject(),
          properties.resultSubject(),
          properties.duplicateWindow());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream", ex);
    }
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private void ensureSettings() {
    if (properties.stream() == null || properties.stream().isBlank()) {
      throw new IllegalStateException("arena.nats.stream must be set");
    }
    if (isBlank(properties.sessionSubject()) || isBlank(properties.resultSubject())) {
      throw new IllegalStateException(
          "arena.nats.session-subject and arena.nats.result-subject must be set");
    }
    if (properties.sessionSubject().equals(properties.resultSubject())) {
      throw new IllegalStateException("arena.nats session and result subjects must differ");
    }
    if (properties.duplicateWindow() == null
        || properties.duplicateWindow().isZero()
        || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("arena.nats.duplicate-window must be positive");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
