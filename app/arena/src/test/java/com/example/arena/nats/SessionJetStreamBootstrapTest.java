/*
 * どこで: Arena JetStream 初期化テスト
 * 何を: live 配信と結果配信の subject を 1 stream にまとめて作成/更新することを確認する
 * なぜ: 起動時に stream が無い環境でも publish 前に確保されることを保証するため
 */
package com.example.arena.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.arena.config.SessionNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionJetStreamBootstrapTest {

  private static final SessionNatsProperties PROPERTIES =
      new SessionNatsProperties(
          "ARENA_EVENTS", "session.events", "session.results", Duration.ofMinutes(2));

  @Mock private Connection connection;

  @Mock private JetStreamManagement jetStreamManagement;

  @Test
  void missingStreamIsCreatedWithBothSubjects() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
        .thenThrow(new StreamNotFoundException());

    new SessionJetStreamBootstrap(connection, PROPERTIES).start();

    final ArgumentCaptor<StreamConfiguration> config =
        ArgumentCaptor.forClass(StreamConfiguration.class);
    verify(jetStreamManagement).addStream(config.capture());
    assertThat(config.getValue().getName()).isEqualTo("ARENA_EVENTS");
    assertThat(config.getValue().getSubjects())
        .containsExactly("session.events", "session.results");
    assertThat(config.getValue().getDuplicateWindow()).isEqualTo(Duration.ofMinutes(2));
  }

  @Test
  void existingStreamIsOnlyUpdated() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);

    new SessionJetStreamBootstrap(connection, PROPERTIES).start();

    verify(jetStreamManagement).updateStream(any(StreamConfiguration.class));
    verify(jetStreamManagement, never()).addStream(any(StreamConfiguration.class));
  }

  @Test
  void sameSubjectForBothChannelsIsRejected() {
    final SessionNatsProperties properties =
        new SessionNatsProperties(
            "ARENA_EVENTS", "session.events", "session.events", Duration.ofMinutes(2));

    assertThatThrownBy(() -> new SessionJetStreamBootstrap(connection, properties).start())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("must differ");
  }

  private static final class StreamNotFoundException extends JetStreamApiException {

    private StreamNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10059;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}
