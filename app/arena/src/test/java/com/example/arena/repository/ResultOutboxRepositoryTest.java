/*
 * どこで: ResultOutboxRepository の統合テスト
 * 何を: 送信期限と claim 期限による確保、claim 保持者だけが結果を反映できることを検証する
 * なぜ: 複数インスタンスで同じ結果イベントを二重送信しないことを保証するため
 */
package com.example.arena.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.arena.AbstractPostgresContainerTest;
import com.example.arena.model.ResultOutboxEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ResultOutboxRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");
  private static final Duration CLAIM = Duration.ofSeconds(30);

  @Autowired private ResultOutboxRepository outboxRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM result_outbox", new MapSqlParameterSource());
  }

  @Test
  void claimSkipsFutureRetriesAndLiveClaims() {
    final UUID oldest = enqueue("s1", null, BASE_TIME);
    final UUID retryLater = enqueue("s2", null, BASE_TIME.plusSeconds(1));
    final UUID abandoned = enqueue("s3", "u1", BASE_TIME.plusSeconds(2));
    final UUID held = enqueue("s3", "u2", BASE_TIME.plusSeconds(3));
    final Instant now = BASE_TIME.plusSeconds(60);
    setDueAt(retryLater, now.plusSeconds(30));
    setSending(abandoned, now.minusSeconds(1));
    setSending(held, now.plusSeconds(30));

    final List<ResultOutboxEntry> claimed = outboxRepository.claimDue("worker-a", now, CLAIM, 10);

    assertThat(claimed).extracting(ResultOutboxEntry::eventId).containsExactly(oldest, abandoned);
    assertThat(claimed.get(1).userId()).isEqualTo("u1");
    assertThat(claimed.get(0).payloadJson()).isEqualTo("{\"seq\": 1}");
    assertThat(stateOf(oldest)).isEqualTo("SENDING");
    assertThat(claimedBy(abandoned)).isEqualTo("worker-a");
    assertThat(stateOf(retryLater)).isEqualTo("QUEUED");
  }

  @Test
  void claimHonoursLimitInEnqueueOrder() {
    final UUID first = enqueue("s1", null, BASE_TIME);
    enqueue("s2", null, BASE_TIME.plusSeconds(1));

    assertThat(outboxRepository.claimDue("worker-a", BASE_TIME.plusSeconds(5), CLAIM, 1))
        .extracting(ResultOutboxEntry::eventId)
        .containsExactly(first);
  }

  @Test
  void onlyClaimOwnerCanMarkSent() {
    final UUID eventId = enqueue("s1", null, BASE_TIME);
    outboxRepository.claimDue("worker-a", BASE_TIME, CLAIM, 10);

    assertThat(outboxRepository.markSent(eventId, "worker-b", BASE_TIME)).isFalse();
    assertThat(outboxRepository.markSent(eventId, "worker-a", BASE_TIME)).isTrue();
    assertThat(stateOf(eventId)).isEqualTo("SENT");
    assertThat(outboxRepository.markSent(eventId, "worker-a", BASE_TIME)).isFalse();
  }

  @Test
  void retryAndDeadReleaseTheClaim() {
    final UUID retried = enqueue("s1", null, BASE_TIME);
    final UUID dead = enqueue("s2", null, BASE_TIME);
    outboxRepository.claimDue("worker-a", BASE_TIME, CLAIM, 10);

    assertThat(
            outboxRepository.scheduleRetry(
                retried, "worker-a", 1, BASE_TIME.plusSeconds(1), "timeout"))
        .isTrue();
    assertThat(outboxRepository.markDead(dead, "worker-a", 8, "gave up")).isTrue();

    assertThat(stateOf(retried)).isEqualTo("QUEUED");
    assertThat(stateOf(dead)).isEqualTo("DEAD");
    assertThat(outboxRepository.countDead()).isEqualTo(1);
    assertThat(outboxRepository.claimDue("worker-b", BASE_TIME, CLAIM, 10)).isEmpty();
    assertThat(outboxRepository.claimDue("worker-b", BASE_TIME.plusSeconds(2), CLAIM, 10))
        .singleElement()
        .extracting(ResultOutboxEntry::attempts)
        .isEqualTo(1);
  }

  private UUID enqueue(String sessionId, String userId, Instant at) {
    final UUID eventId = UUID.randomUUID();
    outboxRepository.enqueue(eventId, "SessionFinished", sessionId, userId, "{\"seq\":1}", at);
    return eventId;
  }

  private void setDueAt(UUID eventId, Instant dueAt) {
    jdbcTemplate.update(
        "UPDATE result_outbox SET due_at = :dueAt WHERE event_id = :eventId",
        new MapSqlParameterSource()
            .addValue("dueAt", toTimestamp(dueAt))
            .addValue("eventId", eventId));
  }

  private void setSending(UUID eventId, Instant claimExpiresAt) {
    jdbcTemplate.update(
        """
        UPDATE result_outbox
        SET state = 'SENDING', claimed_by = 'worker-x', claim_expires_at = :claimExpiresAt
        WHERE event_id = :eventId
        """,
        new MapSqlParameterSource()
            .addValue("claimExpiresAt", toTimestamp(claimExpiresAt))
            .addValue("eventId", eventId));
  }

  private String stateOf(UUID eventId) {
    return column(eventId, "state");
  }

  private String claimedBy(UUID eventId) {
    return column(eventId, "claimed_by");
  }

  private String column(UUID eventId, String column) {
    return jdbcTemplate.queryForObject(
        "SELECT " + column + " FROM result_outbox WHERE event_id = :eventId",
        new MapSqlParameterSource().addValue("eventId", eventId),
        String.class);
  }
}
