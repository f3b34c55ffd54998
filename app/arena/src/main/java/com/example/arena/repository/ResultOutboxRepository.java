/*
 * どこで: Arena データアクセス
 * 何を: result_outbox への積み込み、送信対象の claim、送信結果の反映を担う
 * なぜ: 成績確定と同じトランザクションで配信予約を残し、複数インスタンスでも 1 件ずつ確実に送るため
 */
package com.example.arena.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.arena.model.OutboxState;
import com.example.arena.model.ResultOutboxEntry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ResultOutboxRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ResultOutboxRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  /** 呼び出し元のトランザクションに参加して QUEUED で積む。すぐに送信対象になる。 */
  public void enqueue(
      UUID eventId,
      String kind,
      String sessionId,
      String userId,
      String payloadJson,
      Instant enqueuedAt) {
    jdbcTemplate.update(
        """
        INSERT INTO result_outbox (
          event_id, kind, session_id, user_id, payload, due_at, enqueued_at
        ) VALUES (
          :eventId, :kind, :sessionId, :userId, :payload::jsonb, :enqueuedAt, :enqueuedAt
        )
        """,
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("kind", kind)
            .addValue("sessionId", sessionId)
            .addValue("userId", userId)
            .addValue("payload", payloadJson)
            .addValue("enqueuedAt", toTimestamp(enqueuedAt)));
  }

  /**
   * 期限の来た QUEUED 行と、claim 期限の切れた SENDING 行を積んだ順に最大 limit 件確保する。
   *
   * <p>他インスタンスがロック中の行は飛ばす。確保した行は claimFor の間 workerId の持ち物になる。
   */
  public List<ResultOutboxEntry> claimDue(
      String workerId, Instant now, Duration claimFor, int limit) {
    final List<ResultOutboxEntry> claimed =
        jdbcTemplate.query(
            """
            UPDATE result_outbox
            SET state = 'SENDING',
                claimed_by = :workerId,
                claim_expires_at = :claimExpiresAt
            WHERE event_id IN (
              SELECT event_id
              FROM result_outbox
              WHERE (state = 'QUEUED' AND due_at <= :now)
                 OR (state = 'SENDING' AND claim_expires_at <= :now)
              ORDER BY enqueued_at, event_id
              LIMIT :limit
              FOR UPDATE SKIP LOCKED
            )
            RETURNING event_id, kind, session_id, user_id, payload::text AS payload_json,
                      attempts, enqueued_at
            """,
            new MapSqlParameterSource()
                .addValue("workerId", workerId)
                .addValue("now", toTimestamp(now))
                .addValue("claimExpiresAt", toTimestamp(now.plus(claimFor)))
                .addValue("limit", limit),
            ResultOutboxRepository::mapEntry);
    final List<ResultOutboxEntry> ordered = new ArrayList<>(claimed);
    // RETURNING の順序は不定
    ordered.sort(
        Comparator.comparing(ResultOutboxEntry::enqueuedAt)
            .thenComparing(ResultOutboxEntry::eventId));
    return ordered;
  }

  /** 送信済みにする。claim を他のワーカーに奪われていた場合は false。 */
  public boolean markSent(UUID eventId, String workerId, Instant sentAt) {
    return jdbcTemplate.update(
            """
            UPDATE result_outbox
            SET state = 'SENT', sent_at = :sentAt, claimed_by = NULL,
                claim_expires_at = NULL, last_error = NULL
            WHERE event_id = :eventId AND claimed_by = :workerId AND state = 'SENDING'
            """,
            new MapSqlParameterSource()
                .addValue("sentAt", toTimestamp(sentAt))
                .addValue("eventId", eventId)
                .addValue("workerId", workerId))
        == 1;
  }

  /** 失敗を記録して dueAt に再送する。claim を失っていた場合は false。 */
  public boolean scheduleRetry(
      UUID eventId, String workerId, int attempts, Instant dueAt, String error) {
    return jdbcTemplate.update(
            """
            UPDATE result_outbox
            SET state = 'QUEUED', attempts = :attempts, due_at = :dueAt, last_error = :error,
                claimed_by = NULL, claim_expires_at = NULL
            WHERE event_id = :eventId AND claimed_by = :workerId AND state = 'SENDING'
            """,
            failureParams(eventId, workerId, attempts, error)
                .addValue("dueAt", toTimestamp(dueAt)))
        == 1;
  }

  /** 送信を諦めて DEAD にする。claim を失っていた場合は false。 */
  public boolean markDead(UUID eventId, String workerId, int attempts, String error) {
    return jdbcTemplate.update(
            """
            UPDATE result_outbox
            SET state = 'DEAD', attempts = :attempts, last_error = :error,
                claimed_by = NULL, claim_expires_at = NULL
            WHERE event_id = :eventId AND claimed_by = :workerId AND state = 'SENDING'
            """,
            failureParams(eventId, workerId, attempts, error))
        == 1;
  }

  public long countDead() {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM result_outbox WHERE state = :state",
            new MapSqlParameterSource("state", OutboxState.DEAD.name()),
            Long.class);
    return count == null ? 0 : count;
  }

  private static MapSqlParameterSource failureParams(
      UUID eventId, String workerId, int attempts, String error) {
    return new MapSqlParameterSource()
        .addValue("attempts", attempts)
        .addValue("error", error)
        .addValue("eventId", eventId)
        .addValue("workerId", workerId);
  }

  private static ResultOutboxEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
    return new ResultOutboxEntry(
        rs.getObject("event_id", UUID.class),
        rs.getString("kind"),
        rs.getString("session_id"),
        rs.getString("user_id"),
        rs.getString("payload_json"),
        rs.getInt("attempts"),
        rs.getTimestamp("enqueued_at").toInstant());
  }
}
