/*
 * どこで: Arena サービス層
 * 何を: セッション終了と実績の変化を result_outbox に積む
 * なぜ: 成績確定と同じトランザクションに配信予約を含め、DB と通知の食い違いをなくすため
 */
package com.example.arena.service;

import com.example.arena.model.AchievementEvaluation;
import com.example.arena.model.SessionOutcome;
import com.example.arena.repository.ResultOutboxRepository;
import com.example.common.TraceIds;
import com.example.common.event.ArenaEventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class ResultEventRecorder {

  static final String SESSION_FINISHED = "SessionFinished";
  static final String ACHIEVEMENT_UNLOCKED = "AchievementUnlocked";
  static final String ACHIEVEMENT_PROGRESS = "AchievementProgress";

  private final ResultOutboxRepository outboxRepository;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final Clock clock;

  public ResultEventRecorder(
      ResultOutboxRepository outboxRepository, ObjectMapper objectMapper, Clock clock) {
    this.outboxRepository = outboxRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public void sessionFinished(SessionOutcome outcome) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("game_type", outcome.gameType());
    data.put("finish_reason", outcome.reason().name().toLowerCase(Locale.ROOT));
    data.put("finished_at", outcome.finishedAt() == null ? null : outcome.finishedAt().toString());
    data.put("standings", outcome.standings());
    record(SESSION_FINISHED, "session-finished", outcome.sessionId(), null, data);
  }

  /** 新規解除と進捗の変化だけを積む。変化のない評価と並行解除に負けた評価は積まない。 */
  public void achievementChanges(
      String sessionId, String userId, List<AchievementEvaluation> evaluations) {
    for (AchievementEvaluation evaluation : evaluations) {
      final Map<String, Object> data = new LinkedHashMap<>();
      data.put("achievement_id", evaluation.achievementId());
      data.put("name", evaluation.name());
      if (evaluation.unlocked()) {
        data.put("points", evaluation.pointsAwarded());
        record(ACHIEVEMENT_UNLOCKED, "achievement-unlocked", sessionId, userId, data);
      } else if (!evaluation.alreadyUnlocked()
          && evaluation.progress().compareTo(evaluation.previousProgress()) != 0) {
        data.put("progress", evaluation.progress());
        data.put("previous_progress", evaluation.previousProgress());
        record(ACHIEVEMENT_PROGRESS, "achievement-progress", sessionId, userId, data);
      }
    }
  }

  private void record(
      String kind, String eventType, String sessionId, String userId, Map<String, Object> data) {
    final UUID eventId = UUID.randomUUID();
    final Instant now = Instant.now(clock);
    final ArenaEventEnvelope envelope =
        new ArenaEventEnvelope(
            eventId.toString(),
            eventType,
            now.toString(),
            sessionId,
            userId,
            TraceIds.currentOrNew(),
            data);
    final String payload;
    try {
      payload = objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("outbox payload serialization failed", ex);
    }
    outboxRepository.enqueue(eventId, kind, sessionId, userId, payload, now);
  }
}
