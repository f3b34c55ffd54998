/*
 * どこで: Arena サービス層
 * 何を: セッション終了を終了記録・成績加算・実績評価・outbox 登録の 1 トランザクションに変換する
 * なぜ: 途中失敗で一部だけ加算された状態を残さず、再精算を安全に繰り返せるようにするため
 */
package com.example.arena.service;

import com.example.arena.model.AchievementEvaluation;
import com.example.arena.model.GameCredit;
import com.example.arena.model.LeaderboardRecord;
import com.example.arena.model.PlayerSettlement;
import com.example.arena.model.PlayerStanding;
import com.example.arena.model.SessionOutcome;
import com.example.arena.model.SettlementReport;
import com.example.arena.repository.SessionResultRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SessionSettlementService {

  private static final Logger logger = LoggerFactory.getLogger(SessionSettlementService.class);

  private final SessionResultRepository sessionResultRepository;
  private final StatsLedger statsLedger;
  private final AchievementEngine achievementEngine;
  private final ResultEventRecorder resultEventRecorder;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final Clock clock;

  public SessionSettlementService(
      SessionResultRepository sessionResultRepository,
      StatsLedger statsLedger,
      AchievementEngine achievementEngine,
      ResultEventRecorder resultEventRecorder,
      ObjectMapper objectMapper,
      Clock clock) {
    this.sessionResultRepository = sessionResultRepository;
    this.statsLedger = statsLedger;
    this.achievementEngine = achievementEngine;
    this.resultEventRecorder = resultEventRecorder;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Transactional
  public SettlementReport settle(SessionOutcome outcome) {
    final Instant now = Instant.now(clock);
    final boolean first =
        sessionResultRepository.insertIfAbsent(
            outcome.sessionId(),
            outcome.gameType(),
            outcome.reason(),
            writeStandings(outcome.standings()),
            now);
    if (first) {
      resultEventRecorder.sessionFinished(outcome);
    }
    final Instant playedAt = outcome.finishedAt() == null ? now : outcome.finishedAt();
    final List<PlayerSettlement> players = new ArrayList<>(outcome.standings().size());
    for (PlayerStanding standing : outcome.standings()) {
      final GameCredit credit =
          new GameCredit(
              outcome.sessionId(),
              standing.userId(),
              standing.username(),
              standing.result(),
              standing.finalScore(),
              outcome.gameType(),
              outcome.perfectScore(),
              playedAt);
      final Optional<LeaderboardRecord> snapshot = statsLedger.creditGameResult(credit);
      if (snapshot.isEmpty()) {
        players.add(PlayerSettlement.alreadyCredited(standing.userId()));
        continue;
      }
      final List<AchievementEvaluation> evaluations =
          achievementEngine.evaluate(standing.userId(), snapshot.get());
      resultEventRecorder.achievementChanges(outcome.sessionId(), standing.userId(), evaluations);
      players.add(new PlayerSettlement(standing.userId(), true, snapshot.get(), evaluations));
    }
    logger.info(
        "session settled sessionId={} first={} players={} reason={}",
        outcome.sessionId(),
        first,
        players.size(),
        outcome.reason());
    return new SettlementReport(outcome.sessionId(), first, players);
  }

  public boolean isSettled(String sessionId) {
    return sessionResultRepository.exists(sessionId);
  }

  private String writeStandings(List<PlayerStanding> standings) {
    try {
      return objectMapper.writeValueAsString(standings);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("standings serialization failed", ex);
    }
  }
}
