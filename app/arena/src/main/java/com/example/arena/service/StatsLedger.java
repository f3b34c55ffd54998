/*
 * どこで: Arena サービス層
 * 何を: セッション結果をユーザーの通算成績へ 1 回だけ加算する
 * なぜ: 終了の再送や再精算があっても gamesPlayed を二重に数えないため
 */
package com.example.arena.service;

import com.example.arena.api.InvalidSessionRequestException;
import com.example.arena.model.GameCredit;
import com.example.arena.model.GameSettings;
import com.example.arena.model.LeaderboardRecord;
import com.example.arena.repository.LeaderboardRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class StatsLedger {

  private static final Logger logger = LoggerFactory.getLogger(StatsLedger.class);

  private final LeaderboardRepository leaderboardRepository;
  private final Clock clock;

  /**
   * 役割: 1 参加者ぶんの結果を加算する。 動作: (sessionId, userId) の加算マーカーを同じトランザクションで登録し、登録できた場合だけ成績を更新して更新後の値を返す。
   * 前提: score は 0 以上。
   *
   * @return 加算後の成績。既に加算済みなら empty
   */
  @Transactional
  public Optional<LeaderboardRecord> creditGameResult(GameCredit credit) {
    validate(credit);
    final Instant now = Instant.now(clock);
    if (!leaderboardRepository.insertCreditMarker(credit, now)) {
      logger.info(
          "stats already credited sessionId={} userId={}", credit.sessionId(), credit.userId());
      return Optional.empty();
    }
    leaderboardRepository.applyGameResult(credit, now);
    final String gameType =
        credit.gameType() == null || credit.gameType().isBlank()
            ? GameSettings.DEFAULT_GAME_TYPE
            : credit.gameType();
    leaderboardRepository.addGameTypeScore(credit.userId(), gameType, credit.score());
    return Optional.of(get(credit.userId()));
  }

  @Transactional
  public LeaderboardRecord recordDailyStreak(String userId, int dailyStreak) {
    if (dailyStreak < 0) {
      throw new InvalidSessionRequestException("daily_streak must be >= 0");
    }
    leaderboardRepository.updateDailyStreak(userId, dailyStreak, Instant.now(clock));
    return get(userId);
  }

  @Transactional
  public LeaderboardRecord recordFriendCount(String userId, int friendCount) {
    if (friendCount < 0) {
      throw new InvalidSessionRequestException("friend_count must be >= 0");
    }
    leaderboardRepository.updateFriendCount(userId, friendCount, Instant.now(clock));
    return get(userId);
  }

  public LeaderboardRecord get(String userId) {
    return leaderboardRepository
        .findByUserId(userId)
        .orElseGet(() -> LeaderboardRecord.empty(userId));
  }

  private void validate(GameCredit credit) {
    if (credit.sessionId() == null || credit.sessionId().isBlank()) {
      throw new InvalidSessionRequestException("sessionId is required");
    }
    if (credit.userId() == null || credit.userId().isBlank()) {
      throw new InvalidSessionRequestException("userId is required");
    }
    if (credit.result() == null) {
      throw new InvalidSessionRequestException("result is required");
    }
    if (credit.score() < 0) {
      throw new InvalidSessionRequestException("score must be >= 0");
    }
  }
}
