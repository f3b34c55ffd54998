/*
 * どこで: Arena 設定
 * 何を: ルームの TTL・カウントダウン・CAS 再試行などのセッション設定を保持する
 * なぜ: 環境差分をコード外へ出し、テストで短い値に上書きできるようにするため
 */
package com.example.arena.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "arena.session")
public record SessionProperties(
    @NotNull Duration waitingTtl,
    @NotNull Duration playingTtl,
    @NotNull Duration finishedTtl,
    @NotNull Duration countdown,
    @NotNull Duration finishCleanupDelay,
    @Min(1) int casMaxAttempts,
    @Min(2) int defaultMaxPlayers,
    @Min(2) int maxPlayersLimit,
    @Min(1) int nameMaxLength,
    @Min(1) int eventLogSize,
    @Min(0) long forfeitFloorScore,
    @Min(1) int listLimitMax,
    @NotNull Duration sweepInterval,
    boolean sweepEnabled) {

  @AssertTrue(message = "arena.session TTL values must be positive")
  public boolean isTtlPositive() {
    return isPositive(waitingTtl) && isPositive(playingTtl) && isPositive(finishedTtl);
  }

  @AssertTrue(message = "arena.session.default-max-players must not exceed max-players-limit")
  public boolean isDefaultWithinLimit() {
    return defaultMaxPlayers <= maxPlayersLimit;
  }

  private static boolean isPositive(Duration value) {
    return value != null && !value.isZero() && !value.isNegative();
  }
}
