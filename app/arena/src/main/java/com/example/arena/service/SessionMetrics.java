/*
 * どこで: Arena サービス層
 * 何を: キュー/ルーム/実績/outbox のアプリ固有メトリクス記録を集約する
 * なぜ: マッチング待ち時間や CAS 競合、配信失敗を運用で継続監視できるようにするため
 */
package com.example.arena.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SessionMetrics {

  private final MeterRegistry meterRegistry;
  private final AtomicLong queueDepth = new AtomicLong(0);
  private final AtomicLong oldestWaitSeconds = new AtomicLong(0);
  private final AtomicLong outboxDeadCurrent = new AtomicLong(0);
  private final Timer timeToMatchTimer;
  private final Counter casConflictCounter;
  private final Counter achievementUnlockedCounter;
  private final ConcurrentMap<String, Counter> matchResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> finishedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public SessionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder("arena.queue.depth", queueDepth, AtomicLong::get)
        .description("Number of players waiting in the matchmaking queue")
        .register(meterRegistry);
    Gauge.builder("arena.queue.oldest_wait", oldestWaitSeconds, AtomicLong::get)
        .description("Wait time in seconds of the oldest queued player")
        .baseUnit("seconds")
        .register(meterRegistry);
    Gauge.builder("arena.outbox.dead", outboxDeadCurrent, AtomicLong::get)
        .description("Current number of result events that gave up publishing")
        .register(meterRegistry);
    this.timeToMatchTimer =
        Timer.builder("arena.time_to_match")
            .description("Time from queue entry to session creation")
            .register(meterRegistry);
    this.casConflictCounter =
        Counter.builder("arena.room.cas_conflict.total")
            .description("Room compare-and-set attempts rejected by a concurrent update")
            .register(meterRegistry);
    this.achievementUnlockedCounter =
        Counter.builder("arena.achievement.unlocked.total")
            .description("Achievements unlocked")
            .register(meterRegistry);
  }

  public void updateQueueDepth(long depth) {
    queueDepth.set(Math.max(0, depth));
  }

  public void updateOldestWait(long seconds) {
    oldestWaitSeconds.set(Math.max(0, seconds));
  }

  public void recordMatchResult(String result) {
    matchResultCounters
        .computeIfAbsent(
            result,
            key ->
                Counter.builder("arena.match.total")
                    .tags(Tags.of("result", key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTimeToMatch(Instant joinedAt, Instant matchedAt) {
    if (joinedAt == null || matchedAt == null || matchedAt.isBefore(joinedAt)) {
      return;
    }
    timeToMatchTimer.record(Duration.between(joinedAt, matchedAt));
  }

  public void recordCasConflict() {
    casConflictCounter.increment();
  }

  public void recordSessionFinished(String reason) {
    finishedCounters
        .computeIfAbsent(
            reason,
            key ->
                Counter.builder("arena.session.finished.total")
                    .tags(Tags.of("reason", key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAchievementUnlocked() {
    achievementUnlockedCounter.increment();
  }

  public void updateOutboxDeadCurrent(long deadCount) {
    outboxDeadCurrent.set(Math.max(deadCount, 0));
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(
            errorType,
            key ->
                Counter.builder("arena.dependency.error.total")
                    .tags(Tags.of("type", key))
                    .register(meterRegistry))
        .increment();
  }
}
