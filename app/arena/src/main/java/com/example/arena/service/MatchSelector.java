package com.example.arena.service;

import com.example.arena.model.QueueEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * 待機候補から対戦相手を 1 名選ぶ。
 *
 * <p>同じモード・同じ人数・スキル差が range 以内の候補のうち、スキル差が最小のものを選ぶ。差が同じなら先に並んだ方を優先する。
 * maxWait を超えて待っている候補は期限切れとして扱い選ばない。
 */
@Component
public class MatchSelector {

  public Optional<QueueEntry> select(
      QueueEntry self,
      List<QueueEntry> candidates,
      int skillRange,
      Instant now,
      Duration maxWait) {
    final Instant expiredBefore = now.minus(maxWait);
    return candidates.stream()
        .filter(candidate -> !candidate.userId().equals(self.userId()))
        .filter(candidate -> candidate.mode() == self.mode())
        .filter(candidate -> candidate.partySize() == self.partySize())
        .filter(candidate -> skillDiff(self, candidate) <= skillRange)
        .filter(candidate -> !candidate.joinedAt().isBefore(expiredBefore))
        .min(
            Comparator.<QueueEntry>comparingInt(candidate -> skillDiff(self, candidate))
                .thenComparing(QueueEntry::joinedAt)
                .thenComparing(QueueEntry::userId));
  }

  private static int skillDiff(QueueEntry a, QueueEntry b) {
    return Math.abs(a.skillLevel() - b.skillLevel());
  }
}
