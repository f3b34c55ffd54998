package com.example.arena.model;

import java.time.Instant;
import java.util.List;

/**
 * 待機キューの 1 エントリ。ソロは members が本人 1 名、チームはリーダー ID でキューに載り skillLevel はメンバー平均。
 */
public record QueueEntry(
    String userId,
    String username,
    int skillLevel,
    MatchMode mode,
    Instant joinedAt,
    List<TeamMember> members) {

  public QueueEntry {
    members = members == null ? List.of() : List.copyOf(members);
  }

  public int partySize() {
    return Math.max(1, members.size());
  }
}
