/*
 * どこで: Arena ドメインモデル
 * 何を: マッチング要求をソロ/チームの 2 種で表す
 * なぜ: ペアリング処理を 1 本に保ったまま、チーム単位の待機も扱えるようにするため
 */
package com.example.arena.model;

import java.time.Instant;
import java.util.List;

public sealed interface MatchRequest permits MatchRequest.Solo, MatchRequest.Team {

  String userId();

  String username();

  MatchMode mode();

  List<TeamMember> members();

  default QueueEntry toQueueEntry(Instant joinedAt) {
    final List<TeamMember> members = members();
    final int skill =
        (int) Math.round(members.stream().mapToInt(TeamMember::skillLevel).average().orElse(0));
    return new QueueEntry(userId(), username(), skill, mode(), joinedAt, members);
  }

  record Solo(String userId, String username, int skillLevel, MatchMode mode)
      implements MatchRequest {

    @Override
    public List<TeamMember> members() {
      return List.of(new TeamMember(userId, username, skillLevel));
    }
  }

  /** userId はチームリーダー。members にはリーダー自身も含める。 */
  record Team(String userId, String username, MatchMode mode, List<TeamMember> members)
      implements MatchRequest {

    public Team {
      members = members == null ? List.of() : List.copyOf(members);
    }
  }
}
