package com.example.arena.service;

import static com.example.arena.service.ArenaFixtures.FIXED_NOW;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.arena.model.MatchMode;
import com.example.arena.model.QueueEntry;
import com.example.arena.model.TeamMember;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class MatchSelectorTest {

  private static final Duration MAX_WAIT = Duration.ofMinutes(5);

  private final MatchSelector selector = new MatchSelector();

  @Test
  void picksClosestSkillThenOldestEntry() {
    final QueueEntry self = solo("self", 1000, MatchMode.QUICK, 0);
    final List<QueueEntry> candidates =
        List.of(
            solo("far", 1250, MatchMode.QUICK, 100),
            solo("close-new", 1040, MatchMode.QUICK, 10),
            solo("close-old", 960, MatchMode.QUICK, 60));

    final Optional<QueueEntry> match = selector.select(self, candidates, 300, FIXED_NOW, MAX_WAIT);

    assertThat(match).map(QueueEntry::userId).contains("close-old");
  }

  @Test
  void skipsSelfOtherModeAndOutOfRange() {
    final QueueEntry self = solo("self", 1000, MatchMode.RANKED, 0);
    final List<QueueEntry> candidates =
        List.of(
            solo("self", 1000, MatchMode.RANKED, 0),
            solo("quick", 1000, MatchMode.QUICK, 0),
            solo("too-far", 1101, MatchMode.RANKED, 0));

    assertThat(selector.select(self, candidates, 100, FIXED_NOW, MAX_WAIT)).isEmpty();
  }

  @Test
  void skipsEntriesOlderThanMaxWait() {
    final QueueEntry self = solo("self", 1000, MatchMode.QUICK, 0);
    final List<QueueEntry> candidates =
        List.of(solo("stale", 1000, MatchMode.QUICK, 301), solo("fresh", 1200, MatchMode.QUICK, 30));

    assertThat(selector.select(self, candidates, 300, FIXED_NOW, MAX_WAIT))
        .map(QueueEntry::userId)
        .contains("fresh");
  }

  @Test
  void teamsOnlyMatchTeamsOfSameSize() {
    final QueueEntry self = team("lead-a", 1000, 2);
    final List<QueueEntry> candidates =
        List.of(solo("solo", 1000, MatchMode.QUICK, 0), team("lead-b", 1010, 3), team("lead-c", 1100, 2));

    assertThat(selector.select(self, candidates, 300, FIXED_NOW, MAX_WAIT))
        .map(QueueEntry::userId)
        .contains("lead-c");
  }

  @Test
  void breaksFullTiesByUserId() {
    final QueueEntry self = solo("self", 1000, MatchMode.QUICK, 0);
    final List<QueueEntry> candidates =
        List.of(solo("u-b", 1000, MatchMode.QUICK, 5), solo("u-a", 1000, MatchMode.QUICK, 5));

    assertThat(selector.select(self, candidates, 300, FIXED_NOW, MAX_WAIT))
        .map(QueueEntry::userId)
        .contains("u-a");
  }

  private static QueueEntry solo(String userId, int skill, MatchMode mode, long waitedSeconds) {
    return new QueueEntry(
        userId,
        userId,
        skill,
        mode,
        FIXED_NOW.minusSeconds(waitedSeconds),
        List.of(new TeamMember(userId, userId, skill)));
  }

  private static QueueEntry team(String leader, int skill, int size) {
    final List<TeamMember> members =
        IntStream.range(0, size)
            .mapToObj(i -> new TeamMember(i == 0 ? leader : leader + "-" + i, null, skill))
            .toList();
    return new QueueEntry(leader, leader, skill, MatchMode.QUICK, FIXED_NOW, members);
  }
}
