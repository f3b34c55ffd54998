package com.example.arena.service;

import static com.example.arena.service.ArenaFixtures.FIXED_NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.arena.api.ApiErrorCode;
import com.example.arena.api.InvalidSessionRequestException;
import com.example.arena.api.QueueEntryNotFoundException;
import com.example.arena.api.SessionConflictException;
import com.example.arena.model.CreateRoomCommand;
import com.example.arena.model.MatchMode;
import com.example.arena.model.MatchRequest;
import com.example.arena.model.PairingResult;
import com.example.arena.model.QueueEntry;
import com.example.arena.model.QueueStatistics;
import com.example.arena.model.QueueStatus;
import com.example.arena.model.Room;
import com.example.arena.model.RoomStatus;
import com.example.arena.model.TeamMember;
import com.example.arena.repository.ClaimOutcome;
import com.example.arena.repository.EnqueueOutcome;
import com.example.arena.repository.MatchQueueRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class MatchQueueTest {

  private MatchQueueRepository queueRepository;
  private SessionStore sessionStore;
  private GameEventProcessor gameEventProcessor;
  private SessionEventPublisher publisher;
  private SessionMetrics metrics;
  private MatchQueue matchQueue;

  @BeforeEach
  void setUp() {
    queueRepository = Mockito.mock(MatchQueueRepository.class);
    sessionStore = Mockito.mock(SessionStore.class);
    gameEventProcessor = Mockito.mock(GameEventProcessor.class);
    publisher = Mockito.mock(SessionEventPublisher.class);
    metrics = Mockito.mock(SessionMetrics.class);
    when(queueRepository.upsert(any(QueueEntry.class), any(Duration.class)))
        .thenReturn(EnqueueOutcome.QUEUED);
    matchQueue =
        new MatchQueue(
            queueRepository,
            sessionStore,
            gameEventProcessor,
            publisher,
            new MatchSelector(),
            ArenaFixtures.matchmakingProperties(),
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void enqueueStoresEntryWithTtl() {
    final QueueEntry entry =
        matchQueue.enqueue(new MatchRequest.Solo("u1", "alice", 1200, MatchMode.QUICK));

    assertThat(entry.joinedAt()).isEqualTo(FIXED_NOW);
    assertThat(entry.partySize()).isEqualTo(1);
    verify(queueRepository).upsert(entry, Duration.ofMinutes(10));
  }

  @Test
  void enqueueRejectsMemberAlreadyQueuedSolo() {
    when(queueRepository.upsert(any(QueueEntry.class), any(Duration.class)))
        .thenReturn(EnqueueOutcome.MEMBER_ALREADY_QUEUED);

    assertThatThrownBy(
            () ->
                matchQueue.pairAndCreateSession(
                    new MatchRequest.Team(
                        "lead",
                        "lead",
                        MatchMode.QUICK,
                        List.of(
                            new TeamMember("lead", "lead", 1000),
                            new TeamMember("m2", "m2", 1000)))))
        .isInstanceOfSatisfying(
            SessionConflictException.class,
            ex -> assertThat(ex.code()).isEqualTo(ApiErrorCode.ALREADY_QUEUED));
    verify(queueRepository, never()).findCandidates(anyInt(), anyInt());
    verify(queueRepository, never())
        .claimPair(anyString(), anyString(), anyString(), any(Duration.class));
  }

  @Test
  void enqueueRejectsMemberAlreadyInAnotherTeam() {
    when(queueRepository.upsert(
            Mockito.argThat(e -> e != null && e.userId().equals("other")), any(Duration.class)))
        .thenReturn(EnqueueOutcome.MEMBER_ALREADY_QUEUED);

    matchQueue.enqueue(
        new MatchRequest.Team(
            "lead",
            "lead",
            MatchMode.QUICK,
            List.of(new TeamMember("lead", "lead", 1000), new TeamMember("m2", "m2", 1000))));

    assertThatThrownBy(
            () ->
                matchQueue.enqueue(
                    new MatchRequest.Team(
                        "other",
                        "other",
                        MatchMode.QUICK,
                        List.of(
                            new TeamMember("other", "other", 1000),
                            new TeamMember("m2", "m2", 1000)))))
        .isInstanceOf(SessionConflictException.class)
        .hasMessageContaining("already queued");
  }

  @Test
  void enqueueRejectsSkillOutOfRange() {
    assertThatThrownBy(
            () -> matchQueue.enqueue(new MatchRequest.Solo("u1", "alice", 5001, MatchMode.QUICK)))
        .isInstanceOf(InvalidSessionRequestException.class);
    verify(queueRepository, never()).upsert(any(QueueEntry.class), any(Duration.class));
  }

  @Test
  void enqueueTeamUsesAverageSkill() {
    final QueueEntry entry =
        matchQueue.enqueue(
            new MatchRequest.Team(
                "lead",
                "lead",
                MatchMode.RANKED,
                List.of(new TeamMember("lead", "lead", 1000), new TeamMember("m2", "m2", 1101))));

    assertThat(entry.skillLevel()).isEqualTo(1051);
    assertThat(entry.partySize()).isEqualTo(2);
  }

  @Test
  void teamMustIncludeLeaderAndDistinctMembers() {
    assertThatThrownBy(
            () ->
                matchQueue.enqueue(
                    new MatchRequest.Team(
                        "lead",
                        "lead",
                        MatchMode.QUICK,
                        List.of(new TeamMember("a", "a", 1000), new TeamMember("b", "b", 1000)))))
        .isInstanceOf(InvalidSessionRequestException.class)
        .hasMessageContaining("leader");
    assertThatThrownBy(
            () ->
                matchQueue.enqueue(
                    new MatchRequest.Team(
                        "lead",
                        "lead",
                        MatchMode.QUICK,
                        List.of(
                            new TeamMember("lead", "lead", 1000),
                            new TeamMember("lead", "lead", 1000)))))
        .isInstanceOf(InvalidSessionRequestException.class)
        .hasMessageContaining("duplicate");
    assertThatThrownBy(
            () ->
                matchQueue.enqueue(
                    new MatchRequest.Team(
                        "lead", "lead", MatchMode.QUICK, List.of(new TeamMember("lead", "lead", 1000)))))
        .isInstanceOf(InvalidSessionRequestException.class)
        .hasMessageContaining("team size");
  }

  @Test
  void pairCreatesReadyRoomWithBothPlayers() {
    final QueueEntry opponent = entry("u2", 1100, MatchMode.QUICK, 30);
    when(queueRepository.findCandidates(900, 1500)).thenReturn(List.of(opponent));
    when(queueRepository.claimPair(eq("u1"), eq("u2"), anyString(), eq(Duration.ofMinutes(2))))
        .thenReturn(ClaimOutcome.CLAIMED);
    when(sessionStore.create(any(CreateRoomCommand.class)))
        .thenAnswer(invocation -> roomFrom(invocation.getArgument(0)));

    final PairingResult result =
        matchQueue.pairAndCreateSession(new MatchRequest.Solo("u1", "alice", 1200, MatchMode.QUICK));

    assertThat(result.outcome()).isEqualTo(PairingResult.Outcome.MATCHED);
    assertThat(result.opponentIds()).containsExactly("u2");
    final ArgumentCaptor<CreateRoomCommand> command =
        ArgumentCaptor.forClass(CreateRoomCommand.class);
    verify(sessionStore).create(command.capture());
    assertThat(command.getValue().roomId()).startsWith("quick_");
    assertThat(command.getValue().readyAll()).isTrue();
    assertThat(command.getValue().maxPlayers()).isEqualTo(2);
    assertThat(command.getValue().gameSettings().perfectScore()).isEqualTo(100L);
    assertThat(command.getValue().members())
        .extracting(TeamMember::userId)
        .containsExactly("u1", "u2");
    verify(gameEventProcessor).scheduleStart(result.room());
    verify(publisher).publish(eq("session-created"), anyString(), eq("u1"), anyMap());
    verify(metrics).recordMatchResult("matched");
  }

  @Test
  void rankedRoomGetsTimeLimitAndRankFlag() {
    final QueueEntry opponent = entry("u2", 1050, MatchMode.RANKED, 30);
    when(queueRepository.findCandidates(900, 1100)).thenReturn(List.of(opponent));
    when(queueRepository.claimPair(eq("u1"), eq("u2"), anyString(), any(Duration.class)))
        .thenReturn(ClaimOutcome.CLAIMED);
    when(sessionStore.create(any(CreateRoomCommand.class)))
        .thenAnswer(invocation -> roomFrom(invocation.getArgument(0)));

    matchQueue.pairAndCreateSession(new MatchRequest.Solo("u1", "alice", 1000, MatchMode.RANKED));

    final ArgumentCaptor<CreateRoomCommand> command =
        ArgumentCaptor.forClass(CreateRoomCommand.class);
    verify(sessionStore).create(command.capture());
    assertThat(command.getValue().roomId()).startsWith("ranked_");
    assertThat(command.getValue().gameSettings().timeLimitSeconds()).isEqualTo(600);
    assertThat(command.getValue().gameSettings().rankAffected()).isTrue();
  }

  @Test
  void pairRetriesWithNextCandidateWhenOpponentWasTaken() {
    final QueueEntry taken = entry("u2", 1200, MatchMode.QUICK, 30);
    final QueueEntry next = entry("u3", 1250, MatchMode.QUICK, 30);
    when(queueRepository.findCandidates(anyInt(), anyInt()))
        .thenReturn(List.of(taken, next))
        .thenReturn(List.of(next));
    when(queueRepository.claimPair(eq("u1"), eq("u2"), anyString(), any(Duration.class)))
        .thenReturn(ClaimOutcome.OPPONENT_MISSING);
    when(queueRepository.claimPair(eq("u1"), eq("u3"), anyString(), any(Duration.class)))
        .thenReturn(ClaimOutcome.CLAIMED);
    when(sessionStore.create(any(CreateRoomCommand.class)))
        .thenAnswer(invocation -> roomFrom(invocation.getArgument(0)));

    final PairingResult result =
        matchQueue.pairAndCreateSession(new MatchRequest.Solo("u1", "alice", 1200, MatchMode.QUICK));

    assertThat(result.outcome()).isEqualTo(PairingResult.Outcome.MATCHED);
    assertThat(result.opponentIds()).containsExactly("u3");
    verify(metrics).recordMatchResult("opponent_taken");
  }

  @Test
  void pairReportsAlreadyMatchedWhenSelfWasClaimed() {
    when(queueRepository.findCandidates(anyInt(), anyInt()))
        .thenReturn(List.of(entry("u2", 1200, MatchMode.QUICK, 30)));
    when(queueRepository.claimPair(eq("u1"), eq("u2"), anyString(), any(Duration.class)))
        .thenReturn(ClaimOutcome.SELF_MISSING);
    when(queueRepository.findMatchedSessionId("u1")).thenReturn(Optional.of("quick_other"));

    final PairingResult result =
        matchQueue.pairAndCreateSession(new MatchRequest.Solo("u1", "alice", 1200, MatchMode.QUICK));

    assertThat(result.outcome()).isEqualTo(PairingResult.Outcome.ALREADY_MATCHED);
    assertThat(result.queueStatus().sessionId()).isEqualTo("quick_other");
    verify(sessionStore, never()).create(any(CreateRoomCommand.class));
  }

  @Test
  void noCandidateLeavesPlayerQueuedWithPosition() {
    when(queueRepository.findCandidates(anyInt(), anyInt())).thenReturn(List.of());
    when(queueRepository.rank("u1")).thenReturn(Optional.of(2L));
    when(queueRepository.size()).thenReturn(5L);

    final PairingResult result =
        matchQueue.pairAndCreateSession(new MatchRequest.Solo("u1", "alice", 1200, MatchMode.QUICK));

    assertThat(result.outcome()).isEqualTo(PairingResult.Outcome.QUEUED);
    assertThat(result.queueStatus().position()).isEqualTo(3);
    assertThat(result.queueStatus().totalInQueue()).isEqualTo(5);
  }

  @Test
  void failedRoomCreationRequeuesBothEntries() {
    final QueueEntry opponent = entry("u2", 1200, MatchMode.QUICK, 30);
    when(queueRepository.findCandidates(anyInt(), anyInt())).thenReturn(List.of(opponent));
    when(queueRepository.claimPair(eq("u1"), eq("u2"), anyString(), any(Duration.class)))
        .thenReturn(ClaimOutcome.CLAIMED);
    when(sessionStore.create(any(CreateRoomCommand.class)))
        .thenThrow(new IllegalStateException("redis down"));

    assertThatThrownBy(
            () ->
                matchQueue.pairAndCreateSession(
                    new MatchRequest.Solo("u1", "alice", 1200, MatchMode.QUICK)))
        .isInstanceOf(IllegalStateException.class);

    verify(queueRepository).upsert(opponent, Duration.ofMinutes(10));
    verify(queueRepository, times(2))
        .upsert(Mockito.argThat(e -> e.userId().equals("u1")), eq(Duration.ofMinutes(10)));
    verify(metrics).recordMatchResult("create_failed");
  }

  @Test
  void queueStatusFallsBackToMatchedSession() {
    when(queueRepository.findEntry("u1")).thenReturn(Optional.empty());
    when(queueRepository.findMatchedSessionId("u1")).thenReturn(Optional.of("quick_1"));

    final QueueStatus status = matchQueue.queueStatus("u1");

    assertThat(status.state()).isEqualTo(QueueStatus.State.MATCHED);
    assertThat(status.sessionId()).isEqualTo("quick_1");
  }

  @Test
  void queueStatusOfUnknownUserIsNotFound() {
    when(queueRepository.findEntry("u1")).thenReturn(Optional.empty());
    when(queueRepository.findMatchedSessionId("u1")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> matchQueue.queueStatus("u1"))
        .isInstanceOf(QueueEntryNotFoundException.class);
  }

  @Test
  void cleanupRemovesExpiredAndOrphanedEntries() {
    when(queueRepository.findAllQueuedUserIds()).thenReturn(List.of("fresh", "stale", "orphan"));
    when(queueRepository.findEntry("fresh"))
        .thenReturn(Optional.of(entry("fresh", 1000, MatchMode.QUICK, 10)));
    when(queueRepository.findEntry("stale"))
        .thenReturn(Optional.of(entry("stale", 1000, MatchMode.QUICK, 600)));
    when(queueRepository.findEntry("orphan")).thenReturn(Optional.empty());
    when(queueRepository.remove(anyString())).thenReturn(true);

    final int removed = matchQueue.cleanupExpired(Duration.ofMinutes(5));

    assertThat(removed).isEqualTo(2);
    verify(queueRepository).remove("stale");
    verify(queueRepository).remove("orphan");
    verify(queueRepository, never()).remove("fresh");
  }

  @Test
  void statisticsAggregatesSkillAndWait() {
    when(queueRepository.findAllQueuedUserIds()).thenReturn(List.of("a", "b"));
    when(queueRepository.findEntry("a"))
        .thenReturn(Optional.of(entry("a", 1000, MatchMode.QUICK, 10)));
    when(queueRepository.findEntry("b"))
        .thenReturn(Optional.of(entry("b", 1500, MatchMode.QUICK, 30)));

    final QueueStatistics statistics = matchQueue.statistics();

    assertThat(statistics.totalPlayers()).isEqualTo(2);
    assertThat(statistics.averageSkill()).isEqualTo(1250.0);
    assertThat(statistics.averageWaitSeconds()).isEqualTo(20);
    assertThat(statistics.longestWaitSeconds()).isEqualTo(30);
  }

  @Test
  void matchWaitingContinuesAfterFailure() {
    when(queueRepository.findAllQueuedUserIds()).thenReturn(List.of("a", "b"));
    when(queueRepository.findEntry("a"))
        .thenReturn(Optional.of(entry("a", 1000, MatchMode.QUICK, 10)));
    when(queueRepository.findEntry("b"))
        .thenReturn(Optional.of(entry("b", 4000, MatchMode.QUICK, 10)));
    when(queueRepository.findCandidates(700, 1300)).thenThrow(new IllegalStateException("boom"));
    when(queueRepository.findCandidates(3700, 4300)).thenReturn(List.of());

    assertThat(matchQueue.matchWaiting()).isZero();

    verify(metrics).recordDependencyError("match_waiting");
    verify(queueRepository).findCandidates(3700, 4300);
  }

  private static QueueEntry entry(String userId, int skill, MatchMode mode, long waitedSeconds) {
    return new QueueEntry(
        userId,
        userId,
        skill,
        mode,
        FIXED_NOW.minusSeconds(waitedSeconds),
        List.of(new TeamMember(userId, userId, skill)));
  }

  private static Room roomFrom(CreateRoomCommand command) {
    return Room.builder()
        .id(command.roomId())
        .name(command.name())
        .type(command.type())
        .status(RoomStatus.WAITING)
        .maxPlayers(command.maxPlayers())
        .creatorId(command.members().get(0).userId())
        .gameSettings(command.gameSettings())
        .countdownStartedAt(FIXED_NOW)
        .version(1)
        .build();
  }
}
