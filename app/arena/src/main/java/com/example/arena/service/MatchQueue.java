/*
 * どこで: Arena サービス層
 * 何を: スキル順の待機キューへの登録と、対戦相手の確保からルーム作成までを行う
 * なぜ: 確保を Lua で原子的に行い、同じプレイヤーが 2 つのルームに入らないようにするため
 */
package com.example.arena.service;

import com.example.arena.api.ApiErrorCode;
import com.example.arena.api.InvalidSessionRequestException;
import com.example.arena.api.QueueEntryNotFoundException;
import com.example.arena.api.SessionConflictException;
import com.example.arena.config.MatchmakingProperties;
import com.example.arena.model.CreateRoomCommand;
import com.example.arena.model.GameSettings;
import com.example.arena.model.MatchMode;
import com.example.arena.model.MatchRequest;
import com.example.arena.model.PairingResult;
import com.example.arena.model.QueueEntry;
import com.example.arena.model.QueueStatistics;
import com.example.arena.model.QueueStatus;
import com.example.arena.model.Room;
import com.example.arena.model.TeamMember;
import com.example.arena.repository.ClaimOutcome;
import com.example.arena.repository.EnqueueOutcome;
import com.example.arena.repository.MatchQueueRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MatchQueue {

  private static final Logger logger = LoggerFactory.getLogger(MatchQueue.class);
  private static final String RANKED_DIFFICULTY = "hard";

  private final MatchQueueRepository queueRepository;
  private final SessionStore sessionStore;
  private final GameEventProcessor gameEventProcessor;
  private final SessionEventPublisher eventPublisher;
  private final MatchSelector matchSelector;
  private final MatchmakingProperties properties;
  private final SessionMetrics metrics;
  private final Clock clock;

  public MatchQueue(
      MatchQueueRepository queueRepository,
      SessionStore sessionStore,
      GameEventProcessor gameEventProcessor,
      SessionEventPublisher eventPublisher,
      MatchSelector matchSelector,
      MatchmakingProperties properties,
      SessionMetrics metrics,
      Clock clock) {
    this.queueRepository = queueRepository;
    this.sessionStore = sessionStore;
    this.gameEventProcessor = gameEventProcessor;
    this.eventPublisher = eventPublisher;
    this.matchSelector = matchSelector;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** キューへ登録する。既に並んでいれば joinedAt と TTL を更新し直す。 */
  public QueueEntry enqueue(MatchRequest request) {
    validate(request);
    final QueueEntry entry = request.toQueueEntry(Instant.now(clock));
    if (queueRepository.upsert(entry, properties.entryTtl())
        == EnqueueOutcome.MEMBER_ALREADY_QUEUED) {
      logger.info(
          "enqueue rejected; a member is queued elsewhere userId={} partySize={}",
          entry.userId(),
          entry.partySize());
      throw new SessionConflictException(
          ApiErrorCode.ALREADY_QUEUED, "a member of this request is already queued");
    }
    logger.info(
        "queued userId={} mode={} skill={} partySize={}",
        entry.userId(),
        entry.mode().value(),
        entry.skillLevel(),
        entry.partySize());
    return entry;
  }

  public boolean dequeue(String userId) {
    final boolean removed = queueRepository.remove(userId);
    if (removed) {
      logger.info("dequeued userId={}", userId);
    }
    return removed;
  }

  public Optional<QueueEntry> findBestMatch(QueueEntry self, int skillRange) {
    final int min = Math.max(0, self.skillLevel() - skillRange);
    final int max = self.skillLevel() + skillRange;
    return matchSelector.select(
        self,
        queueRepository.findCandidates(min, max),
        skillRange,
        Instant.now(clock),
        properties.maxWait());
  }

  /**
   * 登録して即座にペアリングを試みる。
   *
   * <p>相手が並行して確保されていた場合は残りの候補で再試行し、自分が並行して確保されていた場合はそのルームを返す。
   */
  public PairingResult pairAndCreateSession(MatchRequest request) {
    return pair(enqueue(request));
  }

  /** 待機中の全員についてペアリングを試みる。成立したルーム数を返す。 */
  public int matchWaiting() {
    int matched = 0;
    for (String userId : queueRepository.findAllQueuedUserIds()) {
      final Optional<QueueEntry> entry = queueRepository.findEntry(userId);
      if (entry.isEmpty()) {
        continue;
      }
      try {
        if (pair(entry.get()).outcome() == PairingResult.Outcome.MATCHED) {
          matched++;
        }
      } catch (RuntimeException ex) {
        logger.warn("background pairing failed userId={}", userId, ex);
        metrics.recordDependencyError("match_waiting");
      }
    }
    return matched;
  }

  /** maxWait を超えた待機と、メタデータが期限切れになった待機をキューから外す。 */
  public int cleanupExpired(Duration maxWait) {
    final Instant expiredBefore = Instant.now(clock).minus(maxWait);
    int removed = 0;
    for (String userId : queueRepository.findAllQueuedUserIds()) {
      final Optional<QueueEntry> entry = queueRepository.findEntry(userId);
      if (entry.isPresent() && !entry.get().joinedAt().isBefore(expiredBefore)) {
        continue;
      }
      if (queueRepository.remove(userId)) {
        removed++;
        logger.info(
            "queue entry expired userId={} metadataMissing={}", userId, entry.isEmpty());
      }
    }
    return removed;
  }

  public QueueStatus queueStatus(String userId) {
    final Optional<QueueEntry> entry = queueRepository.findEntry(userId);
    if (entry.isPresent()) {
      return queuedStatus(entry.get());
    }
    return queueRepository
        .findMatchedSessionId(userId)
        .map(QueueStatus::matched)
        .orElseThrow(() -> new QueueEntryNotFoundException(userId));
  }

  public QueueStatistics statistics() {
    final Instant now = Instant.now(clock);
    final List<QueueEntry> entries = new ArrayList<>();
    for (String userId : queueRepository.findAllQueuedUserIds()) {
      queueRepository.findEntry(userId).ifPresent(entries::add);
    }
    if (entries.isEmpty()) {
      return QueueStatistics.empty();
    }
    long totalSkill = 0;
    long totalWait = 0;
    long longestWait = 0;
    for (QueueEntry entry : entries) {
      final long wait = Math.max(0, Duration.between(entry.joinedAt(), now).toSeconds());
      totalSkill += entry.skillLevel();
      totalWait += wait;
      longestWait = Math.max(longestWait, wait);
    }
    return new QueueStatistics(
        entries.size(),
        (double) totalSkill / entries.size(),
        totalWait / entries.size(),
        longestWait);
  }

  private PairingResult pair(QueueEntry self) {
    final int range = skillRangeFor(self.mode());
    for (int attempt = 0; attempt < properties.claimMaxAttempts(); attempt++) {
      final Optional<QueueEntry> candidate = findBestMatch(self, range);
      if (candidate.isEmpty()) {
        break;
      }
      final QueueEntry opponent = candidate.get();
      final String roomId = self.mode().value() + "_" + UUID.randomUUID();
      final ClaimOutcome claim =
          queueRepository.claimPair(
              self.userId(), opponent.userId(), roomId, properties.matchedTtl());
      if (claim == ClaimOutcome.CLAIMED) {
        final Room room = createMatchedRoom(roomId, self, opponent);
        return PairingResult.matched(
            room, opponent.members().stream().map(TeamMember::userId).toList());
      }
      if (claim == ClaimOutcome.SELF_MISSING) {
        metrics.recordMatchResult("already_matched");
        return queueRepository
            .findMatchedSessionId(self.userId())
            .map(sessionId -> PairingResult.alreadyMatched(QueueStatus.matched(sessionId)))
            .orElseGet(() -> PairingResult.queued(QueueStatus.notQueued(queueRepository.size())));
      }
      metrics.recordMatchResult("opponent_taken");
      logger.debug(
          "opponent claimed concurrently userId={} opponent={} attempt={}",
          self.userId(),
          opponent.userId(),
          attempt + 1);
    }
    return PairingResult.queued(queuedStatus(self));
  }

  private Room createMatchedRoom(String roomId, QueueEntry self, QueueEntry opponent) {
    final List<TeamMember> members = new ArrayList<>(self.members());
    members.addAll(opponent.members());
    final Room room;
    try {
      room =
          sessionStore.create(
              new CreateRoomCommand(
                  roomId,
                  self.mode().value() + " match",
                  self.mode().value(),
                  members.size(),
                  settingsFor(self.mode()),
                  members,
                  true));
    } catch (RuntimeException ex) {
      // 確保済みの 2 件をキューへ戻してから失敗を返す
      requeue(self);
      requeue(opponent);
      metrics.recordMatchResult("create_failed");
      logger.warn(
          "matched room creation failed; requeued userId={} opponent={}",
          self.userId(),
          opponent.userId(),
          ex);
      throw ex;
    }
    final Instant now = Instant.now(clock);
    metrics.recordMatchResult("matched");
    metrics.recordTimeToMatch(self.joinedAt(), now);
    metrics.recordTimeToMatch(opponent.joinedAt(), now);
    logger.info(
        "match found sessionId={} userId={} opponent={} mode={} skillDiff={}",
        roomId,
        self.userId(),
        opponent.userId(),
        self.mode().value(),
        Math.abs(self.skillLevel() - opponent.skillLevel()));

    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("mode", self.mode().value());
    data.put("matched", true);
    data.put("participants", members.stream().map(TeamMember::userId).toList());
    eventPublisher.publish("session-created", roomId, self.userId(), data);
    gameEventProcessor.scheduleStart(room);
    return room;
  }

  private void requeue(QueueEntry entry) {
    if (queueRepository.upsert(entry, properties.entryTtl())
        == EnqueueOutcome.MEMBER_ALREADY_QUEUED) {
      logger.warn(
          "requeue skipped; a member joined another entry meanwhile userId={}", entry.userId());
    }
  }

  private QueueStatus queuedStatus(QueueEntry entry) {
    final long position = queueRepository.rank(entry.userId()).map(rank -> rank + 1).orElse(0L);
    final long waitSeconds =
        Math.max(0, Duration.between(entry.joinedAt(), Instant.now(clock)).toSeconds());
    return new QueueStatus(
        QueueStatus.State.QUEUED,
        position,
        queueRepository.size(),
        waitSeconds,
        entry.skillLevel(),
        null);
  }

  private GameSettings settingsFor(MatchMode mode) {
    if (mode == MatchMode.RANKED) {
      return new GameSettings(
          mode.value(),
          (int) properties.rankedTimeLimit().toSeconds(),
          RANKED_DIFFICULTY,
          null,
          true);
    }
    return new GameSettings(mode.value(), null, null, properties.quickPerfectScore(), false);
  }

  private int skillRangeFor(MatchMode mode) {
    return mode == MatchMode.RANKED ? properties.rankedSkillRange() : properties.quickSkillRange();
  }

  private void validate(MatchRequest request) {
    if (request == null || request.userId() == null || request.userId().isBlank()) {
      throw new InvalidSessionRequestException("userId is required");
    }
    if (request.mode() == null) {
      throw new InvalidSessionRequestException("mode is required");
    }
    final List<TeamMember> members = request.members();
    if (request instanceof MatchRequest.Team) {
      if (members.size() < 2 || members.size() > properties.maxTeamSize()) {
        throw new InvalidSessionRequestException(
            "team size must be between 2 and " + properties.maxTeamSize());
      }
      if (members.stream().noneMatch(member -> request.userId().equals(member.userId()))) {
        throw new InvalidSessionRequestException("team members must include the leader");
      }
    }
    final Set<String> ids = new HashSet<>();
    for (TeamMember member : members) {
      if (member.userId() == null || member.userId().isBlank()) {
        throw new InvalidSessionRequestException("member user_id is required");
      }
      if (!ids.add(member.userId())) {
        throw new InvalidSessionRequestException("duplicate team member " + member.userId());
      }
      if (member.skillLevel() < 0 || member.skillLevel() > properties.maxSkillLevel()) {
        throw new InvalidSessionRequestException(
            "skill_level must be between 0 and " + properties.maxSkillLevel());
      }
    }
  }
}
