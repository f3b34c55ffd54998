/*
 * どこで: RedisMatchQueueRepository の統合テスト
 * 何を: 実 Redis 上で登録/取消/確保スクリプトのメンバー索引を検証する
 * なぜ: 同じプレイヤーがソロとチーム、または 2 チームに同時に並んで 2 つのルームへ入らないことを保証するため
 */
package com.example.arena.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.arena.model.MatchMode;
import com.example.arena.model.QueueEntry;
import com.example.arena.model.TeamMember;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;

class RedisMatchQueueRepositoryContainerTest {

  private static final Instant JOINED_AT = Instant.parse("2026-01-17T00:00:00Z");
  private static final Duration TTL = Duration.ofMinutes(10);

  static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  private static final LettuceConnectionFactory CONNECTION_FACTORY;

  static {
    REDIS.start();
    CONNECTION_FACTORY =
        new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
    CONNECTION_FACTORY.afterPropertiesSet();
  }

  private final StringRedisTemplate redisTemplate = new StringRedisTemplate(CONNECTION_FACTORY);
  private final RedisMatchQueueRepository repository =
      new RedisMatchQueueRepository(redisTemplate, new ObjectMapper());

  @AfterAll
  static void closeConnection() {
    CONNECTION_FACTORY.destroy();
  }

  @BeforeEach
  void flush() {
    final Set<String> keys = redisTemplate.keys("*");
    if (keys != null && !keys.isEmpty()) {
      redisTemplate.delete(keys);
    }
  }

  @Test
  void soloPlayerCannotAlsoJoinATeam() {
    assertThat(repository.upsert(solo("m2", 1000), TTL)).isEqualTo(EnqueueOutcome.QUEUED);

    assertThat(repository.upsert(team("lead", "m2"), TTL))
        .isEqualTo(EnqueueOutcome.MEMBER_ALREADY_QUEUED);

    assertThat(repository.findAllQueuedUserIds()).containsExactly("m2");
    assertThat(redisTemplate.hasKey(RedisMatchQueueRepository.playerKey("lead"))).isFalse();
  }

  @Test
  void teamMemberCannotQueueSoloOrInAnotherTeam() {
    assertThat(repository.upsert(team("lead", "m2"), TTL)).isEqualTo(EnqueueOutcome.QUEUED);

    assertThat(repository.upsert(solo("m2", 1000), TTL))
        .isEqualTo(EnqueueOutcome.MEMBER_ALREADY_QUEUED);
    assertThat(repository.upsert(team("other", "m2"), TTL))
        .isEqualTo(EnqueueOutcome.MEMBER_ALREADY_QUEUED);

    assertThat(repository.findAllQueuedUserIds()).containsExactly("lead");
    assertThat(redisTemplate.opsForValue().get(RedisMatchQueueRepository.memberKey("m2")))
        .isEqualTo("lead");
  }

  @Test
  void leaderCanRequeueWithDifferentMembers() {
    repository.upsert(team("lead", "m2"), TTL);

    assertThat(repository.upsert(team("lead", "m3"), TTL)).isEqualTo(EnqueueOutcome.QUEUED);

    assertThat(redisTemplate.hasKey(RedisMatchQueueRepository.memberKey("m2"))).isFalse();
    assertThat(repository.upsert(solo("m2", 1000), TTL)).isEqualTo(EnqueueOutcome.QUEUED);
  }

  @Test
  void dequeueReleasesMembers() {
    repository.upsert(team("lead", "m2"), TTL);

    assertThat(repository.remove("lead")).isTrue();

    assertThat(redisTemplate.hasKey(RedisMatchQueueRepository.memberKey("lead"))).isFalse();
    assertThat(redisTemplate.hasKey(RedisMatchQueueRepository.memberKey("m2"))).isFalse();
    assertThat(repository.upsert(solo("m2", 1000), TTL)).isEqualTo(EnqueueOutcome.QUEUED);
  }

  @Test
  void claimReleasesMembersOfBothEntries() {
    repository.upsert(team("lead", "m2"), TTL);
    repository.upsert(team("rival", "m4"), TTL);

    assertThat(repository.claimPair("lead", "rival", "quick_1", Duration.ofMinutes(2)))
        .isEqualTo(ClaimOutcome.CLAIMED);

    assertThat(repository.findAllQueuedUserIds()).isEmpty();
    assertThat(redisTemplate.keys(RedisMatchQueueRepository.MEMBER_KEY_PREFIX + "*")).isEmpty();
    assertThat(repository.findMatchedSessionId("lead")).contains("quick_1");
    assertThat(repository.upsert(solo("m2", 1000), TTL)).isEqualTo(EnqueueOutcome.QUEUED);
  }

  private static QueueEntry solo(String userId, int skill) {
    return new QueueEntry(
        userId,
        userId,
        skill,
        MatchMode.QUICK,
        JOINED_AT,
        List.of(new TeamMember(userId, userId, skill)));
  }

  private static QueueEntry team(String leader, String member) {
    return new QueueEntry(
        leader,
        leader,
        1000,
        MatchMode.QUICK,
        JOINED_AT,
        List.of(new TeamMember(leader, leader, 1000), new TeamMember(member, member, 1000)));
  }
}
