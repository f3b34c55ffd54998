package com.example.arena.repository;

import com.example.arena.model.MatchMode;
import com.example.arena.model.QueueEntry;
import com.example.arena.model.TeamMember;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisMatchQueueRepository implements MatchQueueRepository {

  private static final Logger logger = LoggerFactory.getLogger(RedisMatchQueueRepository.class);

  static final String QUEUE_KEY = "matchmaking:queue";
  static final String STATUS_QUEUED = "QUEUED";
  static final String STATUS_MATCHED = "MATCHED";

  private static final String FIELD_USER_ID = "user_id";
  private static final String FIELD_USERNAME = "username";
  private static final String FIELD_SKILL_LEVEL = "skill_level";
  private static final String FIELD_MODE = "mode";
  private static final String FIELD_MEMBERS = "members";
  private static final String FIELD_JOINED_AT = "joined_at";
  private static final String FIELD_STATUS = "status";
  private static final String FIELD_SESSION_ID = "session_id";

  private static final TypeReference<List<TeamMember>> MEMBERS_TYPE = new TypeReference<>() {};

  static final String MEMBER_KEY_PREFIX = "matchmaking:member:";

  // player hash の members(JSON) から、owner に紐付いたメンバー索引だけを消す
  private static final String RELEASE_MEMBERS_FUNCTION =
      """
      local function release_members(player_key, owner)
        local raw = redis.call('HGET', player_key, 'members')
        if not raw or raw == '' then
          return
        end
        for _, member in ipairs(cjson.decode(raw)) do
          local member_key = '%s' .. member['user_id']
          if redis.call('GET', member_key) == owner then
            redis.call('DEL', member_key)
          end
        end
      end
      """
          .formatted(MEMBER_KEY_PREFIX);

  // KEYS: queue, player, member... / ARGV: userId, skill, ttlSeconds, field/value...
  // 戻り値: 1=登録, -1=別エントリに並んでいるメンバーがいる
  static final RedisScript<Long> ENQUEUE_SCRIPT =
      new DefaultRedisScript<>(
          RELEASE_MEMBERS_FUNCTION
              + """
              for i = 3, #KEYS do
                local owner = redis.call('GET', KEYS[i])
                if owner and owner ~= ARGV[1] then
                  return -1
                end
              end
              if redis.call('HGET', KEYS[2], 'status') == 'QUEUED' then
                release_members(KEYS[2], ARGV[1])
              end
              redis.call('DEL', KEYS[2])
              for i = 4, #ARGV, 2 do
                redis.call('HSET', KEYS[2], ARGV[i], ARGV[i + 1])
              end
              redis.call('EXPIRE', KEYS[2], tonumber(ARGV[3]))
              for i = 3, #KEYS do
                redis.call('SET', KEYS[i], ARGV[1], 'EX', tonumber(ARGV[3]))
              end
              redis.call('ZADD', KEYS[1], tonumber(ARGV[2]), ARGV[1])
              return 1
              """,
          Long.class);

  // KEYS: queue, player / ARGV: userId
  static final RedisScript<Long> DEQUEUE_SCRIPT =
      new DefaultRedisScript<>(
          RELEASE_MEMBERS_FUNCTION
              + """
              local removed = redis.call('ZREM', KEYS[1], ARGV[1])
              if redis.call('HGET', KEYS[2], 'status') == 'QUEUED' then
                release_members(KEYS[2], ARGV[1])
                redis.call('DEL', KEYS[2])
              end
              return removed
              """,
          Long.class);

  // KEYS: queue, player(self), player(opponent) / ARGV: self, opponent, sessionId, ttlSeconds
  // 戻り値: 1=確保, -1=自分がいない, -2=相手がいない
  static final RedisScript<Long> CLAIM_PAIR_SCRIPT =
      new DefaultRedisScript<>(
          RELEASE_MEMBERS_FUNCTION
              + """
              if not redis.call('ZSCORE', KEYS[1], ARGV[1]) then
                return -1
              end
              if not redis.call('ZSCORE', KEYS[1], ARGV[2]) then
                return -2
              end
              redis.call('ZREM', KEYS[1], ARGV[1], ARGV[2])
              for i = 2, 3 do
                release_members(KEYS[i], ARGV[i - 1])
                redis.call('DEL', KEYS[i])
                redis.call('HSET', KEYS[i], 'status', 'MATCHED', 'session_id', ARGV[3])
                redis.call('EXPIRE', KEYS[i], tonumber(ARGV[4]))
              end
              return 1
              """,
          Long.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public RedisMatchQueueRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public EnqueueOutcome upsert(QueueEntry entry, Duration ttl) {
    final Map<String, String> fields = new LinkedHashMap<>();
    fields.put(FIELD_USER_ID, entry.userId());
    fields.put(FIELD_USERNAME, entry.username() == null ? "" : entry.username());
    fields.put(FIELD_SKILL_LEVEL, Integer.toString(entry.skillLevel()));
    fields.put(FIELD_MODE, entry.mode().value());
    fields.put(FIELD_MEMBERS, writeMembers(entry.members()));
    fields.put(FIELD_JOINED_AT, entry.joinedAt().toString());
    fields.put(FIELD_STATUS, STATUS_QUEUED);

    final List<String> args = new ArrayList<>();
    args.add(entry.userId());
    args.add(Integer.toString(entry.skillLevel()));
    args.add(Long.toString(ttl.toSeconds()));
    for (Map.Entry<String, String> field : fields.entrySet()) {
      args.add(field.getKey());
      args.add(field.getValue());
    }
    final List<String> keys = new ArrayList<>();
    keys.add(QUEUE_KEY);
    keys.add(playerKey(entry.userId()));
    for (TeamMember member : entry.members()) {
      keys.add(memberKey(member.userId()));
    }
    final Long result = redisTemplate.execute(ENQUEUE_SCRIPT, keys, args.toArray());
    if (result == null) {
      throw new IllegalStateException("enqueue script returned no result");
    }
    return result == 1L ? EnqueueOutcome.QUEUED : EnqueueOutcome.MEMBER_ALREADY_QUEUED;
  }

  @Override
  public boolean remove(String userId) {
    final Long removed =
        redisTemplate.execute(DEQUEUE_SCRIPT, List.of(QUEUE_KEY, playerKey(userId)), userId);
    return removed != null && removed > 0;
  }

  @Override
  public Optional<QueueEntry> findEntry(String userId) {
    final Map<String, String> fields = readPlayer(userId);
    if (!STATUS_QUEUED.equals(fields.get(FIELD_STATUS))) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new QueueEntry(
              fields.get(FIELD_USER_ID),
              emptyToNull(fields.get(FIELD_USERNAME)),
              Integer.parseInt(fields.get(FIELD_SKILL_LEVEL)),
              MatchMode.fromValue(fields.get(FIELD_MODE)),
              Instant.parse(fields.get(FIELD_JOINED_AT)),
              readMembers(fields.get(FIELD_MEMBERS))));
    } catch (RuntimeException ex) {
      // 壊れたメタデータは待機者として扱わず、cleanup で取り除かせる
      logger.warn("queue entry metadata is unreadable userId={}", userId, ex);
      return Optional.empty();
    }
  }

  @Override
  public Optional<String> findMatchedSessionId(String userId) {
    final Map<String, String> fields = readPlayer(userId);
    if (!STATUS_MATCHED.equals(fields.get(FIELD_STATUS))) {
      return Optional.empty();
    }
    return Optional.ofNullable(emptyToNull(fields.get(FIELD_SESSION_ID)));
  }

  @Override
  public List<QueueEntry> findCandidates(int minSkill, int maxSkill) {
    final Set<String> ids = redisTemplate.opsForZSet().rangeByScore(QUEUE_KEY, minSkill, maxSkill);
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    final List<QueueEntry> entries = new ArrayList<>(ids.size());
    for (String id : ids) {
      findEntry(id).ifPresent(entries::add);
    }
    return entries;
  }

  @Override
  public List<String> findAllQueuedUserIds() {
    final Set<String> ids = redisTemplate.opsForZSet().range(QUEUE_KEY, 0, -1);
    return ids == null ? List.of() : List.copyOf(ids);
  }

  @Override
  public Optional<Long> rank(String userId) {
    return Optional.ofNullable(redisTemplate.opsForZSet().rank(QUEUE_KEY, userId));
  }

  @Override
  public long size() {
    final Long size = redisTemplate.opsForZSet().size(QUEUE_KEY);
    return size == null ? 0 : size;
  }

  @Override
  public ClaimOutcome claimPair(
      String userId, String opponentId, String sessionId, Duration matchedTtl) {
    final Long result =
        redisTemplate.execute(
            CLAIM_PAIR_SCRIPT,
            List.of(QUEUE_KEY, playerKey(userId), playerKey(opponentId)),
            userId,
            opponentId,
            sessionId,
            Long.toString(matchedTtl.toSeconds()));
    if (result == null) {
      throw new IllegalStateException("claim script returned no result");
    }
    if (result == 1L) {
      return ClaimOutcome.CLAIMED;
    }
    return result == -1L ? ClaimOutcome.SELF_MISSING : ClaimOutcome.OPPONENT_MISSING;
  }

  static String playerKey(String userId) {
    return "player:" + userId;
  }

  static String memberKey(String userId) {
    return MEMBER_KEY_PREFIX + userId;
  }

  private Map<String, String> readPlayer(String userId) {
    final Map<Object, Object> raw = redisTemplate.opsForHash().entries(playerKey(userId));
    final Map<String, String> map = new HashMap<>();
    if (raw == null) {
      return map;
    }
    for (Map.Entry<Object, Object> e : raw.entrySet()) {
      map.put(
          String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
    }
    return map;
  }

  private String writeMembers(List<TeamMember> members) {
    try {
      return objectMapper.writeValueAsString(members);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("queue members serialization failed", ex);
    }
  }

  private List<TeamMember> readMembers(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, MEMBERS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("queue members are corrupted", ex);
    }
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
