/*
 * どこで: Arena Repository 層（Redis 実装）
 * 何を: ルームの作成/CAS 更新/削除を Lua スクリプトで 1 往復に閉じて実行する
 * なぜ: 同じルームへの並行イベントで読み取り→書き込みの間に更新が失われないようにするため
 */
package com.example.arena.repository;

import com.example.arena.model.Room;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisRoomRepository implements RoomRepository {

  static final String ACTIVE_ROOMS_KEY = "rooms:active";
  static final String WAITING_ROOMS_KEY = "rooms:waiting";

  // KEYS: room, rooms:waiting, rooms:active / ARGV: roomId, ttlSeconds, createdAtMillis, field/value...
  static final RedisScript<Long> CREATE_SCRIPT =
      new DefaultRedisScript<>(
          """
          if redis.call('EXISTS', KEYS[1]) == 1 then
            return 0
          end
          for i = 4, #ARGV, 2 do
            redis.call('HSET', KEYS[1], ARGV[i], ARGV[i + 1])
          end
          redis.call('EXPIRE', KEYS[1], tonumber(ARGV[2]))
          redis.call('SADD', KEYS[3], ARGV[1])
          redis.call('ZADD', KEYS[2], tonumber(ARGV[3]), ARGV[1])
          return 1
          """,
          Long.class);

  // KEYS: room, rooms:waiting / ARGV: roomId, expectedVersion, ttlSeconds, status,
  // createdAtMillis, field/value...
  // 戻り値: 1=適用, 0=version 不一致, -1=ルームなし
  static final RedisScript<Long> COMPARE_AND_SET_SCRIPT =
      new DefaultRedisScript<>(
          """
          local current = redis.call('HGET', KEYS[1], 'version')
          if not current then
            return -1
          end
          if current ~= ARGV[2] then
            return 0
          end
          for i = 6, #ARGV, 2 do
            redis.call('HSET', KEYS[1], ARGV[i], ARGV[i + 1])
          end
          redis.call('HINCRBY', KEYS[1], 'version', 1)
          redis.call('EXPIRE', KEYS[1], tonumber(ARGV[3]))
          if ARGV[4] == 'waiting' then
            redis.call('ZADD', KEYS[2], tonumber(ARGV[5]), ARGV[1])
          else
            redis.call('ZREM', KEYS[2], ARGV[1])
          end
          return 1
          """,
          Long.class);

  // KEYS: room, rooms:waiting, rooms:active, room events / ARGV: roomId, expectedVersion or ''
  static final RedisScript<Long> DELETE_SCRIPT =
      new DefaultRedisScript<>(
          """
          if ARGV[2] ~= '' then
            local current = redis.call('HGET', KEYS[1], 'version')
            if current ~= ARGV[2] then
              return 0
            end
          end
          redis.call('DEL', KEYS[1], KEYS[4])
          redis.call('SREM', KEYS[3], ARGV[1])
          redis.call('ZREM', KEYS[2], ARGV[1])
          return 1
          """,
          Long.class);

  // KEYS: room, room events / ARGV: eventJson, maxEntries, ttlSeconds
  static final RedisScript<Long> APPEND_EVENT_SCRIPT =
      new DefaultRedisScript<>(
          """
          if redis.call('EXISTS', KEYS[1]) == 0 then
            return 0
          end
          redis.call('RPUSH', KEYS[2], ARGV[1])
          redis.call('LTRIM', KEYS[2], -tonumber(ARGV[2]), -1)
          redis.call('EXPIRE', KEYS[2], ARGV[3])
          return 1
          """,
          Long.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final RoomHashCodec codec;

  public RedisRoomRepository(StringRedisTemplate redisTemplate, RoomHashCodec codec) {
    this.redisTemplate = redisTemplate;
    this.codec = codec;
  }

  @Override
  public boolean create(Room room, Duration ttl) {
    final List<String> args = new ArrayList<>();
    args.add(room.id());
    args.add(Long.toString(ttl.toSeconds()));
    args.add(Long.toString(room.createdAt().toEpochMilli()));
    appendFields(args, codec.encode(room));
    args.add(RoomHashCodec.FIELD_VERSION);
    args.add(Long.toString(room.version()));
    final Long result =
        redisTemplate.execute(
            CREATE_SCRIPT,
            List.of(roomKey(room.id()), WAITING_ROOMS_KEY, ACTIVE_ROOMS_KEY),
            args.toArray());
    return result != null && result == 1L;
  }

  @Override
  public Optional<Room> findById(String roomId) {
    final Map<Object, Object> raw = redisTemplate.opsForHash().entries(roomKey(roomId));
    if (raw == null || raw.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(codec.decode(raw));
  }

  @Override
  public CasOutcome compareAndSet(Room updated, long expectedVersion, Duration ttl) {
    final List<String> args = new ArrayList<>();
    args.add(updated.id());
    args.add(Long.toString(expectedVersion));
    args.add(Long.toString(ttl.toSeconds()));
    args.add(updated.status().value());
    args.add(Long.toString(updated.createdAt().toEpochMilli()));
    appendFields(args, codec.encode(updated));
    final Long result =
        redisTemplate.execute(
            COMPARE_AND_SET_SCRIPT,
            List.of(roomKey(updated.id()), WAITING_ROOMS_KEY),
            args.toArray());
    if (result == null || result == 0L) {
      return CasOutcome.VERSION_MISMATCH;
    }
    return result < 0 ? CasOutcome.NOT_FOUND : CasOutcome.APPLIED;
  }

  @Override
  public boolean delete(String roomId, Long expectedVersion) {
    final Long result =
        redisTemplate.execute(
            DELETE_SCRIPT,
            List.of(roomKey(roomId), WAITING_ROOMS_KEY, ACTIVE_ROOMS_KEY, eventsKey(roomId)),
            roomId,
            expectedVersion == null ? "" : Long.toString(expectedVersion));
    return result != null && result == 1L;
  }

  @Override
  public List<String> findWaitingRoomIds(long offset, long count) {
    final Set<String> ids =
        redisTemplate.opsForZSet().reverseRange(WAITING_ROOMS_KEY, offset, offset + count - 1);
    return ids == null ? List.of() : List.copyOf(ids);
  }

  @Override
  public Set<String> findActiveRoomIds() {
    final Set<String> ids = redisTemplate.opsForSet().members(ACTIVE_ROOMS_KEY);
    return ids == null ? Set.of() : ids;
  }

  @Override
  public void removeFromIndexes(String roomId) {
    redisTemplate.opsForSet().remove(ACTIVE_ROOMS_KEY, roomId);
    redisTemplate.opsForZSet().remove(WAITING_ROOMS_KEY, roomId);
  }

  @Override
  public boolean appendEvent(String roomId, String eventJson, int maxEntries, Duration ttl) {
    final Long result =
        redisTemplate.execute(
            APPEND_EVENT_SCRIPT,
            List.of(roomKey(roomId), eventsKey(roomId)),
            eventJson,
            Integer.toString(maxEntries),
            Long.toString(ttl.toSeconds()));
    return result != null && result == 1L;
  }

  @Override
  public List<String> findRecentEvents(String roomId, int limit) {
    final List<String> events = redisTemplate.opsForList().range(eventsKey(roomId), -limit, -1);
    return events == null ? List.of() : events;
  }

  static String roomKey(String roomId) {
    return "room:" + roomId;
  }

  static String eventsKey(String roomId) {
    return "room:events:" + roomId;
  }

  private static void appendFields(List<String> args, Map<String, String> fields) {
    for (Map.Entry<String, String> field : fields.entrySet()) {
      args.add(field.getKey());
      args.add(field.getValue());
    }
  }
}
