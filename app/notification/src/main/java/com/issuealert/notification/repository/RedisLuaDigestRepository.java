/*
 * どこで: Notification Repository 層
 * 何を: digest バッファを Redis List/Hash/ZSet と Lua スクリプトで保持する
 * なぜ: 複数ワーカーからの追記と drain を取りこぼし/二重配信なく直列化するため
 */
package com.issuealert.notification.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuealert.notification.model.DigestKey;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.model.DigestTimeline;
import com.issuealert.notification.model.DigestTimelineState;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(
    name = "notification.storage.backend",
    havingValue = "redis",
    matchIfMissing = true)
public class RedisLuaDigestRepository implements DigestRepository {

  private static final Logger logger = LoggerFactory.getLogger(RedisLuaDigestRepository.class);

  static final String WAITING_KEY = "digest:schedule:waiting";
  static final String READY_KEY = "digest:schedule:ready";

  private static final String FIELD_STATE = "state";
  private static final String FIELD_DEADLINE = "deadline";
  private static final String FIELD_WINDOW_START = "window_start";
  private static final String FIELD_INCREMENT = "increment";
  private static final String FIELD_MAXIMUM = "maximum";

  // KEYS: records, timeline, waiting, ready / ARGV: record, now, increment, maximum, digestKey
  private static final String ADD_LUA =
      """
      redis.call('RPUSH', KEYS[1], ARGV[1])
      local state = redis.call('HGET', KEYS[2], 'state')
      local now = tonumber(ARGV[2])
      if not state then
        redis.call('HSET', KEYS[2], 'state', 'READY', 'deadline', now, 'window_start', now,
          'increment', ARGV[3], 'maximum', ARGV[4])
        redis.call('ZADD', KEYS[4], now, ARGV[5])
        return 1
      end
      if state == 'WAITING' then
        local windowStart = tonumber(redis.call('HGET', KEYS[2], 'window_start'))
        local deadline = math.min(now + tonumber(ARGV[3]), windowStart + tonumber(ARGV[4]))
        redis.call('HSET', KEYS[2], 'deadline', deadline, 'increment', ARGV[3], 'maximum', ARGV[4])
        redis.call('ZADD', KEYS[3], deadline, ARGV[5])
      end
      return 0
      """;

  // KEYS: records, timeline, waiting, ready / ARGV: now, digestKey
  private static final String DRAIN_LUA =
      """
      local records = redis.call('LRANGE', KEYS[1], 0, -1)
      redis.call('DEL', KEYS[1])
      redis.call('ZREM', KEYS[4], ARGV[2])
      if #records == 0 then
        redis.call('DEL', KEYS[2])
        redis.call('ZREM', KEYS[3], ARGV[2])
        return '[]'
      end
      local now = tonumber(ARGV[1])
      local increment = tonumber(redis.call('HGET', KEYS[2], 'increment') or '0')
      local deadline = now + increment
      redis.call('HSET', KEYS[2], 'state', 'WAITING', 'window_start', now, 'deadline', deadline)
      redis.call('ZADD', KEYS[3], deadline, ARGV[2])
      return cjson.encode(records)
      """;

  // KEYS: records, timeline, waiting, ready / ARGV: now, digestKey, record...
  private static final String RESTORE_LUA =
      """
      for i = #ARGV, 3, -1 do
        redis.call('LPUSH', KEYS[1], ARGV[i])
      end
      local now = tonumber(ARGV[1])
      redis.call('HSET', KEYS[2], 'state', 'READY', 'deadline', now)
      redis.call('HSETNX', KEYS[2], 'window_start', now)
      redis.call('HSETNX', KEYS[2], 'increment', 0)
      redis.call('HSETNX', KEYS[2], 'maximum', 0)
      redis.call('ZREM', KEYS[3], ARGV[2])
      redis.call('ZADD', KEYS[4], now, ARGV[2])
      return #ARGV - 2
      """;

  // KEYS: timeline, waiting, ready / ARGV: now, readyTimeout, digestKey
  private static final String CLAIM_LUA =
      """
      local now = tonumber(ARGV[1])
      local state = redis.call('HGET', KEYS[1], 'state')
      if state == 'WAITING' then
        if tonumber(redis.call('HGET', KEYS[1], 'deadline')) <= now then
          redis.call('HSET', KEYS[1], 'state', 'READY')
          redis.call('ZREM', KEYS[2], ARGV[3])
          redis.call('ZADD', KEYS[3], now, ARGV[3])
          return 1
        end
        return 0
      end
      if state == 'READY' then
        local since = redis.call('ZSCORE', KEYS[3], ARGV[3])
        if since and tonumber(since) <= now - tonumber(ARGV[2]) then
          redis.call('ZADD', KEYS[3], now, ARGV[3])
          return 1
        end
        return 0
      end
      redis.call('ZREM', KEYS[2], ARGV[3])
      redis.call('ZREM', KEYS[3], ARGV[3])
      return 0
      """;

  private static final String TIMELINE_SUFFIX = ":timeline";
  private static final String RECORDS_SUFFIX = ":records";

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private static final RedisScript<Long> ADD_SCRIPT = new DefaultRedisScript<>(ADD_LUA, Long.class);
  private static final RedisScript<String> DRAIN_SCRIPT =
      new DefaultRedisScript<>(DRAIN_LUA, String.class);
  private static final RedisScript<Long> RESTORE_SCRIPT =
      new DefaultRedisScript<>(RESTORE_LUA, Long.class);
  private static final RedisScript<Long> CLAIM_SCRIPT =
      new DefaultRedisScript<>(CLAIM_LUA, Long.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public RedisLuaDigestRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean add(
      DigestKey key,
      DigestRecord record,
      Duration incrementDelay,
      Duration maximumDelay,
      Instant now) {
    final Long created =
        redisTemplate.execute(
            ADD_SCRIPT,
            keys(key),
            serialize(record),
            String.valueOf(now.toEpochMilli()),
            String.valueOf(incrementDelay.toMillis()),
            String.valueOf(maximumDelay.toMillis()),
            key.unsplit());
    return created != null && created == 1L;
  }

  @Override
  public List<DigestRecord> drain(DigestKey key, Instant now) {
    final String raw =
        redisTemplate.execute(
            DRAIN_SCRIPT, keys(key), String.valueOf(now.toEpochMilli()), key.unsplit());
    if (raw == null) {
      return List.of();
    }
    final List<String> values;
    try {
      values = objectMapper.readValue(raw, STRING_LIST);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse drained digest records key=" + key, ex);
    }
    final List<DigestRecord> records = new ArrayList<>(values.size());
    for (String value : values) {
      deserialize(key, value).ifPresent(records::add);
    }
    return records;
  }

  @Override
  public void restore(DigestKey key, List<DigestRecord> records, Instant now) {
    final List<String> args = new ArrayList<>(records.size() + 2);
    args.add(String.valueOf(now.toEpochMilli()));
    args.add(key.unsplit());
    for (DigestRecord record : records) {
      args.add(serialize(record));
    }
    redisTemplate.execute(RESTORE_SCRIPT, keys(key), args.toArray());
  }

  /**
   * 期限到来の候補を ZSet から読み、key ごとのスクリプトで状態を確認しつつ READY へ移す。
   *
   * <p>スケジュール用 ZSet は全 key 共通のため、Redis は単一ノード構成を前提とする。
   */
  @Override
  public List<DigestKey> claimDue(Instant now, Duration readyTimeout, int limit) {
    final long nowMillis = now.toEpochMilli();
    final Set<String> candidates = new LinkedHashSet<>();
    addAll(candidates, redisTemplate.opsForZSet().rangeByScore(WAITING_KEY, 0, nowMillis, 0, limit));
    addAll(
        candidates,
        redisTemplate
            .opsForZSet()
            .rangeByScore(READY_KEY, 0, nowMillis - readyTimeout.toMillis(), 0, limit));
    final List<DigestKey> claimed = new ArrayList<>();
    for (String candidate : candidates) {
      if (claimed.size() >= limit) {
        break;
      }
      final DigestKey key;
      try {
        key = DigestKey.split(candidate);
      } catch (IllegalArgumentException ex) {
        logger.warn("digest schedule entry removed key={}", candidate, ex);
        redisTemplate.opsForZSet().remove(WAITING_KEY, candidate);
        redisTemplate.opsForZSet().remove(READY_KEY, candidate);
        continue;
      }
      final Long moved =
          redisTemplate.execute(
              CLAIM_SCRIPT,
              List.of(timelineKey(key), WAITING_KEY, READY_KEY),
              String.valueOf(nowMillis),
              String.valueOf(readyTimeout.toMillis()),
              candidate);
      if (moved != null && moved == 1L) {
        claimed.add(key);
      }
    }
    return claimed;
  }

  @Override
  public Optional<DigestTimeline> findTimeline(DigestKey key) {
    final Map<Object, Object> fields = redisTemplate.opsForHash().entries(timelineKey(key));
    if (fields == null || fields.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new DigestTimeline(
            DigestTimelineState.valueOf(String.valueOf(fields.get(FIELD_STATE))),
            epochMillis(fields.get(FIELD_DEADLINE)),
            epochMillis(fields.get(FIELD_WINDOW_START)),
            Duration.ofMillis(Long.parseLong(String.valueOf(fields.get(FIELD_INCREMENT)))),
            Duration.ofMillis(Long.parseLong(String.valueOf(fields.get(FIELD_MAXIMUM))))));
  }

  static String recordsKey(DigestKey key) {
    return key.unsplit() + RECORDS_SUFFIX;
  }

  static String timelineKey(DigestKey key) {
    return key.unsplit() + TIMELINE_SUFFIX;
  }

  private static void addAll(Set<String> target, Set<String> values) {
    if (values != null) {
      target.addAll(values);
    }
  }

  private List<String> keys(DigestKey key) {
    return List.of(recordsKey(key), timelineKey(key), WAITING_KEY, READY_KEY);
  }

  private String serialize(DigestRecord record) {
    try {
      return objectMapper.writeValueAsString(record);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize digest record", ex);
    }
  }

  private Optional<DigestRecord> deserialize(DigestKey key, String json) {
    try {
      return Optional.of(objectMapper.readValue(json, DigestRecord.class));
    } catch (JsonProcessingException ex) {
      // 壊れた 1 件で digest 全体を失わないよう破棄して続行する
      logger.warn("digest record dropped key={}", key, ex);
      return Optional.empty();
    }
  }

  private Instant epochMillis(Object value) {
    // Lua の数値は HSET 時に文字列化されるため小数表記も受け付ける
    return Instant.ofEpochMilli((long) Double.parseDouble(String.valueOf(value)));
  }
}
