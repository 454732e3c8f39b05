package com.issuealert.notification.repository;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/** 送信可能ユーザー ID をカンマ区切り文字列で TTL 付き保存する。空集合は空文字で保存する。 */
@Repository
@ConditionalOnProperty(
    name = "notification.storage.backend",
    havingValue = "redis",
    matchIfMissing = true)
public class RedisSendableUserCache implements SendableUserCache {

  private static final Splitter SPLITTER = Splitter.on(',').omitEmptyStrings().trimResults();
  private static final Joiner JOINER = Joiner.on(',');

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisSendableUserCache(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public Optional<Set<Long>> get(long projectId) {
    final String value = redisTemplate.opsForValue().get(SendableUserCache.cacheKey(projectId));
    if (value == null) {
      return Optional.empty();
    }
    final Set<Long> userIds = new LinkedHashSet<>();
    for (String part : SPLITTER.split(value)) {
      userIds.add(Long.parseLong(part));
    }
    return Optional.of(userIds);
  }

  @Override
  public void put(long projectId, Set<Long> userIds, Duration ttl) {
    redisTemplate.opsForValue().set(SendableUserCache.cacheKey(projectId), JOINER.join(userIds), ttl);
  }

  @Override
  public void evict(long projectId) {
    redisTemplate.delete(SendableUserCache.cacheKey(projectId));
  }
}
