package com.issuealert.notification.repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/** プロセス内の TTL 付きキャッシュ。期限切れは読み出し時に捨てる。 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.storage.backend", havingValue = "memory")
public class InMemorySendableUserCache implements SendableUserCache {

  private final ConcurrentMap<Long, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  @Override
  public Optional<Set<Long>> get(long projectId) {
    final Entry entry = entries.get(projectId);
    if (entry == null) {
      return Optional.empty();
    }
    if (!Instant.now(clock).isBefore(entry.expiresAt())) {
      entries.remove(projectId, entry);
      return Optional.empty();
    }
    return Optional.of(entry.userIds());
  }

  @Override
  public void put(long projectId, Set<Long> userIds, Duration ttl) {
    entries.put(projectId, new Entry(Set.copyOf(userIds), Instant.now(clock).plus(ttl)));
  }

  @Override
  public void evict(long projectId) {
    entries.remove(projectId);
  }

  private record Entry(Set<Long> userIds, Instant expiresAt) {}
}
