/*
 * どこで: Notification Repository 層
 * 何を: digest バッファをプロセス内に保持する実装
 * なぜ: Redis 無しのローカル起動とテストで同じタイムライン規則を使うため
 */
package com.issuealert.notification.repository;

import com.issuealert.notification.model.DigestKey;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.model.DigestTimeline;
import com.issuealert.notification.model.DigestTimelineState;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "notification.storage.backend", havingValue = "memory")
public class InMemoryDigestRepository implements DigestRepository {

  private final Map<DigestKey, List<DigestRecord>> records = new HashMap<>();
  private final Map<DigestKey, DigestTimeline> timelines = new HashMap<>();
  // READY になった時刻。readyTimeout の判定に使う
  private final Map<DigestKey, Instant> readySince = new HashMap<>();

  @Override
  public synchronized boolean add(
      DigestKey key,
      DigestRecord record,
      Duration incrementDelay,
      Duration maximumDelay,
      Instant now) {
    records.computeIfAbsent(key, ignored -> new ArrayList<>()).add(record);
    final DigestTimeline timeline = timelines.get(key);
    if (timeline == null) {
      timelines.put(
          key,
          new DigestTimeline(DigestTimelineState.READY, now, now, incrementDelay, maximumDelay));
      readySince.put(key, now);
      return true;
    }
    if (timeline.state() == DigestTimelineState.WAITING) {
      final Instant extended = now.plus(incrementDelay);
      final Instant ceiling = timeline.windowStart().plus(maximumDelay);
      timelines.put(
          key,
          new DigestTimeline(
              DigestTimelineState.WAITING,
              extended.isBefore(ceiling) ? extended : ceiling,
              timeline.windowStart(),
              incrementDelay,
              maximumDelay));
    }
    return false;
  }

  @Override
  public synchronized List<DigestRecord> drain(DigestKey key, Instant now) {
    final List<DigestRecord> drained = records.remove(key);
    readySince.remove(key);
    final DigestTimeline timeline = timelines.get(key);
    if (drained == null || drained.isEmpty()) {
      timelines.remove(key);
      return List.of();
    }
    final Duration increment = timeline == null ? Duration.ZERO : timeline.incrementDelay();
    final Duration maximum = timeline == null ? Duration.ZERO : timeline.maximumDelay();
    timelines.put(
        key,
        new DigestTimeline(DigestTimelineState.WAITING, now.plus(increment), now, increment, maximum));
    return List.copyOf(drained);
  }

  @Override
  public synchronized void restore(DigestKey key, List<DigestRecord> restored, Instant now) {
    final List<DigestRecord> buffer = new ArrayList<>(restored);
    buffer.addAll(records.getOrDefault(key, List.of()));
    records.put(key, buffer);
    final DigestTimeline timeline = timelines.get(key);
    timelines.put(
        key,
        new DigestTimeline(
            DigestTimelineState.READY,
            now,
            timeline == null ? now : timeline.windowStart(),
            timeline == null ? Duration.ZERO : timeline.incrementDelay(),
            timeline == null ? Duration.ZERO : timeline.maximumDelay()));
    readySince.put(key, now);
  }

  @Override
  public synchronized List<DigestKey> claimDue(Instant now, Duration readyTimeout, int limit) {
    final List<DigestKey> claimed = new ArrayList<>();
    final List<Map.Entry<DigestKey, DigestTimeline>> waiting =
        timelines.entrySet().stream()
            .filter(entry -> entry.getValue().state() == DigestTimelineState.WAITING)
            .filter(entry -> !entry.getValue().deadline().isAfter(now))
            .sorted(Comparator.comparing(entry -> entry.getValue().deadline()))
            .toList();
    for (Map.Entry<DigestKey, DigestTimeline> entry : waiting) {
      if (claimed.size() >= limit) {
        return claimed;
      }
      final DigestTimeline timeline = entry.getValue();
      timelines.put(
          entry.getKey(),
          new DigestTimeline(
              DigestTimelineState.READY,
              timeline.deadline(),
              timeline.windowStart(),
              timeline.incrementDelay(),
              timeline.maximumDelay()));
      readySince.put(entry.getKey(), now);
      claimed.add(entry.getKey());
    }
    final Instant staleBefore = now.minus(readyTimeout);
    final List<DigestKey> stale =
        readySince.entrySet().stream()
            .filter(entry -> !entry.getValue().isAfter(staleBefore))
            .filter(entry -> !claimed.contains(entry.getKey()))
            .map(Map.Entry::getKey)
            .toList();
    for (DigestKey key : stale) {
      if (claimed.size() >= limit) {
        break;
      }
      readySince.put(key, now);
      claimed.add(key);
    }
    return claimed;
  }

  @Override
  public synchronized Optional<DigestTimeline> findTimeline(DigestKey key) {
    return Optional.ofNullable(timelines.get(key));
  }
}
