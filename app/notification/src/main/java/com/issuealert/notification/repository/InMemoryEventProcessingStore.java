package com.issuealert.notification.repository;

import com.issuealert.notification.model.IssueEvent;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/** ローカル起動用。TTL は持たず、削除されるまで保持する。 */
@Repository
@ConditionalOnProperty(name = "notification.storage.backend", havingValue = "memory")
public class InMemoryEventProcessingStore implements EventProcessingStore {

  private final ConcurrentMap<String, IssueEvent> events = new ConcurrentHashMap<>();

  @Override
  public String store(IssueEvent event, boolean unprocessed) {
    final String key = EventProcessingStore.keyFor(event);
    events.put(unprocessed ? EventProcessingStore.unprocessedKey(key) : key, event);
    return key;
  }

  @Override
  public Optional<IssueEvent> get(String key, boolean unprocessed) {
    return Optional.ofNullable(
        events.get(unprocessed ? EventProcessingStore.unprocessedKey(key) : key));
  }

  @Override
  public void deleteByKey(String key) {
    events.remove(key);
    events.remove(EventProcessingStore.unprocessedKey(key));
  }
}
