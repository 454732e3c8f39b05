package com.issuealert.notification.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuealert.notification.config.EventStoreProperties;
import com.issuealert.notification.model.IssueEvent;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/** イベントを JSON で TTL 付き保存する。未処理版はキー末尾に ":u" を付ける。 */
@Repository
@ConditionalOnProperty(
    name = "notification.storage.backend",
    havingValue = "redis",
    matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "StringRedisTemplate/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class RedisEventProcessingStore implements EventProcessingStore {

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final EventStoreProperties properties;

  public RedisEventProcessingStore(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, EventStoreProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public String store(IssueEvent event, boolean unprocessed) {
    final String key = EventProcessingStore.keyFor(event);
    final String json;
    try {
      json = objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize event key=" + key, ex);
    }
    redisTemplate.opsForValue().set(redisKey(key, unprocessed), json, properties.ttl());
    return key;
  }

  @Override
  public Optional<IssueEvent> get(String key, boolean unprocessed) {
    final String json = redisTemplate.opsForValue().get(redisKey(key, unprocessed));
    if (json == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(json, IssueEvent.class));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to deserialize event key=" + key, ex);
    }
  }

  @Override
  public void deleteByKey(String key) {
    redisTemplate.delete(List.of(key, EventProcessingStore.unprocessedKey(key)));
  }

  private String redisKey(String key, boolean unprocessed) {
    return unprocessed ? EventProcessingStore.unprocessedKey(key) : key;
  }
}
