/*
 * どこで: Notification Repository 層
 * 何を: プロジェクト単位の「メール送信可能ユーザー集合」のキャッシュ
 * なぜ: 同じプロジェクトへの連続アラートで設定解決クエリを繰り返さないため
 */
package com.issuealert.notification.repository;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

public interface SendableUserCache {

  Optional<Set<Long>> get(long projectId);

  void put(long projectId, Set<Long> userIds, Duration ttl);

  void evict(long projectId);

  static String cacheKey(long projectId) {
    return "mail:send_to:" + projectId;
  }
}
