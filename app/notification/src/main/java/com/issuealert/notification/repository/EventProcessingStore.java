/*
 * どこで: Notification Repository 層
 * 何を: 取り込み処理中のイベント本体を一時保存するストア
 * なぜ: 後段 (通知ハンドラ) がイベント ID からペイロードを取り出せるようにするため
 */
package com.issuealert.notification.repository;

import com.issuealert.notification.model.IssueEvent;
import java.util.Optional;

public interface EventProcessingStore {

  /** 保存したキー ("e:{projectId}:{eventId}") を返す。 */
  String store(IssueEvent event, boolean unprocessed);

  default String store(IssueEvent event) {
    return store(event, false);
  }

  Optional<IssueEvent> get(String key, boolean unprocessed);

  default Optional<IssueEvent> get(String key) {
    return get(key, false);
  }

  /** 処理済み/未処理の両方を削除する。 */
  void deleteByKey(String key);

  default void delete(IssueEvent event) {
    deleteByKey(keyFor(event));
  }

  static String keyFor(IssueEvent event) {
    return "e:" + event.projectId() + ":" + event.eventId();
  }

  static String unprocessedKey(String key) {
    return key + ":u";
  }
}
