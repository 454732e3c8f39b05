/*
 * どこで: Notification digest モデル
 * 何を: digest の開始/終了時刻と group ごとの件数
 * なぜ: 件名の要約と単一 Issue 通知への分岐判定に使うため
 */
package com.issuealert.notification.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DigestMetadata(Instant start, Instant end, Map<Long, Integer> counts) {

  public DigestMetadata {
    counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
  }

  /** counts はルールをまたいで group ごとに合算する (同じレコードが 2 ルールに一致すれば 2 件)。 */
  public static DigestMetadata of(Digest digest) {
    Instant start = null;
    Instant end = null;
    final Map<Long, Integer> counts = new LinkedHashMap<>();
    for (Map<Long, List<DigestRecord>> groups : digest.asMap().values()) {
      for (Map.Entry<Long, List<DigestRecord>> entry : groups.entrySet()) {
        counts.merge(entry.getKey(), entry.getValue().size(), Integer::sum);
        for (DigestRecord record : entry.getValue()) {
          if (start == null || record.timestamp().isBefore(start)) {
            start = record.timestamp();
          }
          if (end == null || record.timestamp().isAfter(end)) {
            end = record.timestamp();
          }
        }
      }
    }
    return new DigestMetadata(start, end, counts);
  }

  public boolean singleGroup() {
    return counts.size() == 1;
  }

  public long firstGroupId() {
    return counts.keySet().iterator().next();
  }
}
