/*
 * どこで: Notification digest モデル
 * 何を: rule -> group -> records の順序付き構造
 * なぜ: 複数ルール/複数 Issue のまとめ通知を 1 通で描画するため
 */
package com.issuealert.notification.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

public final class Digest {

  private static final Comparator<DigestRecord> NEWEST_FIRST =
      Comparator.comparing(DigestRecord::timestamp).reversed();

  private final Map<AlertRule, Map<Long, List<DigestRecord>>> rules;

  private Digest(Map<AlertRule, Map<Long, List<DigestRecord>>> rules) {
    this.rules = rules;
  }

  /**
   * drain したレコード列から digest を組み立てる。
   *
   * <p>レコードは一致した全ルールの下に group 単位で並び、group 内は新しい順、rule 内の group は件数の多い順になる。
   */
  public static Digest build(List<DigestRecord> records) {
    final List<DigestRecord> ordered = new ArrayList<>(records);
    ordered.sort(NEWEST_FIRST);
    final Map<AlertRule, Map<Long, List<DigestRecord>>> grouped = new LinkedHashMap<>();
    for (DigestRecord record : ordered) {
      for (AlertRule rule : record.rules()) {
        grouped
            .computeIfAbsent(rule, ignored -> new LinkedHashMap<>())
            .computeIfAbsent(record.groupId(), ignored -> new ArrayList<>())
            .add(record);
      }
    }
    return new Digest(freeze(grouped));
  }

  public static Digest empty() {
    return new Digest(Map.of());
  }

  public boolean isEmpty() {
    return rules.isEmpty();
  }

  public Set<AlertRule> rules() {
    return rules.keySet();
  }

  public Map<Long, List<DigestRecord>> groups(AlertRule rule) {
    return rules.getOrDefault(rule, Map.of());
  }

  public Map<AlertRule, Map<Long, List<DigestRecord>>> asMap() {
    return rules;
  }

  /** 全ルールを通して指定 group の最新レコードを返す。 */
  public Optional<DigestRecord> mostRecentRecord(long groupId) {
    return rules.values().stream()
        .flatMap(groups -> groups.getOrDefault(groupId, List.of()).stream())
        .max(Comparator.comparing(DigestRecord::timestamp));
  }

  public Optional<IssueGroup> group(long groupId) {
    return mostRecentRecord(groupId).map(record -> record.event().group());
  }

  /** 条件を満たすレコードだけを残した digest。空になった group/rule は落とす。 */
  public Digest filter(Predicate<DigestRecord> predicate) {
    final Map<AlertRule, Map<Long, List<DigestRecord>>> filtered = new LinkedHashMap<>();
    rules.forEach(
        (rule, groups) ->
            groups.forEach(
                (groupId, records) -> {
                  final List<DigestRecord> kept =
                      records.stream().filter(predicate).toList();
                  if (!kept.isEmpty()) {
                    filtered
                        .computeIfAbsent(rule, ignored -> new LinkedHashMap<>())
                        .put(groupId, kept);
                  }
                }));
    return new Digest(freeze(filtered));
  }

  private static Map<AlertRule, Map<Long, List<DigestRecord>>> freeze(
      Map<AlertRule, Map<Long, List<DigestRecord>>> grouped) {
    final Map<AlertRule, Map<Long, List<DigestRecord>>> frozen = new LinkedHashMap<>();
    grouped.forEach(
        (rule, groups) -> {
          final List<Map.Entry<Long, List<DigestRecord>>> entries =
              new ArrayList<>(groups.entrySet());
          // 件数の多い group を先に出す (同数は登場順)
          entries.sort(
              Comparator.comparing(
                  (Map.Entry<Long, List<DigestRecord>> entry) -> entry.getValue().size())
                  .reversed());
          final Map<Long, List<DigestRecord>> sortedGroups = new LinkedHashMap<>();
          for (Map.Entry<Long, List<DigestRecord>> entry : entries) {
            sortedGroups.put(entry.getKey(), List.copyOf(entry.getValue()));
          }
          frozen.put(rule, Collections.unmodifiableMap(sortedGroups));
        });
    return Collections.unmodifiableMap(frozen);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Digest digest && rules.equals(digest.rules);
  }

  @Override
  public int hashCode() {
    return rules.hashCode();
  }

  @Override
  public String toString() {
    return "Digest" + rules;
  }
}
