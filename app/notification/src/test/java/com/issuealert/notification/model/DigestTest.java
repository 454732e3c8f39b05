/*
 * どこで: Digest モデルのユニットテスト
 * 何を: ルール -> group -> レコードの並び順、件数集計、フィルタを検証する
 * なぜ: digest 件名・本文の件数と並びが組み立て規則どおりであることを保証するため
 */
package com.issuealert.notification.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DigestTest {

  private static final AlertRule RULE_A = new AlertRule(1L, "High error rate");
  private static final AlertRule RULE_B = new AlertRule(2L, "New issue");
  private static final Instant T0 = Instant.parse("2026-02-01T00:00:00Z");

  @Test
  void buildGroupsRecordsUnderEveryMatchingRule() {
    final DigestRecord first = record("e1", 10L, T0, RULE_A);
    final DigestRecord second = record("e2", 10L, T0.plusSeconds(30), RULE_A, RULE_B);
    final DigestRecord third = record("e3", 20L, T0.plusSeconds(10), RULE_A);

    final Digest digest = Digest.build(List.of(first, third, second));

    assertThat(digest.rules()).containsExactly(RULE_A, RULE_B);
    // 件数の多い group が先、group 内は新しい順
    assertThat(digest.groups(RULE_A).keySet()).containsExactly(10L, 20L);
    assertThat(digest.groups(RULE_A).get(10L)).containsExactly(second, first);
    assertThat(digest.groups(RULE_B)).containsOnlyKeys(10L);
    assertThat(digest.mostRecentRecord(10L)).contains(second);
  }

  @Test
  void metadataCountsAcrossRulesAndSpansTimestamps() {
    final Digest digest =
        Digest.build(
            List.of(
                record("e1", 10L, T0, RULE_A),
                record("e2", 10L, T0.plusSeconds(30), RULE_A, RULE_B),
                record("e3", 20L, T0.plusSeconds(10), RULE_A)));

    final DigestMetadata metadata = DigestMetadata.of(digest);

    assertThat(metadata.start()).isEqualTo(T0);
    assertThat(metadata.end()).isEqualTo(T0.plusSeconds(30));
    assertThat(metadata.counts()).isEqualTo(Map.of(10L, 3, 20L, 1));
    assertThat(metadata.singleGroup()).isFalse();
  }

  @Test
  void filterDropsEmptiedGroupsAndRules() {
    final Digest digest =
        Digest.build(
            List.of(record("e1", 10L, T0, RULE_A), record("e2", 20L, T0.plusSeconds(5), RULE_B)));

    final Digest filtered = digest.filter(record -> record.groupId() == 20L);

    assertThat(filtered.rules()).containsExactly(RULE_B);
    assertThat(DigestMetadata.of(filtered).singleGroup()).isTrue();
    assertThat(DigestMetadata.of(filtered).firstGroupId()).isEqualTo(20L);
    assertThat(digest.filter(record -> false).isEmpty()).isTrue();
  }

  @Test
  void digestKeyRoundTripsThroughItsStringForm() {
    final DigestKey withTarget = new DigestKey(3L, ActionTargetType.TEAM, "50");
    final DigestKey owners = new DigestKey(3L, ActionTargetType.ISSUE_OWNERS, null);

    assertThat(withTarget.unsplit()).isEqualTo("mail:p:3:Team:50");
    assertThat(owners.unsplit()).isEqualTo("mail:p:3:IssueOwners:");
    assertThat(DigestKey.split(owners.unsplit())).isEqualTo(owners);
    assertThat(DigestKey.split("mail:p:3:Team:50")).isEqualTo(withTarget);
  }

  static DigestRecord record(String eventId, long groupId, Instant timestamp, AlertRule... rules) {
    final IssueEvent event =
        new IssueEvent(
            eventId,
            new IssueGroup(groupId, 3L, "WEB-" + groupId, "Error " + groupId, "root", "error"),
            timestamp,
            "Error " + groupId,
            "production",
            Map.of(),
            List.of(),
            null);
    return new DigestRecord(timestamp, event, List.of(rules));
  }
}
