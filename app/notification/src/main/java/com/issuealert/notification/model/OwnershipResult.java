/*
 * どこで: Notification ドメインモデル
 * 何を: ownership 評価結果 (Everyone センチネル or 明示オーナー集合)
 * なぜ: 「全員へフォールバック」と「オーナー 0 件」を取り違えないため
 */
package com.issuealert.notification.model;

import java.util.List;
import java.util.Set;

public record OwnershipResult(boolean everyone, Set<Owner> owners, List<Long> matchedRuleIds) {

  public OwnershipResult {
    owners = Set.copyOf(owners);
    matchedRuleIds = List.copyOf(matchedRuleIds);
  }

  public static OwnershipResult everyoneResult() {
    return new OwnershipResult(true, Set.of(), List.of());
  }

  public static OwnershipResult ownersOf(Set<Owner> owners, List<Long> matchedRuleIds) {
    return new OwnershipResult(false, owners, matchedRuleIds);
  }
}
