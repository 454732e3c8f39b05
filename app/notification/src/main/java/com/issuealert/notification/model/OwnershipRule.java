/*
 * どこで: Notification ドメインモデル
 * 何を: ownership_rules の 1 ルール (matcher + pattern + owners)
 * なぜ: イベント属性から担当者を決めるため
 */
package com.issuealert.notification.model;

import java.util.List;

public record OwnershipRule(long ruleId, String matcherType, String pattern, List<Owner> owners) {

  public OwnershipRule {
    owners = List.copyOf(owners);
  }
}
