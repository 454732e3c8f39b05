/*
 * どこで: Notification サービス層
 * 何を: イベント内容から Issue オーナーを求める評価器の抽象
 * なぜ: ルール保存形式や評価方式を受信者解決から切り離すため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.OwnershipResult;

public interface OwnershipEvaluator {

  /** 「全員」を示す結果、明示オーナー集合 (空もあり得る) のいずれかを返す。 */
  OwnershipResult getOwners(long projectId, IssueEvent event);
}
