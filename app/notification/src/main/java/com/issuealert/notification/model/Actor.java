/*
 * どこで: Notification ドメインモデル
 * 何を: 購読主体 (ユーザー/チーム) の共通型
 * なぜ: 担当者やメンションの主体を購読処理へ渡すため
 */
package com.issuealert.notification.model;

public interface Actor {
  long id();
}
