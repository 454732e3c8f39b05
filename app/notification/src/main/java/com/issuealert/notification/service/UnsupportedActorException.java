/*
 * どこで: Notification サービス層
 * 何を: 購読対象として扱えないアクター種別を示す例外
 * なぜ: 呼び出し側の実装誤りとして即座に失敗させるため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.Actor;

public class UnsupportedActorException extends RuntimeException {

  public UnsupportedActorException(Actor actor) {
    super("unsupported actor type: " + (actor == null ? "null" : actor.getClass().getName()));
  }
}
