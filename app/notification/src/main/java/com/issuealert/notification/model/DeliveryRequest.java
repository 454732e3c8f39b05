/*
 * どこで: Notification ドメインモデル
 * 何を: 受信者 1 人分のメール配信要求
 * なぜ: レンダリング/送信 (外部) へ渡す唯一の出力形にするため
 */
package com.issuealert.notification.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DeliveryRequest(
    long userId,
    String subject,
    String template,
    String htmlTemplate,
    String type,
    Map<String, Object> context,
    Map<String, String> headers,
    String referenceType,
    long referenceId) {

  public DeliveryRequest {
    // context は null 値を許容するため Map.copyOf ではなく順序付きコピーにする
    context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }
}
