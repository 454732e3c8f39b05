/*
 * どこで: Notification サービス層
 * 何を: 受信者 1 人分の配信要求を notifications (outbox) に PENDING で登録する
 * なぜ: 配信トランスポートの遅延/失敗を通知判定から切り離し、ワーカーで再送できるようにするため
 */
package com.issuealert.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuealert.notification.model.DeliveryRequest;
import com.issuealert.notification.model.NotificationRecord;
import com.issuealert.notification.model.NotificationStatus;
import com.issuealert.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationOutboxService {

  private final NotificationRepository notificationRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public UUID enqueue(DeliveryRequest request) {
    final Instant now = Instant.now(clock);
    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(),
            request.userId(),
            request.type(),
            request.subject(),
            request.referenceType(),
            request.referenceId(),
            serialize(request),
            NotificationStatus.PENDING,
            null,
            null,
            null,
            0,
            now,
            now,
            null);
    return notificationRepository.insert(record);
  }

  private String serialize(DeliveryRequest request) {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("delivery request serialization failure", ex);
    }
  }
}
