/*
 * どこで: Notification デバッグ API
 * 何を: outbox の配信要求・Issue 参加者・アラート宛先を取得する
 * なぜ: 動作確認と開発時の可視化のため
 */
package com.issuealert.notification.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuealert.notification.model.ActionTargetType;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.model.NotificationRecord;
import com.issuealert.notification.model.SubscriptionReason;
import com.issuealert.notification.repository.IssueGroupRepository;
import com.issuealert.notification.repository.NotificationRepository;
import com.issuealert.notification.service.ParticipantResolver;
import com.issuealert.notification.service.RecipientResolver;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationDebugController {

    private final NotificationRepository notificationRepository;
    private final IssueGroupRepository issueGroupRepository;
    private final ParticipantResolver participantResolver;
    private final RecipientResolver recipientResolver;
    private final ObjectMapper objectMapper;

    @GetMapping("/inbox/{userId}")
    public NotificationInboxResponse inbox(@PathVariable("userId") long userId) {
        List<NotificationSummary> items = notificationRepository.findByUserId(userId).stream()
                .map(this::toSummary)
                .toList();
        return new NotificationInboxResponse(userId, items);
    }

    @GetMapping("/participants/{groupId}")
    public ParticipantsResponse participants(@PathVariable("groupId") long groupId) {
        IssueGroup group = issueGroupRepository.findById(groupId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "group not found"));
        Map<Long, SubscriptionReason> participants = participantResolver.getParticipants(group);
        List<ParticipantsResponse.Participant> items = participants.entrySet().stream()
                .map(entry -> new ParticipantsResponse.Participant(
                        entry.getKey(),
                        entry.getValue().name().toLowerCase(Locale.ROOT),
                        entry.getValue().description()))
                .toList();
        return new ParticipantsResponse(groupId, items);
    }

    @GetMapping("/recipients")
    public RecipientsResponse recipients(
            @RequestParam("projectId") long projectId,
            @RequestParam("targetType") String targetType,
            @RequestParam(name = "targetIdentifier", required = false) String targetIdentifier) {
        ActionTargetType type;
        try {
            type = ActionTargetType.fromValue(targetType);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        List<Long> userIds = recipientResolver.resolve(projectId, type, targetIdentifier, null).stream()
                .sorted()
                .toList();
        return new RecipientsResponse(
                projectId,
                type.value(),
                targetIdentifier,
                recipientResolver.shouldNotify(type, projectId),
                userIds);
    }

    private NotificationSummary toSummary(NotificationRecord record) {
        try {
            JsonNode payload = objectMapper.readTree(record.payloadJson());
            return new NotificationSummary(
                    record.notificationId(),
                    record.type(),
                    record.subject(),
                    record.referenceType(),
                    record.referenceId(),
                    record.status(),
                    record.attemptCount(),
                    record.createdAt(),
                    record.sentAt(),
                    payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("notification payload parse failure", ex);
        }
    }
}
