/*
 * どこで: Notification NATS 購読
 * 何を: アラート/フィードバックの JetStream subject を購読し、subject ごとのハンドラへ渡す
 * なぜ: ルール一致イベントとフィードバック作成を通知処理に繋ぐため
 */
package com.issuealert.notification.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.issuealert.common.event.IssueAlertEventPayload;
import com.issuealert.common.event.UserReportPayload;
import com.issuealert.notification.config.NotificationNatsProperties;
import com.issuealert.notification.service.IssueNotificationEventHandler;
import com.issuealert.notification.service.NotificationEventPermanentException;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class IssueNotificationSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(IssueNotificationSubscriber.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;
    private static final String MDC_EVENT_ID = "event_id";
    private static final String MDC_PROJECT_ID = "project_id";
    private static final String MDC_GROUP_ID = "group_id";

    private final Connection connection;
    private final IssueNotificationEventHandler eventHandler;
    private final NotificationNatsProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription alertSubscription;
    private JetStreamSubscription userReportSubscription;

    public IssueNotificationSubscriber(Connection connection,
            IssueNotificationEventHandler eventHandler,
            NotificationNatsProperties properties,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.eventHandler = eventHandler;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            alertSubscription = jetStream.subscribe(
                    properties.alertSubject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions(properties.durable() + "-alerts"));
            userReportSubscription = jetStream.subscribe(
                    properties.userReportSubject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions(properties.durable() + "-user-reports"));
            logger.info("issue notification subscriber started alertSubject={} userReportSubject={} stream={}",
                    properties.alertSubject(),
                    properties.userReportSubject(),
                    properties.stream());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (alertSubscription != null) {
            alertSubscription.unsubscribe();
            alertSubscription = null;
        }
        if (userReportSubscription != null) {
            userReportSubscription.unsubscribe();
            userReportSubscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        try {
            dispatch(message);
            // JetStream 明示 ack: 成功時は ack して再配信を止める
            message.ack();
        } catch (IOException ex) {
            // payload 破損は再配信で回復しないため恒久的に TERM する
            logger.warn("failed to parse nats message payload subject={}", message.getSubject(), ex);
            termSilently(message);
        } catch (NotificationEventPermanentException ex) {
            logger.warn("permanent failure while handling nats message subject={}", message.getSubject(), ex);
            termSilently(message);
        } catch (DataAccessException ex) {
            // DB/Redis など一時的失敗は再配信させる
            logger.warn("temporary failure while handling nats message subject={}", message.getSubject(), ex);
            nakSilently(message);
        } catch (RuntimeException ex) {
            // 不明な例外はデータロス回避のため再配信に倒す
            logger.warn("failed to handle nats message subject={}", message.getSubject(), ex);
            nakSilently(message);
        } finally {
            MDC.remove(MDC_EVENT_ID);
            MDC.remove(MDC_PROJECT_ID);
            MDC.remove(MDC_GROUP_ID);
        }
    }

    private void dispatch(Message message) throws IOException {
        String subject = message.getSubject();
        if (properties.alertSubject().equals(subject)) {
            IssueAlertEventPayload payload = objectMapper.readValue(message.getData(), IssueAlertEventPayload.class);
            MDC.put(MDC_EVENT_ID, payload.eventId());
            MDC.put(MDC_PROJECT_ID, String.valueOf(payload.projectId()));
            MDC.put(MDC_GROUP_ID, String.valueOf(payload.groupId()));
            eventHandler.handleIssueAlert(payload);
            return;
        }
        if (properties.userReportSubject().equals(subject)) {
            UserReportPayload payload = objectMapper.readValue(message.getData(), UserReportPayload.class);
            MDC.put(MDC_PROJECT_ID, String.valueOf(payload.projectId()));
            MDC.put(MDC_GROUP_ID, String.valueOf(payload.groupId()));
            eventHandler.handleUserReport(payload);
            return;
        }
        throw new NotificationEventPermanentException("unexpected subject=" + subject);
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        // Nats-Msg-Id による重複排除を有効化するため stream を必ず作成する
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.alertSubject(), properties.userReportSubject())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (!isStreamNotFound(ex)) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
        logger.info("notification stream ensured stream={} duplicateWindow={}",
                properties.stream(),
                properties.duplicateWindow());
    }

    private boolean isStreamNotFound(JetStreamApiException ex) {
        return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
                || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
    }

    private PushSubscribeOptions buildPushSubscribeOptions(String durable) {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(durable)
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack nats message", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term nats message", ex);
        }
    }
}
