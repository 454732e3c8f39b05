/*
 * どこで: Notification NATS JetStream 購読テスト(統合寄り)
 * 何を: start() 経由で handleMessage が配線されることと subject ごとの振り分け・ack/nak/term を検証する
 * なぜ: JetStream 購読設定とハンドラ連携を最低限保証するため
 */
package com.issuealert.notification.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuealert.common.event.IssueAlertEventPayload;
import com.issuealert.common.event.UserReportPayload;
import com.issuealert.notification.config.NotificationNatsProperties;
import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.repository.EventProcessingStore;
import com.issuealert.notification.repository.IssueGroupRepository;
import com.issuealert.notification.service.IssueNotificationEventHandler;
import com.issuealert.notification.service.NotificationDispatcher;
import com.issuealert.notification.service.NotificationEventPermanentException;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

@ExtendWith(MockitoExtension.class)
class IssueNotificationSubscriberTest {

        private static final String ALERT_SUBJECT = "issue.alert.triggered";
        private static final String USER_REPORT_SUBJECT = "issue.user_report.created";
        private static final String STREAM = "issue-notification-events";
        private static final String DURABLE = "issue-notification";
        private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
        private static final Duration ACK_WAIT = Duration.ofSeconds(10);
        private static final int MAX_DELIVER = 5;
        private static final String ALERT_JSON = """
                        {"event_id":"evt-1","group_id":7,"project_id":3,
                         "occurred_at":"2026-01-12T00:00:00Z","title":"KeyError",
                         "rules":[{"rule_id":11,"label":"New issue"}],
                         "target_type":"IssueOwners"}
                        """;
        private static final String USER_REPORT_JSON = """
                        {"report_id":"r-1","group_id":7,"project_id":3,"name":"Jane",
                         "email":"jane@example.com","comments":"It broke"}
                        """;

        @Mock
        private Connection connection;

        @Mock
        private JetStream jetStream;

        @Mock
        private JetStreamManagement jetStreamManagement;

        @Mock
        private Dispatcher dispatcher;

        @Mock
        private JetStreamSubscription subscription;

        @Mock
        private IssueNotificationEventHandler eventHandler;

        @Captor
        private ArgumentCaptor<MessageHandler> handlerCaptor;

        @Captor
        private ArgumentCaptor<PushSubscribeOptions> optionsCaptor;

        @Captor
        private ArgumentCaptor<IssueAlertEventPayload> alertCaptor;

        private IssueNotificationSubscriber subscriber;

        @BeforeEach
        void setUp() {
                NotificationNatsProperties properties = new NotificationNatsProperties(ALERT_SUBJECT,
                                USER_REPORT_SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);
                subscriber = new IssueNotificationSubscriber(connection, eventHandler, properties, new ObjectMapper());
        }

        @Test
        void ackWhenAlertHandledSuccessfully() throws Exception {
                Message message = message(ALERT_SUBJECT, ALERT_JSON);
                startCapturingHandler();

                handlerCaptor.getValue().onMessage(message);

                verify(eventHandler).handleIssueAlert(alertCaptor.capture());
                IssueAlertEventPayload payload = alertCaptor.getValue();
                assertEquals("evt-1", payload.eventId());
                assertEquals(7L, payload.groupId());
                assertEquals("IssueOwners", payload.targetType());
                assertEquals(11L, payload.rules().get(0).ruleId());
                verify(message).ack();
                verify(message, never()).nak();
        }

        @Test
        void ackWhenEventStoreFailsAfterDispatch() throws Exception {
                IssueGroupRepository groups = mock(IssueGroupRepository.class);
                EventProcessingStore store = mock(EventProcessingStore.class);
                NotificationDispatcher notificationDispatcher = mock(NotificationDispatcher.class);
                when(groups.findById(7L))
                                .thenReturn(Optional.of(new IssueGroup(7L, 3L, "WEB-7", "KeyError", "root", "error")));
                when(store.store(any(IssueEvent.class), eq(true))).thenReturn("e:3:evt-1");
                doThrow(new DataAccessResourceFailureException("redis down")).when(store).deleteByKey("e:3:evt-1");
                subscriber = new IssueNotificationSubscriber(connection,
                                new IssueNotificationEventHandler(groups, store, notificationDispatcher),
                                new NotificationNatsProperties(ALERT_SUBJECT, USER_REPORT_SUBJECT, STREAM, DURABLE,
                                                DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER),
                                new ObjectMapper());
                Message message = message(ALERT_SUBJECT, ALERT_JSON);
                startCapturingHandler();

                handlerCaptor.getValue().onMessage(message);

                verify(notificationDispatcher, times(1)).ruleNotify(any(), any(), any(), any());
                verify(message).ack();
                verify(message, never()).nak();
        }

        @Test
        void userReportSubjectRoutesToUserReportHandler() throws Exception {
                Message message = message(USER_REPORT_SUBJECT, USER_REPORT_JSON);
                startCapturingHandler();

                handlerCaptor.getValue().onMessage(message);

                verify(eventHandler).handleUserReport(any(UserReportPayload.class));
                verify(eventHandler, never()).handleIssueAlert(any());
                verify(message).ack();
        }

        @Test
        void nakWhenHandlerFailsTemporarily() throws Exception {
                Message message = message(ALERT_SUBJECT, ALERT_JSON);
                startCapturingHandler();
                doThrow(new DataAccessResourceFailureException("boom"))
                                .when(eventHandler)
                                .handleIssueAlert(any(IssueAlertEventPayload.class));

                handlerCaptor.getValue().onMessage(message);

                verify(message, never()).ack();
                verify(message).nak();
        }

        @Test
        void termWhenHandlerFailsPermanently() throws Exception {
                Message message = message(ALERT_SUBJECT, ALERT_JSON);
                startCapturingHandler();
                doThrow(new NotificationEventPermanentException("unknown group_id=7"))
                                .when(eventHandler)
                                .handleIssueAlert(any(IssueAlertEventPayload.class));

                handlerCaptor.getValue().onMessage(message);

                verify(message).term();
                verify(message, never()).ack();
                verify(message, never()).nak();
        }

        @Test
        void termWhenPayloadParseFails() throws Exception {
                Message message = message(ALERT_SUBJECT, "{not-json");
                startCapturingHandler();

                handlerCaptor.getValue().onMessage(message);

                verify(message).term();
                verify(message, never()).ack();
                verifyNoInteractions(eventHandler);
        }

        @Test
        void termWhenSubjectIsUnexpected() throws Exception {
                Message message = mock(Message.class);
                when(message.getSubject()).thenReturn("issue.unknown");
                startCapturingHandler();

                handlerCaptor.getValue().onMessage(message);

                verify(message).term();
                verifyNoInteractions(eventHandler);
        }

        @Test
        void swallowExceptionWhenNakFails() throws Exception {
                Message message = message(ALERT_SUBJECT, ALERT_JSON);
                startCapturingHandler();
                doThrow(new IllegalStateException("handler-failed"))
                                .when(eventHandler)
                                .handleIssueAlert(any(IssueAlertEventPayload.class));
                doThrow(new IllegalStateException("nak-failed"))
                                .when(message)
                                .nak();

                assertDoesNotThrow(() -> handlerCaptor.getValue().onMessage(message));

                verify(message, never()).ack();
                verify(message).nak();
        }

        @Test
        void startCreatesStreamWithBothSubjectsWhenMissing() throws Exception {
                stubConnection();
                when(jetStream.subscribe(anyString(), eq(dispatcher), any(MessageHandler.class), eq(false),
                                any(PushSubscribeOptions.class)))
                                .thenReturn(subscription);
                when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
                                .thenThrow(new StreamNotFoundException());
                ArgumentCaptor<StreamConfiguration> streamCaptor = ArgumentCaptor.forClass(StreamConfiguration.class);

                subscriber.start();

                verify(jetStreamManagement).addStream(streamCaptor.capture());
                assertEquals(STREAM, streamCaptor.getValue().getName());
                assertEquals(DUPLICATE_WINDOW, streamCaptor.getValue().getDuplicateWindow());
                assertEquals(2, streamCaptor.getValue().getSubjects().size());
        }

        @Test
        void startUsesSeparateDurablesWithAckWaitAndMaxDeliver() throws Exception {
                stubConnection();
                when(jetStream.subscribe(anyString(), eq(dispatcher), any(MessageHandler.class), eq(false),
                                optionsCaptor.capture()))
                                .thenReturn(subscription);

                subscriber.start();

                assertEquals(2, optionsCaptor.getAllValues().size());
                assertEquals(DURABLE + "-alerts", optionsCaptor.getAllValues().get(0).getDurable());
                assertEquals(DURABLE + "-user-reports", optionsCaptor.getAllValues().get(1).getDurable());
                PushSubscribeOptions options = optionsCaptor.getAllValues().get(0);
                assertEquals(ACK_WAIT, options.getConsumerConfiguration().getAckWait());
                assertEquals(MAX_DELIVER, options.getConsumerConfiguration().getMaxDeliver());
        }

        @Test
        void stopClosesSubscriptionsAndDispatcherSafelyWhenCalledMultipleTimes() throws Exception {
                stubConnection();
                when(jetStream.subscribe(anyString(), eq(dispatcher), any(MessageHandler.class), eq(false),
                                any(PushSubscribeOptions.class)))
                                .thenReturn(subscription);

                subscriber.start();

                assertDoesNotThrow(subscriber::stop);
                assertDoesNotThrow(subscriber::stop);

                verify(subscription, times(2)).unsubscribe();
                verify(connection, times(1)).closeDispatcher(dispatcher);
        }

        private void startCapturingHandler() throws Exception {
                stubConnection();
                when(jetStream.subscribe(anyString(), eq(dispatcher), handlerCaptor.capture(), eq(false),
                                any(PushSubscribeOptions.class)))
                                .thenReturn(subscription);
                subscriber.start();
        }

        private void stubConnection() throws IOException {
                when(connection.jetStream()).thenReturn(jetStream);
                when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
                when(connection.createDispatcher()).thenReturn(dispatcher);
        }

        private Message message(String subject, String json) {
                Message message = mock(Message.class);
                when(message.getSubject()).thenReturn(subject);
                when(message.getData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
                return message;
        }

        private static final class StreamNotFoundException extends JetStreamApiException {
                private StreamNotFoundException() {
                        super(Error.JsBadRequestErr);
                }

                @Override
                public int getApiErrorCode() {
                        return 10059;
                }

                @Override
                public int getErrorCode() {
                        return 404;
                }
        }
}
