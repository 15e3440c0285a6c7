package com.github.salilvnair.supportrouter.notification;

import com.github.salilvnair.supportrouter.escalation.RulePriority;
import com.github.salilvnair.supportrouter.support.RecordingNotificationListener;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.github.salilvnair.supportrouter.support.RouterFixtures.NOW;
import static com.github.salilvnair.supportrouter.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.supportrouter.support.TestConstants.STAFF_TARGET;
import static com.github.salilvnair.supportrouter.support.TestConstants.TENANT_ACME;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class NotificationDispatcherTest {

    @Test
    void everyListenerReceivesEveryNotification() {
        RecordingNotificationListener first = new RecordingNotificationListener();
        RecordingNotificationListener second = new RecordingNotificationListener();
        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(first, second));

        dispatcher.dispatch(List.of(notification(NotificationType.ESCALATION), notification(NotificationType.LEAD_THRESHOLD)));

        assertEquals(2, first.received().size());
        assertEquals(2, second.received().size());
        assertEquals(NotificationType.LEAD_THRESHOLD, second.received().get(1).type());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        NotificationListener failing = mock(NotificationListener.class);
        doThrow(new IllegalStateException("smtp down")).when(failing).onNotification(any());
        RecordingNotificationListener recording = new RecordingNotificationListener();
        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(failing, recording));

        assertDoesNotThrow(() -> dispatcher.dispatch(notification(NotificationType.ADVISORY)));

        assertEquals(1, recording.received().size());
    }

    @Test
    void noListenersIsANoOp() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of());

        assertDoesNotThrow(() -> dispatcher.dispatch(notification(NotificationType.ESCALATION)));
        assertDoesNotThrow(() -> dispatcher.dispatch((List<RouterNotification>) null));
    }

    private static RouterNotification notification(NotificationType type) {
        return RouterNotification.builder()
                .type(type)
                .tenantId(TENANT_ACME)
                .sessionId(SESSION_ID)
                .priority(RulePriority.HIGH)
                .category("legal_threat")
                .summary("Kunden hotar med advokat")
                .notifyTargets(Set.of(STAFF_TARGET))
                .createdAt(NOW)
                .build();
    }
}
