package com.supperclub.reservation.event.producer;

import com.supperclub.common.event.AdminAlertEvent;
import com.supperclub.common.event.Topics;
import com.supperclub.reservation.TestFixtures;
import com.supperclub.reservation.domain.IssueType;
import com.supperclub.reservation.domain.ReconciliationIssue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminAlertPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @InjectMocks
    private AdminAlertPublisher alertPublisher;

    @Test
    void alert_acknowledged_sendsEventKeyedByDinner() {
        ReconciliationIssue issue = paidUnseated();
        @SuppressWarnings("unchecked")
        SendResult<String, Object> result = mock(SendResult.class);
        when(kafkaTemplate.send(eq(Topics.ADMIN_ALERT), eq("10"), any()))
                .thenReturn(CompletableFuture.completedFuture(result));

        assertThat(alertPublisher.alert(issue)).isTrue();

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(Topics.ADMIN_ALERT), eq("10"), captor.capture());
        AdminAlertEvent event = (AdminAlertEvent) captor.getValue();
        assertThat(event.getEventType()).isEqualTo(AdminAlertEvent.TYPE_PAID_UNSEATED);
        assertThat(event.getIssueId()).isEqualTo(7L);
        assertThat(event.getPaymentReference()).isEqualTo("pi_1");
    }

    @Test
    void alert_brokerRejects_throwsForRetry() {
        ReconciliationIssue issue = paidUnseated();
        when(kafkaTemplate.send(eq(Topics.ADMIN_ALERT), eq("10"), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatThrownBy(() -> alertPublisher.alert(issue))
                .isInstanceOf(AdminAlertPublisher.AlertDeliveryException.class)
                .hasRootCauseMessage("broker down");
    }

    @Test
    void fallback_reportsUndelivered() {
        assertThat(alertPublisher.alertUndelivered(paidUnseated(), new IllegalStateException("open"))).isFalse();
    }

    @Test
    void alertKey_withoutEvent_usesIssueId() {
        ReconciliationIssue issue = ReconciliationIssue.builder()
                .issueType(IssueType.NOTIFICATION_FAILED)
                .bookingId(42L)
                .detail("email undeliverable")
                .build();
        TestFixtures.setEntityId(issue, 8L);

        assertThat(AdminAlertPublisher.alertKey(issue)).isEqualTo("8");
    }

    private static ReconciliationIssue paidUnseated() {
        ReconciliationIssue issue = ReconciliationIssue.builder()
                .issueType(IssueType.PAID_UNSEATED)
                .paymentReference("pi_1")
                .eventId(10L)
                .tableId(100L)
                .detail("table taken")
                .build();
        TestFixtures.setEntityId(issue, 7L);
        return issue;
    }
}
