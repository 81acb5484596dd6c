package com.supperclub.reservation.event.outbox;

import com.supperclub.reservation.TestFixtures;
import com.supperclub.reservation.config.ReservationProperties;
import com.supperclub.reservation.service.EscalationService;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static com.supperclub.reservation.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxEventPublisherTest {

    private static final String TOPIC = "reservation.booking.confirmed";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;
    @Mock
    private EscalationService escalationService;

    private OutboxEventPublisher publisher;

    @BeforeEach
    void setUp() {
        ReservationProperties properties = TestFixtures.defaultProperties();
        properties.getOutbox().setMaxAttempts(3);
        publisher = new OutboxEventPublisher(kafkaTemplate, escalationService, properties,
                TestFixtures.fixedClock(NOW));
    }

    @Test
    void acknowledged_marksPublished() {
        OutboxEvent event = newEvent();
        @SuppressWarnings("unchecked")
        SendResult<String, String> result = mock(SendResult.class);
        when(kafkaTemplate.send(TOPIC, "10", "{}")).thenReturn(CompletableFuture.completedFuture(result));

        assertThat(publisher.publish(event)).isTrue();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PUBLISHED);
        assertThat(event.getPublishedAt()).isEqualTo(NOW);
        verifyNoInteractions(escalationService);
    }

    @Test
    void brokerError_schedulesRetryWithCause() {
        OutboxEvent event = newEvent();
        when(kafkaTemplate.send(TOPIC, "10", "{}"))
                .thenReturn(CompletableFuture.failedFuture(new TimeoutException("no leader")));

        assertThat(publisher.publish(event)).isFalse();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PENDING);
        assertThat(event.getAttempts()).isEqualTo(1);
        assertThat(event.getNextAttemptAt()).isAfter(NOW);
        assertThat(event.getLastError()).isEqualTo("TimeoutException: no leader");
        verifyNoInteractions(escalationService);
    }

    @Test
    void sendThrowsSynchronously_treatedAsFailure() {
        OutboxEvent event = newEvent();
        when(kafkaTemplate.send(TOPIC, "10", "{}")).thenThrow(new IllegalStateException("producer closed"));

        assertThat(publisher.publish(event)).isFalse();

        assertThat(event.getAttempts()).isEqualTo(1);
    }

    @Test
    void lastAttemptFails_marksFailedAndEscalatesBooking() {
        OutboxEvent event = newEvent();
        event.recordFailure("earlier", NOW, 3);
        event.recordFailure("earlier", NOW, 3);
        when(kafkaTemplate.send(TOPIC, "10", "{}"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publish(event);

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.FAILED);
        verify(escalationService).recordNotificationFailure(42L, "BOOKING_CONFIRMED", TOPIC);
    }

    private static OutboxEvent newEvent() {
        return OutboxEvent.pending(42L, "BOOKING_CONFIRMED", TOPIC, "10", "{}", NOW);
    }
}
