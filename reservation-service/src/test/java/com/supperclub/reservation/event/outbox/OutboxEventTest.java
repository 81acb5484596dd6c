package com.supperclub.reservation.event.outbox;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.supperclub.reservation.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class OutboxEventTest {

    @Test
    void pending_isDueImmediately() {
        OutboxEvent event = newEvent();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PENDING);
        assertThat(event.getNextAttemptAt()).isEqualTo(NOW);
        assertThat(event.getAttempts()).isZero();
    }

    @Test
    void recordFailure_pushesNextAttemptBackExponentially() {
        OutboxEvent event = newEvent();

        assertThat(event.recordFailure("TimeoutException: no ack", NOW, 8)).isFalse();
        assertThat(event.getNextAttemptAt()).isEqualTo(NOW.plusSeconds(2));

        assertThat(event.recordFailure("TimeoutException: no ack", NOW, 8)).isFalse();
        assertThat(event.getNextAttemptAt()).isEqualTo(NOW.plusSeconds(4));
        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PENDING);
        assertThat(event.getLastError()).startsWith("TimeoutException");
    }

    @Test
    void recordFailure_lastAttempt_marksFailed() {
        OutboxEvent event = newEvent();
        event.recordFailure("broker down", NOW, 2);

        boolean exhausted = event.recordFailure("broker down", NOW, 2);

        assertThat(exhausted).isTrue();
        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.FAILED);
        assertThat(event.getAttempts()).isEqualTo(2);
    }

    @Test
    void backoff_isCapped() {
        assertThat(OutboxEvent.backoff(8)).isEqualTo(Duration.ofSeconds(256));
        assertThat(OutboxEvent.backoff(9)).isEqualTo(OutboxEvent.MAX_BACKOFF);
        assertThat(OutboxEvent.backoff(40)).isEqualTo(OutboxEvent.MAX_BACKOFF);
    }

    @Test
    void recordFailure_longErrorIsTruncated() {
        OutboxEvent event = newEvent();

        event.recordFailure("x".repeat(2_000), NOW, 8);

        assertThat(event.getLastError()).hasSize(500);
    }

    @Test
    void markPublished_clearsLastError() {
        OutboxEvent event = newEvent();
        event.recordFailure("broker down", NOW, 8);

        event.markPublished(NOW.plusSeconds(3));

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PUBLISHED);
        assertThat(event.getPublishedAt()).isEqualTo(NOW.plusSeconds(3));
        assertThat(event.getLastError()).isNull();
    }

    private static OutboxEvent newEvent() {
        return OutboxEvent.pending(42L, "BOOKING_CONFIRMED", "reservation.booking.confirmed", "10", "{}", NOW);
    }
}
