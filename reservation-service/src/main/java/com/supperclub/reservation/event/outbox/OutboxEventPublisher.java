package com.supperclub.reservation.event.outbox;

import com.supperclub.reservation.config.ReservationProperties;
import com.supperclub.reservation.service.EscalationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends one queued notification and records the outcome on the row. Runs inside the
 * relay's transaction, which holds the row lock until the outcome is written.
 * Delivery is at-least-once; the mailer dedupes on the message id in the payload.
 */
@Slf4j
@Service
public class OutboxEventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final EscalationService escalationService;
    private final ReservationProperties properties;
    private final Clock clock;

    public OutboxEventPublisher(@Qualifier("outboxKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate,
                                EscalationService escalationService,
                                ReservationProperties properties,
                                Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.escalationService = escalationService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return true if the broker acknowledged the message
     */
    public boolean publish(OutboxEvent event) {
        try {
            kafkaTemplate.send(event.getTopic(), event.getPartitionKey(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onFailure(event, e);
            return false;
        } catch (ExecutionException e) {
            onFailure(event, e.getCause() != null ? e.getCause() : e);
            return false;
        } catch (TimeoutException | RuntimeException e) {
            onFailure(event, e);
            return false;
        }
        event.markPublished(LocalDateTime.now(clock));
        log.debug("Relayed {} for bookingId={} (outbox id={})", event.getEventType(), event.getBookingId(), event.getId());
        return true;
    }

    private void onFailure(OutboxEvent event, Throwable cause) {
        int maxAttempts = properties.getOutbox().getMaxAttempts();
        boolean exhausted = event.recordFailure(describe(cause), LocalDateTime.now(clock), maxAttempts);
        if (!exhausted) {
            log.warn("Relay of {} for bookingId={} failed (attempt {}/{}), next at {}: {}",
                    event.getEventType(), event.getBookingId(), event.getAttempts(), maxAttempts,
                    event.getNextAttemptAt(), event.getLastError());
            return;
        }
        log.error("Giving up on {} for bookingId={} after {} attempts",
                event.getEventType(), event.getBookingId(), event.getAttempts(), cause);
        escalationService.recordNotificationFailure(event.getBookingId(), event.getEventType(), event.getTopic());
    }

    private static String describe(Throwable cause) {
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
