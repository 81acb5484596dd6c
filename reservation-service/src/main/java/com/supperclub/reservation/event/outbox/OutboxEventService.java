package com.supperclub.reservation.event.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supperclub.common.event.BookingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Queues booking notifications in the caller's transaction, so a booking change
 * and its notification commit or roll back together.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent enqueue(BookingEvent event, String topic) {
        OutboxEvent row = OutboxEvent.pending(
                event.getBookingId(), event.getEventType(), topic,
                String.valueOf(event.getEventId()), toJson(event), LocalDateTime.now(clock));
        outboxEventRepository.save(row);
        log.debug("Queued {} for bookingId={} on {}", event.getEventType(), event.getBookingId(), topic);
        return row;
    }

    private String toJson(BookingEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Booking event is not serializable: " + event.getEventType(), e);
        }
    }
}
