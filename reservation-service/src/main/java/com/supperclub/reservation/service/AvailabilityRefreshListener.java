package com.supperclub.reservation.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityRefreshListener {

    private final AvailabilityCalculator availabilityCalculator;

    /**
     * The booking is already committed here; a failed rewrite leaves stale counters
     * that the reconciliation sweep corrects.
     */
    @TransactionalEventListener(fallbackExecution = true)
    public void onAvailabilityChanged(AvailabilityChangedEvent event) {
        try {
            availabilityCalculator.syncEventAvailability(event.eventId());
        } catch (Exception e) {
            availabilityCalculator.invalidate(event.eventId());
            log.warn("Availability rewrite failed after commit: eventId={}", event.eventId(), e);
        }
    }
}
