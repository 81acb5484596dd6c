package com.supperclub.reservation.service;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.cache.AvailabilityCache;
import com.supperclub.reservation.domain.BookingStatus;
import com.supperclub.reservation.domain.VenueEvent;
import com.supperclub.reservation.jooq.InventoryJooqRepository;
import com.supperclub.reservation.jooq.InventoryJooqRepository.BookingTotals;
import com.supperclub.reservation.repository.BookingRepository;
import com.supperclub.reservation.repository.VenueEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Derives event availability from bookings. Cached reads are for display;
 * {@link #isTableAvailable(Long, Long)} always goes to storage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityCalculator {

    private final VenueEventRepository eventRepository;
    private final BookingRepository bookingRepository;
    private final InventoryJooqRepository inventoryRepository;
    private final AvailabilityCache availabilityCache;
    private final ApplicationEventPublisher eventPublisher;

    public AvailabilitySnapshot computeAvailability(Long eventId) {
        AvailabilitySnapshot cached = availabilityCache.get(eventId);
        if (cached != null) {
            return cached;
        }
        AvailabilitySnapshot snapshot = calculate(eventId);
        availabilityCache.put(eventId, snapshot);
        return snapshot;
    }

    public boolean isTableAvailable(Long eventId, Long tableId) {
        return !bookingRepository.existsByEventIdAndTableIdAndStatusIn(
                eventId, tableId, BookingStatus.BLOCKING);
    }

    public void invalidate(Long eventId) {
        availabilityCache.invalidate(eventId);
    }

    /**
     * Evicts now and schedules a counter rewrite. Inside a transaction the rewrite
     * waits for commit; outside one it runs immediately.
     */
    public void refresh(Long eventId) {
        availabilityCache.invalidate(eventId);
        eventPublisher.publishEvent(new AvailabilityChangedEvent(eventId));
    }

    /**
     * Recomputes from storage, writes the counters onto the event row and re-primes the cache.
     * Runs in its own transaction so it also works from an after-commit callback.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AvailabilitySnapshot syncEventAvailability(Long eventId) {
        availabilityCache.invalidate(eventId);
        AvailabilitySnapshot snapshot = calculate(eventId);
        inventoryRepository.updateEventAvailability(
                eventId, snapshot.availableSeats(), snapshot.availableTables());
        availabilityCache.put(eventId, snapshot);
        log.debug("Availability synced: eventId={}, seats={}, tables={}, soldOut={}",
                eventId, snapshot.availableSeats(), snapshot.availableTables(), snapshot.soldOut());
        return snapshot;
    }

    public int syncAllEventsAvailability() {
        List<Long> eventIds = inventoryRepository.findAllEventIds();
        int synced = 0;
        for (Long eventId : eventIds) {
            try {
                syncEventAvailability(eventId);
                synced++;
            } catch (Exception e) {
                log.error("Failed to sync availability: eventId={}", eventId, e);
            }
        }
        log.info("Availability synced for {}/{} events", synced, eventIds.size());
        return synced;
    }

    AvailabilitySnapshot calculate(Long eventId) {
        VenueEvent event = eventRepository.findById(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
        BookingTotals totals = inventoryRepository.aggregateBookings(eventId);

        if (event.isTicketOnly()) {
            int capacity = event.getTicketCapacity() != null ? event.getTicketCapacity() : event.getTotalSeats();
            int seats = Math.max(0, capacity - totals.bookedSeats());
            return new AvailabilitySnapshot(eventId, seats, 1, capacity, 1, seats == 0);
        }

        int seats = Math.max(0, event.getTotalSeats() - totals.bookedSeats());
        int tables = Math.max(0, event.getTotalTables() - totals.bookedTables());
        return new AvailabilitySnapshot(eventId, seats, tables,
                event.getTotalSeats(), event.getTotalTables(), seats == 0 || tables == 0);
    }
}
