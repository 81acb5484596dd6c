package com.supperclub.reservation.service;

import com.supperclub.reservation.config.ReservationProperties;
import com.supperclub.reservation.domain.Booking;
import com.supperclub.reservation.domain.BookingSelection;
import com.supperclub.reservation.domain.BookingStatus;
import com.supperclub.reservation.domain.SeatHold;
import com.supperclub.reservation.domain.SeatHoldStatus;
import com.supperclub.reservation.jooq.InventoryJooqRepository;
import com.supperclub.reservation.repository.BookingRepository;
import com.supperclub.reservation.repository.SeatHoldRepository;
import com.supperclub.reservation.repository.VenueTableRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Live, uncached checks run immediately before any write that claims a table.
 * Returns results; never throws for business conditions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingValidator {

    static final String VALIDATION_ERROR_REASON = "Error validating table status";

    private final BookingRepository bookingRepository;
    private final SeatHoldRepository seatHoldRepository;
    private final VenueTableRepository tableRepository;
    private final InventoryJooqRepository inventoryRepository;
    private final ReservationProperties properties;
    private final Clock clock;

    /**
     * No blocking booking and no live hold on the table.
     */
    public boolean tableAvailableForBooking(Long tableId, Long eventId) {
        return tableAvailableForHolder(tableId, eventId, null);
    }

    /**
     * Same as {@link #tableAvailableForBooking(Long, Long)} except that the hold
     * identified by {@code lockToken} does not count against the table.
     */
    public boolean tableAvailableForHolder(Long tableId, Long eventId, String lockToken) {
        if (bookingRepository.existsByEventIdAndTableIdAndStatusIn(eventId, tableId, BookingStatus.BLOCKING)) {
            return false;
        }
        return inventoryRepository.countActiveHolds(eventId, tableId, now(), lockToken) == 0;
    }

    public boolean noDuplicateBooking(String userId, Long eventId) {
        if (userId == null) {
            return true;
        }
        return !bookingRepository.existsByUserIdAndEventIdAndStatusNotIn(
                userId, eventId, BookingStatus.RELEASED);
    }

    public boolean withinTicketCutoff(LocalDateTime eventDate) {
        return withinTicketCutoff(eventDate, properties.getBooking().getTicketCutoffDays());
    }

    public boolean withinTicketCutoff(LocalDateTime eventDate, int cutoffDays) {
        return !now().isAfter(eventDate.minusDays(cutoffDays));
    }

    /**
     * Whether {@code newTableId} can take a booking for the event. A blocking booking
     * with id {@code excludeBookingId} (the one being edited) is ignored. Fails closed
     * when storage cannot be read.
     */
    public TableReassignmentCheck validateTableReassignment(Long newTableId, Long eventId, Long excludeBookingId) {
        try {
            Optional<Booking> sold = bookingRepository
                    .findByEventIdAndTableIdAndStatusIn(eventId, newTableId, BookingStatus.BLOCKING)
                    .stream()
                    .filter(b -> excludeBookingId == null || !excludeBookingId.equals(b.getId()))
                    .findFirst();
            if (sold.isPresent()) {
                Booking booking = sold.get();
                String customer = booking.getCustomerEmail() != null
                        ? booking.getCustomerEmail() : booking.getUserId();
                return TableReassignmentCheck.blocked(
                        "Cannot modify table " + tableLabel(newTableId) + " - currently SOLD to " + customer);
            }

            LocalDateTime now = now();
            List<SeatHold> holds = seatHoldRepository
                    .findByEventIdAndTableIdAndStatusAndHoldExpiryGreaterThanEqualOrderByHoldExpiryDesc(
                            eventId, newTableId, SeatHoldStatus.ACTIVE, now);
            if (!holds.isEmpty()) {
                long minutes = holds.get(0).remainingMinutes(now);
                return TableReassignmentCheck.blocked(
                        "Cannot modify table " + tableLabel(newTableId)
                                + " - currently ON HOLD (" + minutes + " minutes remaining)");
            }
            return TableReassignmentCheck.ok();
        } catch (DataAccessException e) {
            log.error("Table status lookup failed: eventId={}, tableId={}", eventId, newTableId, e);
            return TableReassignmentCheck.blocked(VALIDATION_ERROR_REASON);
        }
    }

    /**
     * Returns one message per invalid selection; empty when all are valid.
     */
    public List<String> validateSelections(List<BookingSelection> selections) {
        List<String> problems = new ArrayList<>();
        if (selections == null) {
            return problems;
        }
        for (int i = 0; i < selections.size(); i++) {
            BookingSelection selection = selections.get(i);
            if (selection == null) {
                problems.add("selections[" + i + "]: missing");
                continue;
            }
            if (selection.getKind() == null) {
                problems.add("selections[" + i + "]: kind is required");
            }
            if (selection.getItemId() == null || selection.getItemId().isBlank()) {
                problems.add("selections[" + i + "]: itemId is required");
            }
            if (selection.getQuantity() <= 0) {
                problems.add("selections[" + i + "]: quantity must be positive");
            }
        }
        return problems;
    }

    private String tableLabel(Long tableId) {
        return tableRepository.findById(tableId)
                .map(table -> String.valueOf(table.getTableNumber()))
                .orElse(String.valueOf(tableId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
