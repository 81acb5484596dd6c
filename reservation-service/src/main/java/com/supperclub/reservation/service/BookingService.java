package com.supperclub.reservation.service;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.domain.Booking;
import com.supperclub.reservation.domain.BookingSelection;
import com.supperclub.reservation.domain.BookingStatus;
import com.supperclub.reservation.domain.VenueEvent;
import com.supperclub.reservation.domain.VenueTable;
import com.supperclub.reservation.dto.request.ManualReservationRequest;
import com.supperclub.reservation.dto.request.ModifyBookingRequest;
import com.supperclub.reservation.dto.request.SelectionRequest;
import com.supperclub.reservation.event.producer.BookingEventProducer;
import com.supperclub.reservation.repository.BookingRepository;
import com.supperclub.reservation.repository.VenueEventRepository;
import com.supperclub.reservation.repository.VenueTableRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives every booking status transition. Each mutation is flushed before
 * availability is refreshed, audited, and announced through the outbox.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final String ENTITY_TYPE = "Booking";
    private static final String OFFLINE_REFERENCE_PREFIX = "offline_";

    private final BookingRepository bookingRepository;
    private final VenueEventRepository eventRepository;
    private final VenueTableRepository tableRepository;
    private final BookingValidator bookingValidator;
    private final AdminConflictGuard conflictGuard;
    private final SeatHoldManager seatHoldManager;
    private final AvailabilityCalculator availabilityCalculator;
    private final AdminAuditService auditService;
    private final BookingEventProducer eventProducer;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId) {
        return findBooking(bookingId);
    }

    @Transactional(readOnly = true)
    public Optional<Booking> findByPaymentReference(String paymentReference) {
        return bookingRepository.findByPaymentReference(paymentReference);
    }

    @Transactional
    public Booking createManualReservation(ManualReservationRequest request, String adminId) {
        VenueEvent event = findEvent(request.eventId());
        requireTableSeating(event);
        VenueTable table = findTable(request.tableId());
        requireSameVenue(event, table);
        conflictGuard.guardSeatModification(table.getId(), event.getId(), null);

        List<BookingSelection> selections = toSelections(request.selections());
        requireValidSelections(selections);

        Booking booking = Booking.builder()
                .eventId(event.getId())
                .tableId(table.getId())
                .userId(request.userId())
                .partySize(request.partySize())
                .seatNumbers(request.seatNumbers())
                .guestNames(request.guestNames())
                .selections(selections)
                .customerEmail(request.customerEmail())
                .notes(request.notes())
                .build();
        booking.reserve(request.comp(), adminId);
        bookingRepository.saveAndFlush(booking);

        availabilityCalculator.refresh(event.getId());
        auditService.record(adminId, request.comp() ? "CREATE_COMP_BOOKING" : "CREATE_MANUAL_BOOKING",
                ENTITY_TYPE, booking.getId(), details(booking));
        eventProducer.publishBookingReserved(booking);

        log.info("Manual booking created: bookingId={}, eventId={}, tableId={}, status={}, by={}",
                booking.getId(), booking.getEventId(), booking.getTableId(), booking.getStatus(), adminId);
        return booking;
    }

    @Transactional
    public Booking markPaidOffline(Long bookingId, long amountCents, String adminId) {
        if (amountCents <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Amount must be greater than zero");
        }
        Booking booking = findBooking(bookingId);
        booking.markPaidOffline(amountCents, OFFLINE_REFERENCE_PREFIX + clock.millis(), adminId);
        bookingRepository.saveAndFlush(booking);

        availabilityCalculator.refresh(booking.getEventId());
        Map<String, Object> details = details(booking);
        details.put("amountCents", amountCents);
        auditService.record(adminId, "MARK_PAID_OFFLINE", ENTITY_TYPE, booking.getId(), details);
        eventProducer.publishBookingConfirmed(booking);

        log.info("Booking marked paid offline: bookingId={}, amountCents={}, by={}",
                bookingId, amountCents, adminId);
        return booking;
    }

    /**
     * Admin edit. Rejected when the booking changed since the admin read it, or when
     * a new table is SOLD or held.
     */
    @Transactional
    public Booking modifyBooking(Long bookingId, ModifyBookingRequest request, String adminId) {
        Booking booking = findBooking(bookingId);
        if (!Objects.equals(booking.getVersion(), request.expectedVersion())) {
            throw new BusinessException(ErrorCode.BOOKING_VERSION_CONFLICT,
                    "Booking " + bookingId + " is at version " + booking.getVersion()
                            + ", expected " + request.expectedVersion());
        }

        Long previousTableId = booking.getTableId();
        boolean tableChanged = request.tableId() != null && !request.tableId().equals(previousTableId);
        if (tableChanged) {
            VenueEvent event = findEvent(booking.getEventId());
            requireTableSeating(event);
            VenueTable table = findTable(request.tableId());
            requireSameVenue(event, table);
            conflictGuard.guardSeatModification(table.getId(), booking.getEventId(), booking.getId());
        }

        List<BookingSelection> selections = null;
        if (request.selections() != null) {
            selections = toSelections(request.selections());
            requireValidSelections(selections);
        }

        booking.modify(request.tableId(), request.partySize(), request.seatNumbers(),
                request.guestNames(), selections, request.notes(), adminId);
        try {
            bookingRepository.saveAndFlush(booking);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new BusinessException(ErrorCode.BOOKING_VERSION_CONFLICT);
        }

        availabilityCalculator.refresh(booking.getEventId());
        Map<String, Object> details = details(booking);
        if (tableChanged) {
            details.put("previousTableId", previousTableId);
        }
        auditService.record(adminId, "MODIFY_BOOKING", ENTITY_TYPE, booking.getId(), details);
        eventProducer.publishBookingModified(booking);

        log.info("Booking modified: bookingId={}, tableId={}, version={}, by={}",
                bookingId, booking.getTableId(), booking.getVersion(), adminId);
        return booking;
    }

    @Transactional
    public Booking cancelBooking(Long bookingId, String actorId, String reason) {
        Booking booking = findBooking(bookingId);
        if (!booking.cancel(actorId)) {
            return booking;
        }
        bookingRepository.saveAndFlush(booking);

        availabilityCalculator.refresh(booking.getEventId());
        Map<String, Object> details = details(booking);
        if (reason != null) {
            details.put("reason", reason);
        }
        auditService.record(actorId, "CANCEL_BOOKING", ENTITY_TYPE, booking.getId(), details);
        eventProducer.publishBookingCancelled(booking);

        log.info("Booking cancelled: bookingId={}, eventId={}, tableId={}, by={}",
                bookingId, booking.getEventId(), booking.getTableId(), actorId);
        return booking;
    }

    /**
     * Turns a captured payment into a CONFIRMED booking and completes the originating hold,
     * in one transaction. The table is re-checked live; the payer's own hold does not count.
     * Ticket-only events skip tables and holds and are checked against pooled capacity instead.
     */
    @Transactional
    public SettlementResult settlePaidCheckout(PaidCheckout checkout) {
        Optional<Booking> existing = bookingRepository.findByPaymentReference(checkout.paymentReference());
        if (existing.isPresent()) {
            log.info("Payment already settled: paymentReference={}, bookingId={}",
                    checkout.paymentReference(), existing.get().getId());
            return SettlementResult.alreadySettled(existing.get());
        }

        VenueEvent event = findEvent(checkout.eventId());
        if (event.isTicketOnly()) {
            return settleTicketPurchase(checkout);
        }
        if (checkout.tableId() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Paid checkout for table-seating event " + event.getId() + " names no table");
        }
        if (!bookingValidator.tableAvailableForHolder(checkout.tableId(), checkout.eventId(), checkout.lockToken())) {
            log.warn("Paid checkout lost its table: eventId={}, tableId={}, paymentReference={}",
                    checkout.eventId(), checkout.tableId(), checkout.paymentReference());
            return SettlementResult.tableTaken();
        }

        Booking booking = paidBooking(checkout, checkout.tableId(), checkout.seatNumbers());
        bookingRepository.saveAndFlush(booking);

        if (checkout.lockToken() != null) {
            seatHoldManager.completeHold(checkout.lockToken());
        }
        return announceSettlement(booking, checkout);
    }

    private SettlementResult settleTicketPurchase(PaidCheckout checkout) {
        // held until commit, so the next purchase for this event counts this one
        eventRepository.findByIdForUpdate(checkout.eventId())
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
        int remaining = availabilityCalculator.calculate(checkout.eventId()).availableSeats();
        if (remaining < checkout.partySize()) {
            log.warn("Paid tickets exceed remaining capacity: eventId={}, quantity={}, remaining={}, paymentReference={}",
                    checkout.eventId(), checkout.partySize(), remaining, checkout.paymentReference());
            return SettlementResult.soldOut();
        }

        Booking booking = paidBooking(checkout, null, List.of());
        bookingRepository.saveAndFlush(booking);
        return announceSettlement(booking, checkout);
    }

    private Booking paidBooking(PaidCheckout checkout, Long tableId, List<Integer> seatNumbers) {
        Booking booking = Booking.builder()
                .eventId(checkout.eventId())
                .tableId(tableId)
                .userId(checkout.userId())
                .partySize(checkout.partySize())
                .seatNumbers(seatNumbers)
                .guestNames(checkout.guestNames())
                .selections(checkout.selections())
                .customerEmail(checkout.customerEmail())
                .lockToken(checkout.lockToken())
                .build();
        booking.confirmPayment(checkout.paymentReference(), checkout.checkoutSessionId(), checkout.amountCents());
        return booking;
    }

    private SettlementResult announceSettlement(Booking booking, PaidCheckout checkout) {
        availabilityCalculator.refresh(booking.getEventId());
        Map<String, Object> details = details(booking);
        details.put("paymentReference", checkout.paymentReference());
        details.put("amountCents", checkout.amountCents());
        auditService.record(AdminAuditService.SYSTEM_ACTOR, "PAYMENT_CONFIRMED", ENTITY_TYPE, booking.getId(), details);
        eventProducer.publishBookingConfirmed(booking);

        log.info("Booking confirmed from payment: bookingId={}, eventId={}, tableId={}, paymentReference={}",
                booking.getId(), booking.getEventId(), booking.getTableId(), checkout.paymentReference());
        return SettlementResult.confirmed(booking);
    }

    /**
     * Releases the table of the booking paid with {@code paymentReference}.
     * Empty when no booking carries that reference.
     */
    @Transactional
    public Optional<Booking> applyRefund(String paymentReference, long refundAmountCents, String refundReference) {
        Optional<Booking> found = bookingRepository.findByPaymentReference(paymentReference);
        if (found.isEmpty()) {
            log.warn("Refund for unknown payment: paymentReference={}", paymentReference);
            return Optional.empty();
        }
        Booking booking = found.get();
        if (booking.getStatus() == BookingStatus.REFUNDED) {
            log.info("Refund already applied: bookingId={}", booking.getId());
            return found;
        }
        if (!booking.getStatus().canTransitionTo(BookingStatus.REFUNDED)) {
            log.warn("Refund ignored for booking in status {}: bookingId={}", booking.getStatus(), booking.getId());
            return found;
        }

        booking.refund(refundAmountCents, refundReference);
        bookingRepository.saveAndFlush(booking);

        availabilityCalculator.refresh(booking.getEventId());
        Map<String, Object> details = details(booking);
        details.put("refundAmountCents", refundAmountCents);
        details.put("paymentReference", paymentReference);
        auditService.record(AdminAuditService.SYSTEM_ACTOR, "PAYMENT_REFUNDED", ENTITY_TYPE, booking.getId(), details);
        eventProducer.publishBookingRefunded(booking);

        log.info("Booking refunded: bookingId={}, refundAmountCents={}", booking.getId(), refundAmountCents);
        return found;
    }

    /**
     * Marks the booking for manual review. A dispute never cancels the booking by itself.
     */
    @Transactional
    public Optional<Booking> flagDispute(String paymentReference, String reason) {
        Optional<Booking> found = bookingRepository.findByPaymentReference(paymentReference);
        found.ifPresent(booking -> {
            booking.flagForReview(reason);
            bookingRepository.save(booking);
            Map<String, Object> details = details(booking);
            details.put("reason", reason == null ? "" : reason);
            auditService.record(AdminAuditService.SYSTEM_ACTOR, "PAYMENT_DISPUTED", ENTITY_TYPE, booking.getId(), details);
            log.warn("Booking flagged for dispute review: bookingId={}, reason={}", booking.getId(), reason);
        });
        return found;
    }

    private Booking findBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));
    }

    private VenueEvent findEvent(Long eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
    }

    private VenueTable findTable(Long tableId) {
        return tableRepository.findById(tableId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TABLE_NOT_FOUND));
    }

    private static void requireTableSeating(VenueEvent event) {
        if (event.isTicketOnly()) {
            throw new BusinessException(ErrorCode.TICKET_ONLY_EVENT,
                    "Event " + event.getId() + " has no table seating");
        }
    }

    private void requireSameVenue(VenueEvent event, VenueTable table) {
        if (!event.getVenueId().equals(table.getVenueId())) {
            throw new BusinessException(ErrorCode.TABLE_NOT_FOUND,
                    "Table " + table.getTableNumber() + " is not part of this event's venue");
        }
    }

    private void requireValidSelections(List<BookingSelection> selections) {
        List<String> problems = bookingValidator.validateSelections(selections);
        if (!problems.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_SELECTION, String.join(", ", problems));
        }
    }

    private static List<BookingSelection> toSelections(List<SelectionRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream().map(SelectionRequest::toSelection).toList();
    }

    private static Map<String, Object> details(Booking booking) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventId", booking.getEventId());
        details.put("tableId", booking.getTableId());
        details.put("status", booking.getStatus().name());
        details.put("paymentState", booking.getPaymentState().name());
        details.put("partySize", booking.getPartySize());
        return details;
    }
}
