package com.supperclub.reservation.event.producer;

import com.supperclub.common.event.BookingEvent;
import com.supperclub.common.event.Topics;
import com.supperclub.reservation.domain.Booking;
import com.supperclub.reservation.event.outbox.OutboxEventService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns booking state changes into outbox rows. The mailer consumes
 * BOOKING_CONFIRMED, BOOKING_CANCELLED and BOOKING_REFUNDED.
 */
@Component
@RequiredArgsConstructor
public class BookingEventProducer {

    private final OutboxEventService outboxEventService;

    public void publishBookingReserved(Booking booking) {
        outboxEventService.enqueue(BookingEvent.reserved(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getTableId(), booking.getPartySize(), booking.getCustomerEmail()),
                Topics.BOOKING_RESERVED);
    }

    public void publishBookingConfirmed(Booking booking) {
        outboxEventService.enqueue(BookingEvent.confirmed(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getTableId(), booking.getPartySize(), booking.getCustomerEmail(),
                booking.getAmountPaidCents()),
                Topics.BOOKING_CONFIRMED);
    }

    public void publishBookingModified(Booking booking) {
        outboxEventService.enqueue(BookingEvent.modified(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getTableId(), booking.getPartySize(), booking.getCustomerEmail()),
                Topics.BOOKING_MODIFIED);
    }

    public void publishBookingCancelled(Booking booking) {
        outboxEventService.enqueue(BookingEvent.cancelled(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getTableId(), booking.getCustomerEmail()),
                Topics.BOOKING_CANCELLED);
    }

    public void publishBookingRefunded(Booking booking) {
        outboxEventService.enqueue(BookingEvent.refunded(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getTableId(), booking.getCustomerEmail(), booking.getRefundAmountCents()),
                Topics.BOOKING_REFUNDED);
    }
}
