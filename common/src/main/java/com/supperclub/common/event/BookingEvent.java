package com.supperclub.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Booking lifecycle notification, consumed by the mailer and reporting.
 * Partitioned by {@code eventId} so every change to one dinner arrives in order.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEvent extends DomainEvent {

    public static final String TYPE_RESERVED = "BOOKING_RESERVED";
    public static final String TYPE_CONFIRMED = "BOOKING_CONFIRMED";
    public static final String TYPE_MODIFIED = "BOOKING_MODIFIED";
    public static final String TYPE_CANCELLED = "BOOKING_CANCELLED";
    public static final String TYPE_REFUNDED = "BOOKING_REFUNDED";

    private Long bookingId;
    private String userId;
    private Long eventId;
    private Long tableId;
    private int partySize;
    private String customerEmail;
    private Long amountCents;

    private BookingEvent(String eventType, Long bookingId, String userId, Long eventId,
                         Long tableId, int partySize, String customerEmail, Long amountCents) {
        super(eventType);
        this.bookingId = bookingId;
        this.userId = userId;
        this.eventId = eventId;
        this.tableId = tableId;
        this.partySize = partySize;
        this.customerEmail = customerEmail;
        this.amountCents = amountCents;
    }

    public static BookingEvent reserved(Long bookingId, String userId, Long eventId,
                                        Long tableId, int partySize, String customerEmail) {
        return new BookingEvent(TYPE_RESERVED, bookingId, userId, eventId, tableId,
                partySize, customerEmail, null);
    }

    public static BookingEvent confirmed(Long bookingId, String userId, Long eventId,
                                         Long tableId, int partySize, String customerEmail,
                                         Long amountCents) {
        return new BookingEvent(TYPE_CONFIRMED, bookingId, userId, eventId, tableId,
                partySize, customerEmail, amountCents);
    }

    public static BookingEvent modified(Long bookingId, String userId, Long eventId,
                                        Long tableId, int partySize, String customerEmail) {
        return new BookingEvent(TYPE_MODIFIED, bookingId, userId, eventId, tableId,
                partySize, customerEmail, null);
    }

    public static BookingEvent cancelled(Long bookingId, String userId, Long eventId,
                                         Long tableId, String customerEmail) {
        return new BookingEvent(TYPE_CANCELLED, bookingId, userId, eventId, tableId,
                0, customerEmail, null);
    }

    public static BookingEvent refunded(Long bookingId, String userId, Long eventId,
                                        Long tableId, String customerEmail, Long refundCents) {
        return new BookingEvent(TYPE_REFUNDED, bookingId, userId, eventId, tableId,
                0, customerEmail, refundCents);
    }
}
