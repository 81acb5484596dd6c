package com.supperclub.reservation.domain;

import com.supperclub.common.domain.BaseTimeEntity;
import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "bookings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long eventId;

    /** Null for pooled ticket-only bookings. */
    private Long tableId;

    @Column(length = 64)
    private String userId;

    @Column(nullable = false)
    private int partySize;

    @ElementCollection
    @CollectionTable(name = "booking_seats", joinColumns = @JoinColumn(name = "booking_id"))
    @Column(name = "seat_number", nullable = false)
    private List<Integer> seatNumbers = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "booking_guests", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "position")
    @Column(name = "guest_name", nullable = false, length = 200)
    private List<String> guestNames = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "booking_selections", joinColumns = @JoinColumn(name = "booking_id"))
    private List<BookingSelection> selections = new ArrayList<>();

    @Column(length = 255)
    private String customerEmail;

    @Column(length = 1000)
    private String notes;

    @Column(unique = true, length = 100)
    private String paymentReference;

    @Column(length = 100)
    private String checkoutSessionId;

    @Column(nullable = false)
    private long amountPaidCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private PaymentState paymentState;

    private Long refundAmountCents;

    @Column(length = 100)
    private String refundReference;

    @Column(length = 36)
    private String lockToken;

    @Column(nullable = false)
    private boolean reviewRequired;

    @Column(length = 500)
    private String reviewReason;

    @Column(length = 64)
    private String modifiedBy;

    @Version
    private Long version;

    @Builder
    private Booking(Long eventId, Long tableId, String userId, int partySize,
                    List<Integer> seatNumbers, List<String> guestNames,
                    List<BookingSelection> selections, String customerEmail,
                    String notes, String lockToken) {
        this.eventId = eventId;
        this.tableId = tableId;
        this.userId = userId;
        this.partySize = partySize;
        replace(this.seatNumbers, seatNumbers);
        replace(this.guestNames, guestNames);
        replace(this.selections, selections);
        this.customerEmail = customerEmail;
        this.notes = notes;
        this.lockToken = lockToken;
        this.status = BookingStatus.PENDING;
        this.paymentState = PaymentState.UNPAID;
        this.amountPaidCents = 0L;
    }

    /** Admin-created, unpaid. {@code comp} books a complimentary table instead of a pay-later one. */
    public void reserve(boolean comp, String adminId) {
        transitionTo(comp ? BookingStatus.COMP : BookingStatus.RESERVED);
        this.paymentState = comp ? PaymentState.COMP : PaymentState.UNPAID;
        this.modifiedBy = adminId;
    }

    public void confirmPayment(String paymentReference, String checkoutSessionId, long amountCents) {
        transitionTo(BookingStatus.CONFIRMED);
        this.paymentState = PaymentState.PAID;
        this.paymentReference = paymentReference;
        this.checkoutSessionId = checkoutSessionId;
        this.amountPaidCents = amountCents;
    }

    /**
     * Settles an unpaid admin booking. A RESERVED booking becomes CONFIRMED; a booking
     * edited while unpaid stays MODIFIED and only its payment state changes.
     */
    public void markPaidOffline(long amountCents, String paymentReference, String adminId) {
        boolean payable = this.paymentState == PaymentState.UNPAID
                && (this.status == BookingStatus.RESERVED || this.status == BookingStatus.MODIFIED);
        if (!payable) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TRANSITION,
                    "Only unpaid RESERVED or MODIFIED bookings can be marked paid offline: current status="
                            + this.status + ", payment=" + this.paymentState);
        }
        if (this.status == BookingStatus.RESERVED) {
            transitionTo(BookingStatus.CONFIRMED);
        }
        this.paymentState = PaymentState.PAID;
        this.paymentReference = paymentReference;
        this.amountPaidCents = amountCents;
        this.modifiedBy = adminId;
    }

    public void modify(Long tableId, Integer partySize, List<Integer> seatNumbers,
                       List<String> guestNames, List<BookingSelection> selections,
                       String notes, String adminId) {
        transitionTo(BookingStatus.MODIFIED);
        if (tableId != null) {
            this.tableId = tableId;
        }
        if (partySize != null) {
            this.partySize = partySize;
        }
        if (seatNumbers != null) {
            replace(this.seatNumbers, seatNumbers);
        }
        if (guestNames != null) {
            replace(this.guestNames, guestNames);
        }
        if (selections != null) {
            replace(this.selections, selections);
        }
        if (notes != null) {
            this.notes = notes;
        }
        this.modifiedBy = adminId;
    }

    /**
     * Returns false when the booking was already cancelled.
     */
    public boolean cancel(String actorId) {
        if (this.status == BookingStatus.CANCELED) {
            return false; // idempotent
        }
        transitionTo(BookingStatus.CANCELED);
        this.modifiedBy = actorId;
        return true;
    }

    /**
     * Returns false when the refund was already applied.
     */
    public boolean refund(long refundAmountCents, String refundReference) {
        if (this.status == BookingStatus.REFUNDED) {
            return false; // idempotent
        }
        transitionTo(BookingStatus.REFUNDED);
        this.refundAmountCents = refundAmountCents;
        this.refundReference = refundReference;
        return true;
    }

    public void flagForReview(String reason) {
        this.reviewRequired = true;
        this.reviewReason = reason;
    }

    public boolean isBlocking() {
        return this.status.isBlocking();
    }

    private void transitionTo(BookingStatus next) {
        if (!this.status.canTransitionTo(next)) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TRANSITION,
                    "Cannot move booking from " + this.status + " to " + next);
        }
        this.status = next;
    }

    private static <T> void replace(List<T> target, List<T> values) {
        target.clear();
        if (values != null) {
            target.addAll(values);
        }
    }
}
