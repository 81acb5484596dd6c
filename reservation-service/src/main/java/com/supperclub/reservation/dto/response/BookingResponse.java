package com.supperclub.reservation.dto.response;

import com.supperclub.reservation.domain.Booking;
import com.supperclub.reservation.domain.BookingSelection;

import java.time.LocalDateTime;
import java.util.List;

public record BookingResponse(
        Long bookingId,
        Long eventId,
        Long tableId,
        String userId,
        int partySize,
        List<Integer> seatNumbers,
        List<String> guestNames,
        List<SelectionResponse> selections,
        String customerEmail,
        String status,
        String paymentState,
        long amountPaidCents,
        Long refundAmountCents,
        boolean reviewRequired,
        Long version,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getEventId(),
                booking.getTableId(),
                booking.getUserId(),
                booking.getPartySize(),
                List.copyOf(booking.getSeatNumbers()),
                List.copyOf(booking.getGuestNames()),
                booking.getSelections().stream().map(SelectionResponse::from).toList(),
                booking.getCustomerEmail(),
                booking.getStatus().name(),
                booking.getPaymentState().name(),
                booking.getAmountPaidCents(),
                booking.getRefundAmountCents(),
                booking.isReviewRequired(),
                booking.getVersion(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }

    public record SelectionResponse(String kind, String itemId, String name, int quantity) {
        static SelectionResponse from(BookingSelection selection) {
            return new SelectionResponse(selection.getKind().name(), selection.getItemId(),
                    selection.getName(), selection.getQuantity());
        }
    }
}
