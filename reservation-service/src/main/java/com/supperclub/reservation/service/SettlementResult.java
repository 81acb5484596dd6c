package com.supperclub.reservation.service;

import com.supperclub.reservation.domain.Booking;

public record SettlementResult(Outcome outcome, Booking booking) {

    public enum Outcome {
        CONFIRMED,
        /** A booking already exists for this payment reference. */
        ALREADY_SETTLED,
        /** Another booking or hold owns the table; the payment needs a human. */
        TABLE_TAKEN,
        /** A ticket-only event has fewer seats left than the paid party size. */
        SOLD_OUT
    }

    public static SettlementResult confirmed(Booking booking) {
        return new SettlementResult(Outcome.CONFIRMED, booking);
    }

    public static SettlementResult alreadySettled(Booking booking) {
        return new SettlementResult(Outcome.ALREADY_SETTLED, booking);
    }

    public static SettlementResult tableTaken() {
        return new SettlementResult(Outcome.TABLE_TAKEN, null);
    }

    public static SettlementResult soldOut() {
        return new SettlementResult(Outcome.SOLD_OUT, null);
    }
}
