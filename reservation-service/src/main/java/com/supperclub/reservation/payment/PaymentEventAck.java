package com.supperclub.reservation.payment;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body returned to the gateway. Any 2xx stops redelivery.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentEventAck(boolean received, boolean duplicate, ReconcileOutcome outcome) {

    public static PaymentEventAck duplicateDelivery() {
        return new PaymentEventAck(true, true, null);
    }

    public static PaymentEventAck processed(ReconcileOutcome outcome) {
        return new PaymentEventAck(true, false, outcome);
    }
}
