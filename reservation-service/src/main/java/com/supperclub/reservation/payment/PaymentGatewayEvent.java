package com.supperclub.reservation.payment;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A verified gateway delivery: unique event id, event type and the {@code data.object} payload.
 */
public record PaymentGatewayEvent(String id, String type, JsonNode object) {

    public static final String CHECKOUT_COMPLETED = "checkout.session.completed";
    public static final String PAYMENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String CHARGE_REFUNDED = "charge.refunded";
    public static final String PAYMENT_REFUNDED = "payment_intent.refunded";
    public static final String DISPUTE_CREATED = "charge.dispute.created";

    public String text(String field) {
        JsonNode node = object.path(field);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    public long amount(String... fields) {
        for (String field : fields) {
            JsonNode node = object.path(field);
            if (node.isNumber()) {
                return node.asLong();
            }
        }
        return 0L;
    }

    public JsonNode metadata() {
        return object.path("metadata");
    }
}
