package com.supperclub.reservation.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.supperclub.common.exception.BusinessException;
import com.supperclub.reservation.domain.Booking;
import com.supperclub.reservation.domain.BookingStatus;
import com.supperclub.reservation.domain.IssueType;
import com.supperclub.reservation.event.IdempotencyService;
import com.supperclub.reservation.service.BookingService;
import com.supperclub.reservation.service.EscalationService;
import com.supperclub.reservation.service.PaidCheckout;
import com.supperclub.reservation.service.SettlementResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns payment gateway webhooks into booking state, exactly once per gateway event id.
 * <p>
 * Business outcomes (confirmed, lost race, refund, dispute, unknown type) are always
 * acknowledged; a lost race is escalated for a human instead of producing a second
 * booking. Infrastructure failures release the event claim and propagate, so the
 * gateway redelivers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentEventReconciler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentWebhookParser webhookParser;
    private final IdempotencyService idempotencyService;
    private final BookingService bookingService;
    private final EscalationService escalationService;

    public PaymentEventAck handlePaymentEvent(String payload, String signatureHeader) {
        signatureVerifier.verify(payload, signatureHeader);
        PaymentGatewayEvent event = webhookParser.parse(payload);

        if (!idempotencyService.claim(event.id(), event.type())) {
            log.info("Duplicate payment event skipped: id={}, type={}", event.id(), event.type());
            return PaymentEventAck.duplicateDelivery();
        }

        try {
            ReconcileOutcome outcome = dispatch(event);
            log.info("Payment event processed: id={}, type={}, outcome={}", event.id(), event.type(), outcome);
            return PaymentEventAck.processed(outcome);
        } catch (RuntimeException e) {
            log.error("Payment event failed, releasing claim for redelivery: id={}, type={}",
                    event.id(), event.type(), e);
            idempotencyService.release(event.id());
            throw e;
        }
    }

    private ReconcileOutcome dispatch(PaymentGatewayEvent event) {
        return switch (event.type()) {
            case PaymentGatewayEvent.CHECKOUT_COMPLETED, PaymentGatewayEvent.PAYMENT_SUCCEEDED ->
                    handlePaymentSucceeded(event);
            case PaymentGatewayEvent.CHARGE_REFUNDED, PaymentGatewayEvent.PAYMENT_REFUNDED ->
                    handleRefund(event);
            case PaymentGatewayEvent.DISPUTE_CREATED -> handleDispute(event);
            default -> {
                log.debug("Ignoring payment event type: {}", event.type());
                yield ReconcileOutcome.IGNORED;
            }
        };
    }

    private ReconcileOutcome handlePaymentSucceeded(PaymentGatewayEvent event) {
        if (PaymentGatewayEvent.CHECKOUT_COMPLETED.equals(event.type())
                && !"paid".equals(event.text("payment_status"))) {
            return ReconcileOutcome.IGNORED;
        }
        // payment intents without reservation metadata belong to a checkout session handled separately
        if (PaymentGatewayEvent.PAYMENT_SUCCEEDED.equals(event.type())
                && !webhookParser.hasReservationMetadata(event)) {
            return ReconcileOutcome.IGNORED;
        }

        PaidCheckout checkout;
        try {
            checkout = webhookParser.toPaidCheckout(event);
        } catch (InvalidMetadataException e) {
            escalationService.escalate(IssueType.MALFORMED_METADATA, event.id(), paymentReferenceOf(event),
                    null, null, null, e.getMessage());
            return ReconcileOutcome.MALFORMED_METADATA;
        }

        SettlementResult result;
        try {
            result = bookingService.settlePaidCheckout(checkout);
        } catch (DataIntegrityViolationException e) {
            // the session and its payment intent can race to settle the same payment
            Optional<Booking> settled = bookingService.findByPaymentReference(checkout.paymentReference());
            if (settled.isPresent()) {
                log.info("Payment settled by a concurrent delivery: paymentReference={}, bookingId={}",
                        checkout.paymentReference(), settled.get().getId());
                return ReconcileOutcome.DUPLICATE_PAYMENT;
            }
            // otherwise a concurrent writer claimed the table between the re-check and the insert
            log.warn("Unique index rejected paid booking: eventId={}, tableId={}",
                    checkout.eventId(), checkout.tableId());
            result = SettlementResult.tableTaken();
        } catch (BusinessException e) {
            escalationService.escalate(IssueType.MALFORMED_METADATA, event.id(), checkout.paymentReference(),
                    checkout.eventId(), checkout.tableId(), null, e.getMessage());
            return ReconcileOutcome.MALFORMED_METADATA;
        }

        return switch (result.outcome()) {
            case CONFIRMED -> ReconcileOutcome.BOOKING_CONFIRMED;
            case ALREADY_SETTLED -> ReconcileOutcome.DUPLICATE_PAYMENT;
            case TABLE_TAKEN -> {
                escalationService.escalate(IssueType.PAID_UNSEATED, event.id(), checkout.paymentReference(),
                        checkout.eventId(), checkout.tableId(), null,
                        "Payment of " + checkout.amountCents() + " cents captured for " + checkout.customerEmail()
                                + " but the table is already taken; refund or reseat");
                yield ReconcileOutcome.ESCALATED;
            }
            case SOLD_OUT -> {
                escalationService.escalate(IssueType.PAID_UNSEATED, event.id(), checkout.paymentReference(),
                        checkout.eventId(), null, null,
                        "Payment of " + checkout.amountCents() + " cents captured for " + checkout.customerEmail()
                                + " but fewer than " + checkout.partySize() + " tickets remain; refund");
                yield ReconcileOutcome.ESCALATED;
            }
        };
    }

    private ReconcileOutcome handleRefund(PaymentGatewayEvent event) {
        String paymentReference = paymentReferenceOf(event);
        if (paymentReference == null) {
            log.warn("Refund event without payment reference: id={}", event.id());
            return ReconcileOutcome.BOOKING_NOT_FOUND;
        }
        JsonNode firstRefund = event.object().path("refunds").path("data").path(0);
        long refundAmount = firstRefund.path("amount").isNumber()
                ? firstRefund.path("amount").asLong()
                : event.amount("amount_refunded", "amount");
        String refundReference = firstRefund.hasNonNull("id") ? firstRefund.get("id").asText() : event.text("id");

        Optional<Booking> booking = bookingService.applyRefund(paymentReference, refundAmount, refundReference);
        if (booking.isEmpty()) {
            return ReconcileOutcome.BOOKING_NOT_FOUND;
        }
        return booking.get().getStatus() == BookingStatus.REFUNDED
                ? ReconcileOutcome.REFUNDED
                : ReconcileOutcome.IGNORED;
    }

    private ReconcileOutcome handleDispute(PaymentGatewayEvent event) {
        String paymentReference = paymentReferenceOf(event);
        String reason = event.text("reason");
        Optional<Booking> booking = paymentReference == null
                ? Optional.empty()
                : bookingService.flagDispute(paymentReference, reason);

        escalationService.escalate(IssueType.PAYMENT_DISPUTED, event.id(), paymentReference,
                booking.map(Booking::getEventId).orElse(null),
                booking.map(Booking::getTableId).orElse(null),
                booking.map(Booking::getId).orElse(null),
                "Dispute opened (" + reason + ") for " + event.amount("amount") + " cents");
        return ReconcileOutcome.DISPUTE_FLAGGED;
    }

    /**
     * Charges and disputes point at their payment intent; intents are their own reference.
     */
    private static String paymentReferenceOf(PaymentGatewayEvent event) {
        if (event.type().startsWith("payment_intent.")) {
            return event.text("id");
        }
        return event.text("payment_intent");
    }
}
