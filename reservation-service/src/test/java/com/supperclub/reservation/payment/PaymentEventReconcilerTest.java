package com.supperclub.reservation.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.TestFixtures;
import com.supperclub.reservation.domain.Booking;
import com.supperclub.reservation.domain.IssueType;
import com.supperclub.reservation.event.IdempotencyService;
import com.supperclub.reservation.service.BookingService;
import com.supperclub.reservation.service.EscalationService;
import com.supperclub.reservation.service.PaidCheckout;
import com.supperclub.reservation.service.SettlementResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.util.Optional;

import static com.supperclub.reservation.TestFixtures.EVENT_ID;
import static com.supperclub.reservation.TestFixtures.TABLE_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentEventReconcilerTest {

    private static final String SIGNATURE = "t=1,v1=00";

    @Mock
    private WebhookSignatureVerifier signatureVerifier;
    @Mock
    private IdempotencyService idempotencyService;
    @Mock
    private BookingService bookingService;
    @Mock
    private EscalationService escalationService;

    private PaymentEventReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new PaymentEventReconciler(signatureVerifier, new PaymentWebhookParser(new ObjectMapper()),
                idempotencyService, bookingService, escalationService);
    }

    @Test
    void paidCheckout_confirmsBooking() {
        when(idempotencyService.claim("evt_1", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);
        Booking booking = TestFixtures.confirmedBooking(1L, EVENT_ID, TABLE_ID, "pi_1");
        when(bookingService.settlePaidCheckout(any(PaidCheckout.class))).thenReturn(SettlementResult.confirmed(booking));

        PaymentEventAck ack = reconciler.handlePaymentEvent(checkoutPayload("evt_1", "paid"), SIGNATURE);

        assertThat(ack.received()).isTrue();
        assertThat(ack.duplicate()).isFalse();
        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.BOOKING_CONFIRMED);
        ArgumentCaptor<PaidCheckout> captor = ArgumentCaptor.forClass(PaidCheckout.class);
        verify(bookingService).settlePaidCheckout(captor.capture());
        assertThat(captor.getValue().paymentReference()).isEqualTo("pi_1");
        assertThat(captor.getValue().tableId()).isEqualTo(TABLE_ID);
        verifyNoInteractions(escalationService);
    }

    @Test
    void redeliveredEvent_isAcknowledgedWithoutProcessing() {
        when(idempotencyService.claim("evt_1", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(false);

        PaymentEventAck ack = reconciler.handlePaymentEvent(checkoutPayload("evt_1", "paid"), SIGNATURE);

        assertThat(ack.duplicate()).isTrue();
        verifyNoInteractions(bookingService, escalationService);
    }

    @Test
    void invalidSignature_rejectedBeforeClaim() {
        doThrow(new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE))
                .when(signatureVerifier).verify(anyString(), eq("bad"));

        assertThatThrownBy(() -> reconciler.handlePaymentEvent(checkoutPayload("evt_1", "paid"), "bad"))
                .isInstanceOf(BusinessException.class);
        verifyNoInteractions(idempotencyService, bookingService);
    }

    @Test
    void sameTablePaidTwice_secondPaymentEscalated() {
        when(idempotencyService.claim("evt_2", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);
        when(bookingService.settlePaidCheckout(any(PaidCheckout.class))).thenReturn(SettlementResult.tableTaken());

        PaymentEventAck ack = reconciler.handlePaymentEvent(checkoutPayload("evt_2", "paid"), SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.ESCALATED);
        verify(escalationService).escalate(eq(IssueType.PAID_UNSEATED), eq("evt_2"), eq("pi_1"),
                eq(EVENT_ID), eq(TABLE_ID), isNull(), contains("already taken"));
    }

    @Test
    void uniqueIndexViolation_treatedAsTableTaken() {
        when(idempotencyService.claim("evt_3", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);
        when(bookingService.settlePaidCheckout(any(PaidCheckout.class)))
                .thenThrow(new DataIntegrityViolationException("uk_bookings_blocking_table"));
        when(bookingService.findByPaymentReference("pi_1")).thenReturn(Optional.empty());

        PaymentEventAck ack = reconciler.handlePaymentEvent(checkoutPayload("evt_3", "paid"), SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.ESCALATED);
        verify(escalationService).escalate(eq(IssueType.PAID_UNSEATED), eq("evt_3"), eq("pi_1"),
                eq(EVENT_ID), eq(TABLE_ID), isNull(), anyString());
        verify(idempotencyService, never()).release(anyString());
    }

    @Test
    void sessionAndIntentRacingOnOnePayment_loserReportedAsDuplicate() {
        when(idempotencyService.claim("evt_14", PaymentGatewayEvent.PAYMENT_SUCCEEDED)).thenReturn(true);
        // the checkout session for pi_14 committed between the lookup and the insert
        when(bookingService.settlePaidCheckout(any(PaidCheckout.class)))
                .thenThrow(new DataIntegrityViolationException("bookings_payment_reference_key"));
        Booking settled = TestFixtures.confirmedBooking(7L, EVENT_ID, TABLE_ID, "pi_14");
        when(bookingService.findByPaymentReference("pi_14")).thenReturn(Optional.of(settled));
        String payload = """
                {"id":"evt_14","type":"payment_intent.succeeded","data":{"object":{
                  "id":"pi_14","amount_received":48000,
                  "metadata":{"eventId":"%d","tableId":"%d","userId":"guest-1","seats":"1,2"}}}}
                """.formatted(EVENT_ID, TABLE_ID);

        PaymentEventAck ack = reconciler.handlePaymentEvent(payload, SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.DUPLICATE_PAYMENT);
        verifyNoInteractions(escalationService);
        verify(idempotencyService, never()).release(anyString());
    }

    @Test
    void ticketOnlyPaymentBeyondCapacity_escalatedWithoutTable() {
        when(idempotencyService.claim("evt_15", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);
        when(bookingService.settlePaidCheckout(any(PaidCheckout.class))).thenReturn(SettlementResult.soldOut());
        String payload = """
                {"id":"evt_15","type":"checkout.session.completed","data":{"object":{
                  "id":"cs_15","payment_intent":"pi_15","payment_status":"paid","amount_total":27000,
                  "metadata":{"eventId":"%d","eventType":"ticket-only","quantity":"3","userId":"guest-1"}}}}
                """.formatted(EVENT_ID);

        PaymentEventAck ack = reconciler.handlePaymentEvent(payload, SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.ESCALATED);
        ArgumentCaptor<PaidCheckout> captor = ArgumentCaptor.forClass(PaidCheckout.class);
        verify(bookingService).settlePaidCheckout(captor.capture());
        assertThat(captor.getValue().tableId()).isNull();
        assertThat(captor.getValue().partySize()).isEqualTo(3);
        verify(escalationService).escalate(eq(IssueType.PAID_UNSEATED), eq("evt_15"), eq("pi_15"),
                eq(EVENT_ID), isNull(), isNull(), contains("tickets remain"));
    }

    @Test
    void sameCheckoutSettledTwice_reportedAsDuplicatePayment() {
        when(idempotencyService.claim("evt_4", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);
        Booking booking = TestFixtures.confirmedBooking(1L, EVENT_ID, TABLE_ID, "pi_1");
        when(bookingService.settlePaidCheckout(any(PaidCheckout.class)))
                .thenReturn(SettlementResult.alreadySettled(booking));

        PaymentEventAck ack = reconciler.handlePaymentEvent(checkoutPayload("evt_4", "paid"), SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.DUPLICATE_PAYMENT);
        verifyNoInteractions(escalationService);
    }

    @Test
    void unpaidCheckout_ignored() {
        when(idempotencyService.claim("evt_5", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);

        PaymentEventAck ack = reconciler.handlePaymentEvent(checkoutPayload("evt_5", "unpaid"), SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.IGNORED);
        verifyNoInteractions(bookingService);
    }

    @Test
    void paymentIntentWithoutReservationMetadata_ignored() {
        when(idempotencyService.claim("evt_6", PaymentGatewayEvent.PAYMENT_SUCCEEDED)).thenReturn(true);
        String payload = """
                {"id":"evt_6","type":"payment_intent.succeeded","data":{"object":{"id":"pi_6","metadata":{}}}}
                """;

        PaymentEventAck ack = reconciler.handlePaymentEvent(payload, SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.IGNORED);
        verifyNoInteractions(bookingService);
    }

    @Test
    void malformedMetadata_escalatedAndAcknowledged() {
        when(idempotencyService.claim("evt_7", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);
        String payload = """
                {"id":"evt_7","type":"checkout.session.completed","data":{"object":{
                  "id":"cs_7","payment_intent":"pi_7","payment_status":"paid",
                  "metadata":{"eventId":"ten","tableId":"100","userId":"guest-1"}}}}
                """;

        PaymentEventAck ack = reconciler.handlePaymentEvent(payload, SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.MALFORMED_METADATA);
        verify(escalationService).escalate(eq(IssueType.MALFORMED_METADATA), eq("evt_7"), eq("pi_7"),
                isNull(), isNull(), isNull(), contains("eventId"));
        verifyNoInteractions(bookingService);
    }

    @Test
    void unknownEventInMetadata_escalatedAsMalformed() {
        when(idempotencyService.claim("evt_8", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);
        when(bookingService.settlePaidCheckout(any(PaidCheckout.class)))
                .thenThrow(new BusinessException(ErrorCode.EVENT_NOT_FOUND));

        PaymentEventAck ack = reconciler.handlePaymentEvent(checkoutPayload("evt_8", "paid"), SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.MALFORMED_METADATA);
        verify(escalationService).escalate(eq(IssueType.MALFORMED_METADATA), eq("evt_8"), eq("pi_1"),
                eq(EVENT_ID), eq(TABLE_ID), isNull(), anyString());
    }

    @Test
    void infrastructureFailure_releasesClaimAndPropagates() {
        when(idempotencyService.claim("evt_9", PaymentGatewayEvent.CHECKOUT_COMPLETED)).thenReturn(true);
        when(bookingService.settlePaidCheckout(any(PaidCheckout.class)))
                .thenThrow(new QueryTimeoutException("database timeout"));

        assertThatThrownBy(() -> reconciler.handlePaymentEvent(checkoutPayload("evt_9", "paid"), SIGNATURE))
                .isInstanceOf(QueryTimeoutException.class);
        verify(idempotencyService).release("evt_9");
    }

    @Test
    void chargeRefunded_marksBookingRefunded() {
        when(idempotencyService.claim("evt_10", PaymentGatewayEvent.CHARGE_REFUNDED)).thenReturn(true);
        Booking booking = TestFixtures.confirmedBooking(1L, EVENT_ID, TABLE_ID, "pi_1");
        booking.refund(48_000L, "re_1");
        when(bookingService.applyRefund("pi_1", 48_000L, "re_1")).thenReturn(Optional.of(booking));
        String payload = """
                {"id":"evt_10","type":"charge.refunded","data":{"object":{
                  "id":"ch_1","payment_intent":"pi_1","amount_refunded":48000,
                  "refunds":{"data":[{"id":"re_1","amount":48000}]}}}}
                """;

        PaymentEventAck ack = reconciler.handlePaymentEvent(payload, SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.REFUNDED);
    }

    @Test
    void refundForUnknownPayment_reportsNotFound() {
        when(idempotencyService.claim("evt_11", PaymentGatewayEvent.PAYMENT_REFUNDED)).thenReturn(true);
        when(bookingService.applyRefund("pi_x", 500L, "pi_x")).thenReturn(Optional.empty());
        String payload = """
                {"id":"evt_11","type":"payment_intent.refunded","data":{"object":{"id":"pi_x","amount":500}}}
                """;

        PaymentEventAck ack = reconciler.handlePaymentEvent(payload, SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.BOOKING_NOT_FOUND);
    }

    @Test
    void dispute_flagsBookingAndEscalates() {
        when(idempotencyService.claim("evt_12", PaymentGatewayEvent.DISPUTE_CREATED)).thenReturn(true);
        Booking booking = TestFixtures.confirmedBooking(1L, EVENT_ID, TABLE_ID, "pi_1");
        when(bookingService.flagDispute("pi_1", "fraudulent")).thenReturn(Optional.of(booking));
        String payload = """
                {"id":"evt_12","type":"charge.dispute.created","data":{"object":{
                  "id":"dp_1","payment_intent":"pi_1","reason":"fraudulent","amount":48000}}}
                """;

        PaymentEventAck ack = reconciler.handlePaymentEvent(payload, SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.DISPUTE_FLAGGED);
        verify(escalationService).escalate(eq(IssueType.PAYMENT_DISPUTED), eq("evt_12"), eq("pi_1"),
                eq(EVENT_ID), eq(TABLE_ID), eq(1L), contains("fraudulent"));
    }

    @Test
    void unhandledType_ignored() {
        when(idempotencyService.claim("evt_13", "customer.created")).thenReturn(true);

        PaymentEventAck ack = reconciler.handlePaymentEvent(
                "{\"id\":\"evt_13\",\"type\":\"customer.created\",\"data\":{\"object\":{\"id\":\"cus_1\"}}}", SIGNATURE);

        assertThat(ack.outcome()).isEqualTo(ReconcileOutcome.IGNORED);
        verifyNoInteractions(bookingService, escalationService);
    }

    private static String checkoutPayload(String eventId, String paymentStatus) {
        return """
                {"id":"%s","type":"checkout.session.completed","data":{"object":{
                  "id":"cs_1","payment_intent":"pi_1","payment_status":"%s","amount_total":48000,
                  "customer_details":{"email":"ana@example.com"},
                  "metadata":{"eventId":"%d","tableId":"%d","userId":"guest-1","seats":"1,2,3,4",
                              "lockToken":"tok-1"}}}}
                """.formatted(eventId, paymentStatus, EVENT_ID, TABLE_ID);
    }
}
