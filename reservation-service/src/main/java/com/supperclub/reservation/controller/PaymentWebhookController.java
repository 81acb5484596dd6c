package com.supperclub.reservation.controller;

import com.supperclub.reservation.payment.PaymentEventAck;
import com.supperclub.reservation.payment.PaymentEventReconciler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway callback endpoint. The body is taken raw so the signature is checked
 * against the exact bytes that were signed.
 */
@Tag(name = "Payment Webhook", description = "Payment gateway event intake")
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentWebhookController {

    public static final String SIGNATURE_HEADER = "Payment-Signature";

    private final PaymentEventReconciler reconciler;

    @Operation(summary = "Receive gateway event", description = "Verify, deduplicate and apply a payment event")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event acknowledged"),
            @ApiResponse(responseCode = "400", description = "Bad signature or payload"),
            @ApiResponse(responseCode = "500", description = "Processing failed; gateway should retry")
    })
    @PostMapping("/webhook")
    public ResponseEntity<PaymentEventAck> receive(
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody String payload) {
        return ResponseEntity.ok(reconciler.handlePaymentEvent(payload, signature));
    }
}
