package com.supperclub.reservation.payment;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.config.ReservationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Verifies {@code t=<unix seconds>,v1=<hex hmac>} signature headers. The HMAC-SHA256
 * is computed over {@code "<t>.<raw payload>"} with the shared signing secret.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final String signingSecret;
    private final Duration tolerance;
    private final Clock clock;

    public WebhookSignatureVerifier(ReservationProperties properties, Clock clock) {
        this.signingSecret = properties.getWebhook().getSigningSecret();
        this.tolerance = properties.getWebhook().getTolerance();
        this.clock = clock;
    }

    public void verify(String payload, String signatureHeader) {
        if (signingSecret == null || signingSecret.isBlank()) {
            log.error("Webhook signing secret is not configured; rejecting delivery");
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "Webhook signing is not configured");
        }
        if (payload == null || signatureHeader == null || signatureHeader.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "Missing signature");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split(",")) {
            String[] kv = part.trim().split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            if ("t".equals(kv[0])) {
                timestamp = parseTimestamp(kv[1]);
            } else if ("v1".equals(kv[0])) {
                signatures.add(kv[1]);
            }
        }
        if (timestamp == null || signatures.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "Malformed signature header");
        }

        long age = Math.abs(clock.instant().getEpochSecond() - timestamp);
        if (age > tolerance.getSeconds()) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "Signature timestamp outside tolerance");
        }

        byte[] expected = hmac(timestamp + "." + payload);
        for (String candidate : signatures) {
            byte[] actual;
            try {
                actual = HexFormat.of().parseHex(candidate);
            } catch (IllegalArgumentException e) {
                continue;
            }
            if (MessageDigest.isEqual(expected, actual)) {
                return;
            }
        }
        throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
    }

    /**
     * Builds a header the way the gateway does; used by local tooling and tests.
     */
    public String sign(String payload, long timestampSeconds) {
        return "t=" + timestampSeconds + ",v1=" + HexFormat.of().formatHex(hmac(timestampSeconds + "." + payload));
    }

    private byte[] hmac(String content) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(content.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is mandatory on every JVM
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static Long parseTimestamp(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
