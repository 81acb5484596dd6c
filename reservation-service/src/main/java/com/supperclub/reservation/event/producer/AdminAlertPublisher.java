package com.supperclub.reservation.event.producer;

import com.supperclub.common.event.AdminAlertEvent;
import com.supperclub.common.event.Topics;
import com.supperclub.reservation.domain.ReconciliationIssue;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pages staff about a reconciliation issue. Sent directly rather than through the
 * outbox: the issue row is already the durable record, and the sweep re-alerts
 * every open issue, so a dropped alert is retried there.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminAlertPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    /**
     * @return true once the broker has acknowledged the alert, false if the
     * circuit is open or retries ran out
     */
    @Retry(name = "kafkaProducer")
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "alertUndelivered")
    public boolean alert(ReconciliationIssue issue) {
        AdminAlertEvent event = AdminAlertEvent.of(
                issue.getIssueType().name(), issue.getId(), issue.getPaymentReference(),
                issue.getEventId(), issue.getTableId(), issue.getDetail());
        try {
            kafkaTemplate.send(Topics.ADMIN_ALERT, alertKey(issue), event)
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new AlertDeliveryException(issue, e.getCause());
        } catch (TimeoutException e) {
            throw new AlertDeliveryException(issue, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDeliveryException(issue, e);
        }
        log.warn("Admin alert sent: issueId={}, type={}, paymentReference={}",
                issue.getId(), issue.getIssueType(), issue.getPaymentReference());
        return true;
    }

    @SuppressWarnings("unused")
    boolean alertUndelivered(ReconciliationIssue issue, Throwable t) {
        log.error("Admin alert not delivered, will retry on next sweep: issueId={}, type={}",
                issue.getId(), issue.getIssueType(), t);
        return false;
    }

    /** Alerts for one dinner share a key; issues without an event fall back to the issue id. */
    static String alertKey(ReconciliationIssue issue) {
        Long key = issue.getEventId() != null ? issue.getEventId() : issue.getId();
        return String.valueOf(key);
    }

    static class AlertDeliveryException extends RuntimeException {
        AlertDeliveryException(ReconciliationIssue issue, Throwable cause) {
            super("Alert for issue " + issue.getId() + " not acknowledged", cause);
        }
    }
}
