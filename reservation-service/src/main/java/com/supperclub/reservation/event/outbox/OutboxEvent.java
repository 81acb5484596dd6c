package com.supperclub.reservation.event.outbox;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A booking notification waiting to be relayed to Kafka. Written in the same
 * transaction as the booking change it describes.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    static final Duration MAX_BACKOFF = Duration.ofMinutes(5);
    private static final int ERROR_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long bookingId;

    @Column(nullable = false, length = 40)
    private String eventType;

    @Column(nullable = false, length = 100)
    private String topic;

    @Column(nullable = false, length = 30)
    private String partitionKey;

    @Column(nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OutboxStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(length = ERROR_LENGTH)
    private String lastError;

    @Column(nullable = false)
    private LocalDateTime nextAttemptAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime publishedAt;

    private OutboxEvent(Long bookingId, String eventType, String topic, String partitionKey,
                        String payload, LocalDateTime now) {
        this.bookingId = bookingId;
        this.eventType = eventType;
        this.topic = topic;
        this.partitionKey = partitionKey;
        this.payload = payload;
        this.status = OutboxStatus.PENDING;
        this.createdAt = now;
        this.nextAttemptAt = now;
    }

    public static OutboxEvent pending(Long bookingId, String eventType, String topic,
                                      String partitionKey, String payload, LocalDateTime now) {
        return new OutboxEvent(bookingId, eventType, topic, partitionKey, payload, now);
    }

    public void markPublished(LocalDateTime now) {
        this.status = OutboxStatus.PUBLISHED;
        this.publishedAt = now;
        this.lastError = null;
    }

    /**
     * Records a failed send and schedules the next one.
     *
     * @return true when {@code maxAttempts} is used up and the row is now FAILED
     */
    public boolean recordFailure(String error, LocalDateTime now, int maxAttempts) {
        this.attempts++;
        this.lastError = truncate(error);
        if (attempts >= maxAttempts) {
            this.status = OutboxStatus.FAILED;
            return true;
        }
        this.nextAttemptAt = now.plus(backoff(attempts));
        return false;
    }

    /** 2, 4, 8 ... seconds, capped at {@link #MAX_BACKOFF}. */
    static Duration backoff(int attempts) {
        if (attempts >= 9) {
            return MAX_BACKOFF;
        }
        Duration delay = Duration.ofSeconds(1L << attempts);
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, ERROR_LENGTH);
    }

    public enum OutboxStatus {
        PENDING, PUBLISHED, FAILED
    }
}
