package com.supperclub.reservation.event;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Gateway event id claimed before processing. Always inserted, never merged, so a
 * second claim for the same id hits the primary key.
 */
@Entity
@Table(name = "processed_payment_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedPaymentEvent implements Persistable<String> {

    @Id
    @Column(length = 100)
    private String eventId;

    @Column(nullable = false, length = 100)
    private String eventType;

    @Column(nullable = false)
    private LocalDateTime processedAt;

    @Transient
    private boolean isNew = true;

    public ProcessedPaymentEvent(String eventId, String eventType) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.processedAt = LocalDateTime.now();
    }

    @Override
    public String getId() {
        return eventId;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }
}
