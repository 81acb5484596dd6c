package com.supperclub.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Envelope fields shared by every message this system emits.
 * {@code messageId} identifies the message itself so consumers can deduplicate
 * redeliveries; it is unrelated to the dinner event a booking belongs to.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class DomainEvent {

    public static final int SCHEMA_VERSION = 1;

    private String messageId;
    private String eventType;
    private int schemaVersion;
    private Instant occurredAt;

    protected DomainEvent(String eventType, Clock clock) {
        this.messageId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.schemaVersion = SCHEMA_VERSION;
        this.occurredAt = clock.instant();
    }

    protected DomainEvent(String eventType) {
        this(eventType, Clock.systemUTC());
    }
}
