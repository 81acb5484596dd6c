package com.supperclub.reservation.service;

/**
 * Published inside a booking transaction; counters are rewritten once it commits.
 */
public record AvailabilityChangedEvent(Long eventId) {
}
