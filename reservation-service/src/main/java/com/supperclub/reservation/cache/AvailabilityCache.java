package com.supperclub.reservation.cache;

import com.supperclub.reservation.service.AvailabilitySnapshot;

/**
 * Short-lived store of computed availability per event. Read-only derived data:
 * nothing may decide a booking from a cached value.
 */
public interface AvailabilityCache {

    /** Returns null on a miss; expired entries are gone from the store. */
    AvailabilitySnapshot get(Long eventId);

    void put(Long eventId, AvailabilitySnapshot snapshot);

    void invalidate(Long eventId);
}
