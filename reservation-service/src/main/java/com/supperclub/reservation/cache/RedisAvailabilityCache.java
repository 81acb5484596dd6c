package com.supperclub.reservation.cache;

import com.supperclub.reservation.service.AvailabilitySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Availability snapshots in the shared Redis cache. Entry lifetime is the cache's TTL,
 * so every service instance sees the same expiry.
 */
@Slf4j
@Component
public class RedisAvailabilityCache implements AvailabilityCache {

    public static final String CACHE_NAME = "availability";

    private final Cache cache;

    public RedisAvailabilityCache(CacheManager cacheManager) {
        Cache resolved = cacheManager.getCache(CACHE_NAME);
        if (resolved == null) {
            throw new IllegalStateException("Cache not configured: " + CACHE_NAME);
        }
        this.cache = resolved;
    }

    @Override
    public AvailabilitySnapshot get(Long eventId) {
        try {
            return cache.get(eventId, AvailabilitySnapshot.class);
        } catch (DataAccessException e) {
            // a cache outage degrades to recomputing from the database
            log.warn("Availability cache read failed: eventId={}, cause={}", eventId, e.getMessage());
            return null;
        }
    }

    @Override
    public void put(Long eventId, AvailabilitySnapshot snapshot) {
        try {
            cache.put(eventId, snapshot);
        } catch (DataAccessException e) {
            log.warn("Availability cache write failed: eventId={}, cause={}", eventId, e.getMessage());
        }
    }

    @Override
    public void invalidate(Long eventId) {
        cache.evict(eventId);
        log.debug("Availability cache evicted: eventId={}", eventId);
    }
}
