package com.supperclub.reservation.service;

import com.supperclub.reservation.config.ReservationProperties;
import com.supperclub.reservation.domain.SeatHold;
import com.supperclub.reservation.domain.SeatHoldStatus;
import com.supperclub.reservation.jooq.InventoryJooqRepository;
import com.supperclub.reservation.repository.SeatHoldRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of short-lived table holds: create, validate, complete, expire.
 * Primitives report outcomes as values; they never throw for expected conditions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatHoldManager {

    private final SeatHoldRepository seatHoldRepository;
    private final InventoryJooqRepository inventoryRepository;
    private final ReservationProperties properties;
    private final Clock clock;

    /**
     * Persists a new ACTIVE hold and returns its lock token, or null when the insert
     * fails (including losing the active-hold unique index to a concurrent caller).
     * Must not run inside a caller's transaction: the insert commits on its own.
     */
    public String createHold(Long eventId, Long tableId, List<Integer> seatNumbers,
                             String ownerId, String sessionId) {
        String lockToken = UUID.randomUUID().toString();
        SeatHold hold = SeatHold.builder()
                .eventId(eventId)
                .tableId(tableId)
                .seatNumbers(seatNumbers)
                .ownerId(ownerId)
                .sessionId(sessionId)
                .lockToken(lockToken)
                .holdStartTime(now())
                .ttl(properties.getHold().getTtl())
                .build();
        try {
            seatHoldRepository.saveAndFlush(hold);
        } catch (DataAccessException e) {
            log.warn("Seat hold not created: eventId={}, tableId={}, cause={}",
                    eventId, tableId, e.getMostSpecificCause().getMessage());
            return null;
        }
        log.info("Seat hold created: eventId={}, tableId={}, expiresAt={}",
                eventId, tableId, hold.getHoldExpiry());
        return lockToken;
    }

    @Transactional
    public HoldCheck checkHold(String lockToken, Long eventId, Long tableId) {
        Optional<SeatHold> found = seatHoldRepository.findByLockToken(lockToken);
        if (found.isEmpty()) {
            return HoldCheck.NOT_FOUND;
        }
        SeatHold hold = found.get();
        // a lapsed hold is flipped whoever asks, before the caller's identity is compared
        if (hold.getStatus() == SeatHoldStatus.ACTIVE && hold.isExpired(now())) {
            hold.expire();
            log.info("Seat hold expired on read: eventId={}, tableId={}",
                    hold.getEventId(), hold.getTableId());
            return HoldCheck.EXPIRED;
        }
        if (!hold.getEventId().equals(eventId) || !hold.getTableId().equals(tableId)) {
            return HoldCheck.MISMATCH;
        }
        if (hold.getStatus() == SeatHoldStatus.EXPIRED) {
            return HoldCheck.EXPIRED;
        }
        if (hold.getStatus() != SeatHoldStatus.ACTIVE) {
            return HoldCheck.INACTIVE;
        }
        return HoldCheck.VALID;
    }

    @Transactional
    public boolean validateHold(String lockToken, Long eventId, Long tableId) {
        return checkHold(lockToken, eventId, tableId) == HoldCheck.VALID;
    }

    /**
     * ACTIVE to COMPLETED. Returns false for an unknown, completed or expired hold,
     * so repeated calls are harmless.
     */
    @Transactional
    public boolean completeHold(String lockToken) {
        return seatHoldRepository.findByLockToken(lockToken)
                .map(hold -> {
                    boolean completed = hold.complete();
                    if (completed) {
                        log.info("Seat hold completed: eventId={}, tableId={}",
                                hold.getEventId(), hold.getTableId());
                    }
                    return completed;
                })
                .orElse(false);
    }

    public boolean isExpired(SeatHold hold, LocalDateTime now) {
        return hold.isExpired(now);
    }

    public int expireStaleHolds() {
        int expired = inventoryRepository.expireStaleHolds(now());
        if (expired > 0) {
            log.info("Expired {} stale seat holds", expired);
        }
        return expired;
    }

    public int expireStaleHolds(Long eventId, Long tableId) {
        return inventoryRepository.expireStaleHolds(eventId, tableId, now());
    }

    public List<SeatHold> getActiveHolds(Long eventId, Long tableId) {
        return seatHoldRepository
                .findByEventIdAndTableIdAndStatusAndHoldExpiryGreaterThanEqualOrderByHoldExpiryDesc(
                        eventId, tableId, SeatHoldStatus.ACTIVE, now());
    }

    public Optional<SeatHold> findHold(String lockToken) {
        return seatHoldRepository.findByLockToken(lockToken);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
