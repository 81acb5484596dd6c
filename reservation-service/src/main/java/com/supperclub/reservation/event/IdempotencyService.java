package com.supperclub.reservation.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Deduplicates payment gateway deliveries by event id.
 * The primary key on processed_payment_events decides which concurrent delivery wins.
 * Not transactional itself: each repository call commits on its own so that a lost
 * claim never poisons a caller's transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final ProcessedPaymentEventRepository processedEventRepository;

    public boolean isDuplicate(String eventId) {
        if (eventId == null) {
            return false;
        }
        return processedEventRepository.existsById(eventId);
    }

    /**
     * Returns true if this caller now owns the event and should process it.
     */
    public boolean claim(String eventId, String eventType) {
        if (isDuplicate(eventId)) {
            return false;
        }
        try {
            processedEventRepository.saveAndFlush(new ProcessedPaymentEvent(eventId, eventType));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent claim lost: eventId={}", eventId);
            return false;
        }
    }

    /**
     * Gives the event back so the gateway's redelivery is processed again.
     */
    public void release(String eventId) {
        processedEventRepository.deleteById(eventId);
        log.info("Released payment event claim: eventId={}", eventId);
    }
}
