package com.supperclub.reservation.service;

import com.supperclub.reservation.jooq.InventoryJooqRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Periodic consistency checks between holds, bookings and stored availability counters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataReconciliationService {

    private final InventoryJooqRepository inventoryRepository;
    private final SeatHoldManager seatHoldManager;
    private final AvailabilityCalculator availabilityCalculator;
    private final EscalationService escalationService;

    /**
     * Runs every check. One failing check does not stop the others.
     */
    public ReconciliationReport reconcile() {
        List<String> failed = new ArrayList<>();
        int holds = runCheck("danglingHolds", this::completeDanglingHolds, failed);
        int synced = runCheck("availability", this::syncAvailability, failed);
        int realerted = runCheck("openIssues", this::realertOpenIssues, failed);
        return new ReconciliationReport(holds, synced, realerted, List.copyOf(failed));
    }

    private static int runCheck(String name, IntSupplier check, List<String> failed) {
        try {
            return check.getAsInt();
        } catch (RuntimeException e) {
            log.error("RECONCILE: check {} failed", name, e);
            failed.add(name);
            return 0;
        }
    }

    /**
     * Holds still ACTIVE although a blocking booking carries their lock token.
     * Happens when settlement committed but the hold completion did not.
     */
    public int completeDanglingHolds() {
        List<String> tokens = inventoryRepository.findDanglingHoldTokens();
        int completed = 0;
        for (String token : tokens) {
            try {
                if (seatHoldManager.completeHold(token)) {
                    completed++;
                }
            } catch (Exception e) {
                log.error("RECONCILE: Failed to complete dangling hold", e);
            }
        }
        if (completed > 0) {
            log.warn("RECONCILE: Completed {} dangling holds", completed);
        }
        return completed;
    }

    /**
     * Rewrites every event's availability counters from its bookings.
     */
    public int syncAvailability() {
        return availabilityCalculator.syncAllEventsAvailability();
    }

    /**
     * Open reconciliation issues are alerted again until someone resolves them.
     */
    public int realertOpenIssues() {
        int realerted = escalationService.realertOpenIssues();
        if (realerted > 0) {
            log.warn("RECONCILE: {} reconciliation issues still open", realerted);
        }
        return realerted;
    }
}
