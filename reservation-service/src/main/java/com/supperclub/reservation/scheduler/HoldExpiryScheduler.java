package com.supperclub.reservation.scheduler;

import com.supperclub.reservation.service.SeatHoldManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Marks elapsed ACTIVE holds as EXPIRED. Reads already treat them as expired,
 * this keeps the table state and the active-hold unique index tidy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldExpiryScheduler {

    private final SeatHoldManager seatHoldManager;

    @Scheduled(fixedDelayString = "${reservation.hold.sweep-interval:PT2M}", initialDelay = 30_000)
    @SchedulerLock(name = "holdExpirySweep", lockAtMostFor = "1m", lockAtLeastFor = "5s")
    public void expireStaleHolds() {
        try {
            int expired = seatHoldManager.expireStaleHolds();
            if (expired > 0) {
                log.info("Hold sweep expired {} holds", expired);
            }
        } catch (Exception e) {
            log.error("Hold sweep failed", e);
        }
    }
}
