package com.supperclub.reservation.service;

import com.supperclub.reservation.config.ReservationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Triggers {@link DataReconciliationService#reconcile()} on one pod at a time.
 * The Redisson lease expires on its own if the holder dies mid-run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationScheduler {

    static final String LOCK_KEY = "lock:reconciliation";

    private final DataReconciliationService reconciliationService;
    private final RedissonClient redissonClient;
    private final ReservationProperties properties;

    @Scheduled(fixedRateString = "${reservation.reconciliation.interval:PT5M}", initialDelayString = "PT1M")
    public void runReconciliation() {
        RLock lock = redissonClient.getLock(LOCK_KEY);
        if (!tryAcquire(lock)) {
            return;
        }
        try {
            ReconciliationReport report = reconciliationService.reconcile();
            if (report.clean()) {
                log.info("RECONCILE: done, {}", report);
            } else {
                log.warn("RECONCILE: finished with failed checks {}, {}", report.failedChecks(), report);
            }
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private boolean tryAcquire(RLock lock) {
        long leaseMillis = properties.getReconciliation().getLockLease().toMillis();
        try {
            if (lock.tryLock(0, leaseMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.debug("RECONCILE: lock held by another pod, skipping this run");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("RECONCILE: interrupted while acquiring lock");
        }
        return false;
    }
}
