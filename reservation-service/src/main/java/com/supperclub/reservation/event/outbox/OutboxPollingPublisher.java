package com.supperclub.reservation.event.outbox;

import com.supperclub.reservation.config.ReservationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Relays due outbox rows and prunes delivered ones. ShedLock keeps each job on one replica.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxPollingPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxEventPublisher outboxEventPublisher;
    private final ReservationProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${reservation.outbox.poll-interval:PT1S}")
    @SchedulerLock(name = "outboxRelay", lockAtMostFor = "30s", lockAtLeastFor = "500ms")
    @Transactional
    public int relayDueEvents() {
        List<OutboxEvent> due = outboxEventRepository.lockDueEvents(
                LocalDateTime.now(clock), properties.getOutbox().getBatchSize());
        int delivered = 0;
        for (OutboxEvent event : due) {
            if (outboxEventPublisher.publish(event)) {
                delivered++;
            }
        }
        if (delivered < due.size()) {
            log.warn("Outbox relay delivered {}/{} due notifications", delivered, due.size());
        }
        return delivered;
    }

    @Scheduled(cron = "${reservation.outbox.cleanup-cron:0 0 4 * * *}")
    @SchedulerLock(name = "outboxCleanup", lockAtMostFor = "5m", lockAtLeastFor = "1m")
    @Transactional
    public int purgeDelivered() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getOutbox().getRetention());
        int deleted = outboxEventRepository.deleteByStatusAndPublishedAtBefore(
                OutboxEvent.OutboxStatus.PUBLISHED, cutoff);
        if (deleted > 0) {
            log.info("Purged {} delivered notifications published before {}", deleted, cutoff);
        }
        return deleted;
    }
}
