package com.supperclub.reservation.service;

import com.supperclub.reservation.MutableClock;
import com.supperclub.reservation.TestFixtures;
import com.supperclub.reservation.config.ReservationProperties;
import com.supperclub.reservation.domain.SeatHoldStatus;
import com.supperclub.reservation.jooq.InventoryJooqRepository;
import com.supperclub.reservation.repository.SeatHoldRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;

import static com.supperclub.reservation.TestFixtures.EVENT_ID;
import static com.supperclub.reservation.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the hold manager through its Spring proxy against H2, so a lazy expiry
 * is checked by reloading the row rather than by inspecting the entity in memory.
 */
@DataJpaTest(properties = {
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.sql.init.mode=never"
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({SeatHoldManager.class, SeatHoldManagerPersistenceTest.ClockConfig.class})
class SeatHoldManagerPersistenceTest {

    @Autowired
    private SeatHoldManager manager;
    @Autowired
    private SeatHoldRepository seatHoldRepository;
    @Autowired
    private MutableClock clock;

    @MockBean
    private InventoryJooqRepository inventoryRepository;

    @Test
    void validateHold_afterTtl_persistsExpiredStatus() {
        String token = manager.createHold(EVENT_ID, 501L, List.of(1, 2), "guest-1", "sess-1");
        clock.advance(Duration.ofMinutes(20).plusSeconds(1));

        assertThat(manager.validateHold(token, EVENT_ID, 501L)).isFalse();

        assertThat(seatHoldRepository.findByLockToken(token))
                .get()
                .extracting(hold -> hold.getStatus())
                .isEqualTo(SeatHoldStatus.EXPIRED);
    }

    @Test
    void validateHold_withinTtl_leavesHoldActive() {
        String token = manager.createHold(EVENT_ID, 502L, List.of(3), "guest-2", null);
        clock.advance(Duration.ofMinutes(19).plusSeconds(59));

        assertThat(manager.validateHold(token, EVENT_ID, 502L)).isTrue();

        assertThat(seatHoldRepository.findByLockToken(token))
                .get()
                .extracting(hold -> hold.getStatus())
                .isEqualTo(SeatHoldStatus.ACTIVE);
    }

    @Test
    void checkHold_lapsedHoldForOtherTable_persistsExpiredStatus() {
        String token = manager.createHold(EVENT_ID, 503L, List.of(1), "guest-3", null);
        clock.advance(Duration.ofMinutes(30));

        assertThat(manager.checkHold(token, EVENT_ID, 999L)).isEqualTo(HoldCheck.EXPIRED);

        assertThat(seatHoldRepository.findByLockToken(token))
                .get()
                .extracting(hold -> hold.getStatus())
                .isEqualTo(SeatHoldStatus.EXPIRED);
    }

    @TestConfiguration
    static class ClockConfig {

        @Bean
        MutableClock clock() {
            return new MutableClock(NOW);
        }

        @Bean
        ReservationProperties reservationProperties() {
            return TestFixtures.defaultProperties();
        }
    }
}
