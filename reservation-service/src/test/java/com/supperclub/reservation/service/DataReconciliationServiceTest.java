package com.supperclub.reservation.service;

import com.supperclub.reservation.jooq.InventoryJooqRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataReconciliationServiceTest {

    @Mock
    private InventoryJooqRepository inventoryRepository;
    @Mock
    private SeatHoldManager seatHoldManager;
    @Mock
    private AvailabilityCalculator availabilityCalculator;
    @Mock
    private EscalationService escalationService;

    @InjectMocks
    private DataReconciliationService reconciliationService;

    @Test
    void reconcile_runsEveryCheckAndReportsCounts() {
        when(inventoryRepository.findDanglingHoldTokens()).thenReturn(List.of("t1"));
        when(seatHoldManager.completeHold("t1")).thenReturn(true);
        when(availabilityCalculator.syncAllEventsAvailability()).thenReturn(4);
        when(escalationService.realertOpenIssues()).thenReturn(2);

        ReconciliationReport report = reconciliationService.reconcile();

        assertThat(report).isEqualTo(new ReconciliationReport(1, 4, 2, List.of()));
        assertThat(report.clean()).isTrue();
    }

    @Test
    void reconcile_failingCheck_doesNotStopTheOthers() {
        when(inventoryRepository.findDanglingHoldTokens()).thenThrow(new QueryTimeoutException("slow"));
        when(availabilityCalculator.syncAllEventsAvailability()).thenReturn(3);
        when(escalationService.realertOpenIssues()).thenReturn(0);

        ReconciliationReport report = reconciliationService.reconcile();

        assertThat(report.failedChecks()).containsExactly("danglingHolds");
        assertThat(report.danglingHoldsCompleted()).isZero();
        assertThat(report.eventsSynced()).isEqualTo(3);
        verify(escalationService).realertOpenIssues();
    }

    @Test
    void completeDanglingHolds_oneFailingToken_othersStillCompleted() {
        when(inventoryRepository.findDanglingHoldTokens()).thenReturn(List.of("t1", "t2", "t3"));
        when(seatHoldManager.completeHold("t1")).thenReturn(true);
        when(seatHoldManager.completeHold("t2")).thenThrow(new IllegalStateException("db error"));
        when(seatHoldManager.completeHold("t3")).thenReturn(false);

        assertThat(reconciliationService.completeDanglingHolds()).isEqualTo(1);
        verify(seatHoldManager).completeHold("t3");
    }

    @Test
    void completeDanglingHolds_noneFound_returnsZero() {
        when(inventoryRepository.findDanglingHoldTokens()).thenReturn(List.of());

        assertThat(reconciliationService.completeDanglingHolds()).isZero();
        verifyNoInteractions(seatHoldManager);
    }
}
