package com.supperclub.reservation.service;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.TestFixtures;
import com.supperclub.reservation.domain.SeatHold;
import com.supperclub.reservation.domain.VenueEvent;
import com.supperclub.reservation.domain.VenueTable;
import com.supperclub.reservation.dto.request.CreateHoldRequest;
import com.supperclub.reservation.dto.response.HoldResponse;
import com.supperclub.reservation.repository.VenueEventRepository;
import com.supperclub.reservation.repository.VenueTableRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.supperclub.reservation.TestFixtures.EVENT_ID;
import static com.supperclub.reservation.TestFixtures.NOW;
import static com.supperclub.reservation.TestFixtures.TABLE_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeatHoldServiceTest {

    @Mock
    private VenueEventRepository eventRepository;
    @Mock
    private VenueTableRepository tableRepository;
    @Mock
    private BookingValidator bookingValidator;
    @Mock
    private SeatHoldManager seatHoldManager;

    private SeatHoldService service;

    private final VenueEvent event = TestFixtures.tableEvent(EVENT_ID, 40, 10);
    private final VenueTable table = TestFixtures.table(TABLE_ID, 7, 4);
    private final CreateHoldRequest request = new CreateHoldRequest(EVENT_ID, TABLE_ID, List.of(1, 2), "sess-1");

    @BeforeEach
    void setUp() {
        service = new SeatHoldService(eventRepository, tableRepository, bookingValidator,
                seatHoldManager, TestFixtures.fixedClock(NOW));
    }

    @Test
    void createHold_success_returnsTokenAndRemainingTime() {
        stubOpenTable();
        when(bookingValidator.tableAvailableForBooking(TABLE_ID, EVENT_ID)).thenReturn(true);
        when(seatHoldManager.createHold(EVENT_ID, TABLE_ID, List.of(1, 2), "guest-1", "sess-1"))
                .thenReturn("token-1");
        SeatHold hold = TestFixtures.activeHold(1L, EVENT_ID, TABLE_ID, "token-1", NOW, Duration.ofMinutes(20));
        when(seatHoldManager.findHold("token-1")).thenReturn(Optional.of(hold));

        HoldResponse response = service.createHold(request, "guest-1");

        assertThat(response.lockToken()).isEqualTo("token-1");
        assertThat(response.expiresInMs()).isEqualTo(Duration.ofMinutes(20).toMillis());
        assertThat(response.holdExpiry()).isEqualTo(NOW.plusMinutes(20));
        verify(seatHoldManager).expireStaleHolds(EVENT_ID, TABLE_ID);
    }

    @Test
    void createHold_unknownEvent_throwsNotFound() {
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.empty());

        assertError(ErrorCode.EVENT_NOT_FOUND);
    }

    @Test
    void createHold_ticketOnlyEvent_rejectedWithoutHold() {
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(TestFixtures.ticketOnlyEvent(EVENT_ID, 30)));

        assertError(ErrorCode.TICKET_ONLY_EVENT);
        verifyNoInteractions(tableRepository, seatHoldManager);
    }

    @Test
    void createHold_tableFromOtherVenue_throwsNotFound() {
        VenueTable foreign = VenueTable.builder().venueId(99L).tableNumber(1).capacity(4).build();
        TestFixtures.setEntityId(foreign, TABLE_ID);
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(tableRepository.findById(TABLE_ID)).thenReturn(Optional.of(foreign));

        assertError(ErrorCode.TABLE_NOT_FOUND);
    }

    @Test
    void createHold_pastCutoff_throwsSalesClosed() {
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(tableRepository.findById(TABLE_ID)).thenReturn(Optional.of(table));
        when(bookingValidator.withinTicketCutoff(event.getEventDate())).thenReturn(false);

        assertError(ErrorCode.TICKET_SALES_CLOSED);
    }

    @Test
    void createHold_moreSeatsThanTableCapacity_throwsInvalidInput() {
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(tableRepository.findById(TABLE_ID)).thenReturn(Optional.of(table));
        when(bookingValidator.withinTicketCutoff(event.getEventDate())).thenReturn(true);

        CreateHoldRequest tooMany = new CreateHoldRequest(EVENT_ID, TABLE_ID, List.of(1, 2, 3, 4, 5), null);

        assertThatThrownBy(() -> service.createHold(tooMany, "guest-1"))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("seats at most 4");
    }

    @Test
    void createHold_guestAlreadyBooked_throwsDuplicate() {
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(tableRepository.findById(TABLE_ID)).thenReturn(Optional.of(table));
        when(bookingValidator.withinTicketCutoff(event.getEventDate())).thenReturn(true);
        when(bookingValidator.noDuplicateBooking("guest-1", EVENT_ID)).thenReturn(false);

        assertError(ErrorCode.DUPLICATE_BOOKING);
    }

    @Test
    void createHold_tableTaken_throwsUnavailableWithoutInsert() {
        stubOpenTable();
        when(bookingValidator.tableAvailableForBooking(TABLE_ID, EVENT_ID)).thenReturn(false);

        assertError(ErrorCode.TABLE_UNAVAILABLE);
        verify(seatHoldManager, never()).createHold(any(), any(), anyList(), any(), any());
    }

    @Test
    void createHold_lostInsertRace_throwsUnavailable() {
        stubOpenTable();
        when(bookingValidator.tableAvailableForBooking(TABLE_ID, EVENT_ID)).thenReturn(true, false);
        when(seatHoldManager.createHold(EVENT_ID, TABLE_ID, List.of(1, 2), "guest-1", "sess-1")).thenReturn(null);

        assertError(ErrorCode.TABLE_UNAVAILABLE);
    }

    @Test
    void createHold_storageFailure_throwsHoldFailed() {
        stubOpenTable();
        when(bookingValidator.tableAvailableForBooking(TABLE_ID, EVENT_ID)).thenReturn(true, true);
        when(seatHoldManager.createHold(EVENT_ID, TABLE_ID, List.of(1, 2), "guest-1", "sess-1")).thenReturn(null);

        assertError(ErrorCode.HOLD_FAILED);
    }

    private void stubOpenTable() {
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(tableRepository.findById(TABLE_ID)).thenReturn(Optional.of(table));
        when(bookingValidator.withinTicketCutoff(event.getEventDate())).thenReturn(true);
        when(bookingValidator.noDuplicateBooking("guest-1", EVENT_ID)).thenReturn(true);
    }

    private void assertError(ErrorCode expected) {
        assertThatThrownBy(() -> service.createHold(request, "guest-1"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(expected));
    }
}
