package com.supperclub.reservation.service;

import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.domain.SeatHold;
import com.supperclub.reservation.domain.VenueEvent;
import com.supperclub.reservation.domain.VenueTable;
import com.supperclub.reservation.dto.request.CreateHoldRequest;
import com.supperclub.reservation.dto.response.HoldResponse;
import com.supperclub.reservation.repository.VenueEventRepository;
import com.supperclub.reservation.repository.VenueTableRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Guest-facing hold flow. Must stay non-transactional: the hold insert commits on
 * its own and a lost unique-index race comes back as a null token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatHoldService {

    private final VenueEventRepository eventRepository;
    private final VenueTableRepository tableRepository;
    private final BookingValidator bookingValidator;
    private final SeatHoldManager seatHoldManager;
    private final Clock clock;

    public HoldResponse createHold(CreateHoldRequest request, String userId) {
        VenueEvent event = eventRepository.findById(request.eventId())
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
        if (event.isTicketOnly()) {
            throw new BusinessException(ErrorCode.TICKET_ONLY_EVENT,
                    "Event " + event.getId() + " sells pooled tickets; there is no table to hold");
        }
        VenueTable table = tableRepository.findById(request.tableId())
                .filter(t -> t.getVenueId().equals(event.getVenueId()))
                .orElseThrow(() -> new BusinessException(ErrorCode.TABLE_NOT_FOUND));

        if (!bookingValidator.withinTicketCutoff(event.getEventDate())) {
            throw new BusinessException(ErrorCode.TICKET_SALES_CLOSED);
        }
        if (request.seatNumbers().size() > table.getCapacity()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Table " + table.getTableNumber() + " seats at most " + table.getCapacity());
        }
        if (!bookingValidator.noDuplicateBooking(userId, event.getId())) {
            throw new BusinessException(ErrorCode.DUPLICATE_BOOKING);
        }

        seatHoldManager.expireStaleHolds(event.getId(), table.getId());
        if (!bookingValidator.tableAvailableForBooking(table.getId(), event.getId())) {
            throw new BusinessException(ErrorCode.TABLE_UNAVAILABLE);
        }

        String lockToken = seatHoldManager.createHold(
                event.getId(), table.getId(), request.seatNumbers(), userId, request.sessionId());
        if (lockToken == null) {
            // lost the insert race, or storage failed
            if (!bookingValidator.tableAvailableForBooking(table.getId(), event.getId())) {
                throw new BusinessException(ErrorCode.TABLE_UNAVAILABLE);
            }
            throw new BusinessException(ErrorCode.HOLD_FAILED);
        }

        SeatHold hold = seatHoldManager.findHold(lockToken)
                .orElseThrow(() -> new BusinessException(ErrorCode.HOLD_FAILED));
        long expiresInMs = Math.max(0, Duration.between(LocalDateTime.now(clock), hold.getHoldExpiry()).toMillis());
        return new HoldResponse(lockToken, expiresInMs, hold.getHoldExpiry());
    }
}
