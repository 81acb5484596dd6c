package com.supperclub.reservation.repository;

import com.supperclub.reservation.domain.SeatHold;
import com.supperclub.reservation.domain.SeatHoldStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface SeatHoldRepository extends JpaRepository<SeatHold, Long> {

    Optional<SeatHold> findByLockToken(String lockToken);

    List<SeatHold> findByEventIdAndTableIdAndStatusAndHoldExpiryGreaterThanEqualOrderByHoldExpiryDesc(
            Long eventId, Long tableId, SeatHoldStatus status, LocalDateTime now);
}
