package com.supperclub.reservation.repository;

import com.supperclub.reservation.domain.Booking;
import com.supperclub.reservation.domain.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    boolean existsByEventIdAndTableIdAndStatusIn(Long eventId, Long tableId, Collection<BookingStatus> statuses);

    List<Booking> findByEventIdAndTableIdAndStatusIn(Long eventId, Long tableId, Collection<BookingStatus> statuses);

    boolean existsByUserIdAndEventIdAndStatusNotIn(String userId, Long eventId, Collection<BookingStatus> statuses);

    Optional<Booking> findByPaymentReference(String paymentReference);
}
